package com.vtrader.api.controller;

import com.vtrader.api.dto.request.ManualFlushRequest;
import com.vtrader.api.dto.request.QuoteBatcherConfigRequest;
import com.vtrader.config.QuoteBatcherConfig;
import com.vtrader.quote.QuoteBatcher;
import com.vtrader.quote.QuoteBatcherState;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the quote coalescer.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/admin/quotes-batcher -- open batches, last flush, counters, circuit and config</li>
 *   <li>POST /api/admin/quotes-batcher/flush -- flushes the open batch of a mode now</li>
 *   <li>PUT /api/admin/quotes-batcher/config -- partial config update, applied to the next batch</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin/quotes-batcher")
public class QuoteBatcherAdminController {

    private static final Logger log = LoggerFactory.getLogger(QuoteBatcherAdminController.class);

    private final QuoteBatcher quoteBatcher;
    private final QuoteBatcherConfig quoteBatcherConfig;

    public QuoteBatcherAdminController(QuoteBatcher quoteBatcher, QuoteBatcherConfig quoteBatcherConfig) {
        this.quoteBatcher = quoteBatcher;
        this.quoteBatcherConfig = quoteBatcherConfig;
    }

    @GetMapping
    public QuoteBatcherState getState() {
        return quoteBatcher.getState();
    }

    @PostMapping("/flush")
    public CompletableFuture<QuoteBatcherState> flush(@RequestBody(required = false) ManualFlushRequest request) {
        String mode = request != null && request.getMode() != null && !request.getMode().isBlank()
                ? request.getMode().trim()
                : QuoteBatcher.DEFAULT_MODE;
        log.info("Manual quote batch flush requested: mode={}", mode);
        return quoteBatcher.manualFlush(mode).thenApply(done -> quoteBatcher.getState());
    }

    @PutMapping("/config")
    public QuoteBatcherState.ConfigView updateConfig(@Valid @RequestBody QuoteBatcherConfigRequest request) {
        quoteBatcherConfig.apply(request);
        return quoteBatcher.getState().getConfig();
    }
}
