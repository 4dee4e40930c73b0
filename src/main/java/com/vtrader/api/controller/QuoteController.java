package com.vtrader.api.controller;

import com.vtrader.domain.model.Quote;
import com.vtrader.quote.BatchRequestOptions;
import com.vtrader.quote.QuoteBatcher;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Quote lookups. Every call goes through the {@link QuoteBatcher}, so concurrent callers
 * asking for overlapping instruments share one upstream request.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/quotes?instruments=NSE_EQ-22,NSE_EQ-2885&amp;mode=ltp -- quotes keyed by instrument id;
 *       ids the upstream did not return are absent</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/quotes")
public class QuoteController {

    private static final Logger log = LoggerFactory.getLogger(QuoteController.class);

    private final QuoteBatcher quoteBatcher;

    public QuoteController(QuoteBatcher quoteBatcher) {
        this.quoteBatcher = quoteBatcher;
    }

    @GetMapping
    public CompletableFuture<Map<String, Quote>> getQuotes(
            @RequestParam String instruments,
            @RequestParam(defaultValue = QuoteBatcher.DEFAULT_MODE) String mode,
            @RequestParam(required = false) String clientId,
            @RequestParam(required = false) Long timeoutMs) {
        List<String> instrumentIds = Arrays.asList(instruments.split(","));
        log.debug("Quote lookup: instruments={}, mode={}, clientId={}", instrumentIds.size(), mode, clientId);

        BatchRequestOptions options = BatchRequestOptions.builder()
                .clientId(clientId)
                .timeoutMs(timeoutMs)
                .build();
        return quoteBatcher.requestQuotes(instrumentIds, mode, options);
    }
}
