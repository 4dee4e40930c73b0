package com.vtrader.api.controller;

import com.vtrader.api.dto.response.QueueStatusResponse;
import com.vtrader.dispatch.DispatchQueue;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of the upstream dispatch queue.
 *
 * <p>DELETE rejects every pending call with a queue-cleared error; the call in flight,
 * if any, is not affected.
 */
@RestController
@RequestMapping("/api/admin/queue-status")
public class DispatchQueueAdminController {

    private static final Logger log = LoggerFactory.getLogger(DispatchQueueAdminController.class);

    private final DispatchQueue dispatchQueue;

    public DispatchQueueAdminController(DispatchQueue dispatchQueue) {
        this.dispatchQueue = dispatchQueue;
    }

    @GetMapping
    public QueueStatusResponse getStatus() {
        return QueueStatusResponse.of(dispatchQueue.status());
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        int cleared = dispatchQueue.clear();
        log.info("Dispatch queue cleared by operator: rejected={}", cleared);
        return Map.of("cleared", cleared);
    }
}
