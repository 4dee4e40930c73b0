package com.vtrader.config;

import com.vtrader.api.dto.request.QuoteBatcherConfigRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the quote request coalescer.
 *
 * <p>Binds to {@code vtrader.quotes.batcher.*}. Every value is read through its getter
 * each time a batch is opened or flushed, never cached by the batcher, so operators can
 * retune a running instance through {@code PUT /api/admin/quotes-batcher/config}.
 *
 * <p>Ranges:
 * <ul>
 *   <li>windowMs: 50..5000</li>
 *   <li>maxUnion: 10..5000 unique instruments per batch</li>
 *   <li>requestTimeoutMs: 200..30000 (200 is also the hard floor per caller)</li>
 *   <li>microCacheTtlMs: 0..5000, 0 disables the micro-cache</li>
 *   <li>circuitBreaker.failureThreshold: 1..50 consecutive failures</li>
 *   <li>circuitBreaker.halfOpenAfterMs: 1000..60000</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "vtrader.quotes.batcher")
@Validated
@Getter
@Setter
public class QuoteBatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(QuoteBatcherConfig.class);

    /** Floor applied to every caller's safety timeout regardless of configuration. */
    public static final long MIN_REQUEST_TIMEOUT_MS = 200;

    @Min(50)
    @Max(5000)
    private volatile long windowMs = 1000;

    @Min(10)
    @Max(5000)
    private volatile int maxUnion = 1000;

    @Min(MIN_REQUEST_TIMEOUT_MS)
    @Max(30_000)
    private volatile long requestTimeoutMs = 4000;

    @Min(0)
    @Max(5000)
    private volatile long microCacheTtlMs = 0;

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    /**
     * Merges an already-validated partial update into the live configuration.
     * Null fields keep their current value.
     */
    public synchronized void apply(QuoteBatcherConfigRequest update) {
        if (update.getWindowMs() != null) {
            windowMs = update.getWindowMs();
        }
        if (update.getMaxUnion() != null) {
            maxUnion = update.getMaxUnion();
        }
        if (update.getRequestTimeoutMs() != null) {
            requestTimeoutMs = update.getRequestTimeoutMs();
        }
        if (update.getMicroCacheTtlMs() != null) {
            microCacheTtlMs = update.getMicroCacheTtlMs();
        }
        if (update.getCircuitBreaker() != null) {
            if (update.getCircuitBreaker().getFailureThreshold() != null) {
                circuitBreaker.setFailureThreshold(update.getCircuitBreaker().getFailureThreshold());
            }
            if (update.getCircuitBreaker().getHalfOpenAfterMs() != null) {
                circuitBreaker.setHalfOpenAfterMs(update.getCircuitBreaker().getHalfOpenAfterMs());
            }
        }
        log.info(
                "Quotes batcher config updated: windowMs={}, maxUnion={}, requestTimeoutMs={}, "
                        + "microCacheTtlMs={}, failureThreshold={}, halfOpenAfterMs={}",
                windowMs,
                maxUnion,
                requestTimeoutMs,
                microCacheTtlMs,
                circuitBreaker.getFailureThreshold(),
                circuitBreaker.getHalfOpenAfterMs());
    }

    @Getter
    @Setter
    public static class CircuitBreaker {

        /** Consecutive upstream failures that open the circuit. */
        @Min(1)
        @Max(50)
        private volatile int failureThreshold = 5;

        /** How long the circuit stays open before upstream calls are let through again. */
        @Min(1000)
        @Max(60_000)
        private volatile long halfOpenAfterMs = 10_000;
    }
}
