package com.vtrader.quote;

import com.vtrader.config.QuoteBatcherConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure circuit breaker guarding the upstream quotes call.
 *
 * <p>Backed by a Resilience4j count-based breaker whose window equals the failure
 * threshold and whose failure-rate threshold is 100%, so it opens exactly when the last
 * {@code failureThreshold} upstream calls all failed. After {@code halfOpenAfterMs} calls
 * are let through again: the first success closes the circuit, the first failure re-opens it.
 *
 * <p>Threshold and cool-down are re-read on every permission check. When either changed,
 * the breaker is rebuilt in CLOSED state.
 */
class QuoteCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(QuoteCircuitBreaker.class);

    private static final String NAME = "vortexQuotes";

    private final QuoteBatcherConfig config;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    private volatile CircuitBreaker delegate;
    private volatile int builtThreshold;
    private volatile long builtHalfOpenAfterMs;

    QuoteCircuitBreaker(QuoteBatcherConfig config) {
        this.config = config;
        rebuild();
    }

    /**
     * False only while the cool-down is running. Once it has elapsed every flush goes
     * through, including those that arrive while the half-open trial call is still in
     * flight; the first recorded outcome closes the circuit or re-opens it.
     */
    boolean tryAcquirePermission() {
        CircuitBreaker breaker = current();
        if (breaker.tryAcquirePermission()) {
            return true;
        }
        return breaker.getState() == CircuitBreaker.State.HALF_OPEN;
    }

    /** Gives back a permission that did not lead to an upstream call (e.g. a cache hit). */
    void releasePermission() {
        current().releasePermission();
    }

    void onSuccess(long durationMs) {
        consecutiveFailures.set(0);
        current().onSuccess(durationMs, TimeUnit.MILLISECONDS);
    }

    void onError(long durationMs, Throwable error) {
        int failures = consecutiveFailures.incrementAndGet();
        CircuitBreaker breaker = current();
        CircuitBreaker.State before = breaker.getState();
        breaker.onError(durationMs, TimeUnit.MILLISECONDS, error);
        if (before != CircuitBreaker.State.OPEN && breaker.getState() == CircuitBreaker.State.OPEN) {
            log.warn(
                    "Circuit opened for quotes batcher: failureCount={}, openForMs={}",
                    failures,
                    builtHalfOpenAfterMs);
        }
    }

    QuoteBatcherState.CircuitView snapshot() {
        CircuitBreaker breaker = current();
        return QuoteBatcherState.CircuitView.builder()
                .state(breaker.getState().name())
                .consecutiveFailures(consecutiveFailures.get())
                .failureThreshold(builtThreshold)
                .halfOpenAfterMs(builtHalfOpenAfterMs)
                .build();
    }

    private CircuitBreaker current() {
        QuoteBatcherConfig.CircuitBreaker settings = config.getCircuitBreaker();
        if (settings.getFailureThreshold() != builtThreshold
                || settings.getHalfOpenAfterMs() != builtHalfOpenAfterMs) {
            synchronized (this) {
                if (settings.getFailureThreshold() != builtThreshold
                        || settings.getHalfOpenAfterMs() != builtHalfOpenAfterMs) {
                    rebuild();
                    log.info(
                            "Quotes circuit breaker rebuilt: failureThreshold={}, halfOpenAfterMs={}",
                            builtThreshold,
                            builtHalfOpenAfterMs);
                }
            }
        }
        return delegate;
    }

    private synchronized void rebuild() {
        int threshold = Math.max(1, config.getCircuitBreaker().getFailureThreshold());
        long halfOpenAfterMs = Math.max(1, config.getCircuitBreaker().getHalfOpenAfterMs());

        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                .waitDurationInOpenState(Duration.ofMillis(halfOpenAfterMs))
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();

        delegate = CircuitBreaker.of(NAME, breakerConfig);
        builtThreshold = config.getCircuitBreaker().getFailureThreshold();
        builtHalfOpenAfterMs = config.getCircuitBreaker().getHalfOpenAfterMs();
        consecutiveFailures.set(0);
    }
}
