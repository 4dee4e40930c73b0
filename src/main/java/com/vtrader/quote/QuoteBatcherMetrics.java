package com.vtrader.quote;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer counters for the quote coalescer.
 *
 * <p>Counter names:
 * <ul>
 *   <li>{@code quotes.batcher.batches}: flushed batches that served at least one caller</li>
 *   <li>{@code quotes.batcher.requests}: callers served by those batches</li>
 *   <li>{@code quotes.batcher.instruments}: unique instruments across those batches</li>
 *   <li>{@code quotes.batcher.upstream.calls} / {@code .upstream.failures}</li>
 *   <li>{@code quotes.batcher.cache.hits}</li>
 *   <li>{@code quotes.batcher.timeouts}: callers rejected by their own safety timeout</li>
 *   <li>{@code quotes.batcher.circuit.rejections}: flushes failed fast while the circuit was open</li>
 * </ul>
 */
class QuoteBatcherMetrics {

    private final Counter batches;
    private final Counter requests;
    private final Counter instruments;
    private final Counter upstreamCalls;
    private final Counter upstreamFailures;
    private final Counter cacheHits;
    private final Counter timeouts;
    private final Counter circuitRejections;

    private final AtomicLong lastErrorAt = new AtomicLong(0);

    QuoteBatcherMetrics(MeterRegistry meterRegistry) {
        this.batches = counter(meterRegistry, "quotes.batcher.batches", "Quote batches flushed");
        this.requests = counter(meterRegistry, "quotes.batcher.requests", "Quote callers served by a flush");
        this.instruments = counter(meterRegistry, "quotes.batcher.instruments", "Unique instruments flushed");
        this.upstreamCalls = counter(meterRegistry, "quotes.batcher.upstream.calls", "Successful upstream quote calls");
        this.upstreamFailures =
                counter(meterRegistry, "quotes.batcher.upstream.failures", "Failed upstream quote calls");
        this.cacheHits = counter(meterRegistry, "quotes.batcher.cache.hits", "Batches served from the micro-cache");
        this.timeouts = counter(meterRegistry, "quotes.batcher.timeouts", "Quote callers that timed out");
        this.circuitRejections =
                counter(meterRegistry, "quotes.batcher.circuit.rejections", "Flushes rejected by the open circuit");
    }

    void recordServedBatch(int requestCount, int instrumentCount) {
        batches.increment();
        requests.increment(requestCount);
        instruments.increment(instrumentCount);
    }

    void recordUpstreamCall() {
        upstreamCalls.increment();
    }

    void recordUpstreamFailure(long at) {
        upstreamFailures.increment();
        lastErrorAt.set(at);
    }

    void recordCacheHit() {
        cacheHits.increment();
    }

    void recordTimeout() {
        timeouts.increment();
    }

    void recordCircuitRejection(long at) {
        circuitRejections.increment();
        lastErrorAt.set(at);
    }

    Map<String, Long> snapshot() {
        Map<String, Long> totals = new LinkedHashMap<>();
        totals.put("totalBatches", (long) batches.count());
        totals.put("totalRequests", (long) requests.count());
        totals.put("totalInstruments", (long) instruments.count());
        totals.put("totalUpstreamCalls", (long) upstreamCalls.count());
        totals.put("totalUpstreamFailures", (long) upstreamFailures.count());
        totals.put("totalCacheHits", (long) cacheHits.count());
        totals.put("totalTimeouts", (long) timeouts.count());
        totals.put("totalCircuitRejections", (long) circuitRejections.count());
        totals.put("lastErrorAt", lastErrorAt.get());
        return totals;
    }

    private static Counter counter(MeterRegistry meterRegistry, String name, String description) {
        return Counter.builder(name).description(description).register(meterRegistry);
    }
}
