package com.vtrader.quote;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Diagnostics snapshot: open batches per mode, the last flush, counters and circuit state. */
@Getter
@Builder
public class QuoteBatcherState {

    private final Map<String, ActiveBatch> activeBatches;
    private final FlushMetadata lastFlushMeta;
    private final Map<String, Long> metrics;
    private final CircuitView circuitBreaker;
    private final int microCacheEntries;
    private final ConfigView config;

    @Getter
    @Builder
    public static class ActiveBatch {
        private final String batchId;
        private final int uniqueInstrumentCount;
        private final int requestCount;
        private final long ageMs;
        private final long windowMs;
        private final int maxUnion;
    }

    @Getter
    @Builder
    public static class CircuitView {
        private final String state;
        private final int consecutiveFailures;
        private final int failureThreshold;
        private final long halfOpenAfterMs;
    }

    @Getter
    @Builder
    public static class ConfigView {
        private final long windowMs;
        private final int maxUnion;
        private final long requestTimeoutMs;
        private final long microCacheTtlMs;
        private final int failureThreshold;
        private final long halfOpenAfterMs;
    }
}
