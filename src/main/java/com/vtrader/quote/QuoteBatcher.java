package com.vtrader.quote;

import com.vtrader.broker.UpstreamClient;
import com.vtrader.config.QuoteBatcherConfig;
import com.vtrader.dispatch.DispatchPriority;
import com.vtrader.dispatch.DispatchQueue;
import com.vtrader.domain.model.Quote;
import com.vtrader.exception.CircuitOpenException;
import com.vtrader.exception.QuoteRequestTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Coalesces concurrent quote lookups into one upstream call per mode and window.
 *
 * <p>Callers arriving within {@code windowMs} of the first caller for a mode join the same
 * {@link QuoteBatch}; the batch fetches the deduplicated union of their ids once and hands
 * every caller only the ids it asked for. A batch flushes when its window timer fires, when
 * its union reaches {@code maxUnion} (the caller that crossed the cap is part of that flush),
 * or on an explicit {@link #manualFlush}.
 *
 * <p>Flush order:
 * <ol>
 *   <li>Nothing to fetch or every caller already timed out: resolve the rest with empty maps.</li>
 *   <li>Circuit open: reject all callers with {@link CircuitOpenException}, no upstream call.</li>
 *   <li>Micro-cache hit for the same mode and union: serve from cache.</li>
 *   <li>Otherwise one {@link DispatchQueue} call at quote priority.</li>
 * </ol>
 *
 * <p>Each caller also carries its own safety timeout ({@code max(200ms, timeoutMs)}). A timed-out
 * caller is rejected alone; the batch and its other callers carry on. A late upstream result
 * for a timed-out caller is discarded.
 */
@Service
public class QuoteBatcher {

    private static final Logger log = LoggerFactory.getLogger(QuoteBatcher.class);

    public static final String DEFAULT_MODE = "ltp";

    private static final String BATCH_ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final QuoteBatcherConfig config;
    private final DispatchQueue dispatchQueue;
    private final UpstreamClient upstreamClient;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, QuoteBatch> batches = new ConcurrentHashMap<>();
    private final QuoteMicroCache microCache;
    private final QuoteCircuitBreaker circuitBreaker;
    private final QuoteBatcherMetrics metrics;

    private volatile FlushMetadata lastFlushMeta;

    public QuoteBatcher(
            QuoteBatcherConfig config,
            DispatchQueue dispatchQueue,
            UpstreamClient upstreamClient,
            @Qualifier("quoteScheduler") ScheduledExecutorService scheduler,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.dispatchQueue = dispatchQueue;
        this.upstreamClient = upstreamClient;
        this.scheduler = scheduler;
        this.clock = clock;
        this.microCache = new QuoteMicroCache(clock);
        this.circuitBreaker = new QuoteCircuitBreaker(config);
        this.metrics = new QuoteBatcherMetrics(meterRegistry);
    }

    public CompletableFuture<Map<String, Quote>> requestQuotes(List<String> instrumentIds, String mode) {
        return requestQuotes(instrumentIds, mode, BatchRequestOptions.NONE);
    }

    /**
     * Joins the open batch for {@code mode} and returns a future for this caller's quotes.
     *
     * <p>Ids are trimmed and blanks dropped; an empty or null list resolves immediately to an
     * empty map. The future fails with {@link QuoteRequestTimeoutException} when this caller's
     * own timeout fires first, with {@link CircuitOpenException} when the circuit is open, or
     * with the upstream failure.
     */
    public CompletableFuture<Map<String, Quote>> requestQuotes(
            List<String> instrumentIds, String mode, BatchRequestOptions options) {
        List<String> ids = normalize(instrumentIds);
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        String normalizedMode = normalizeMode(mode);
        BatchRequestOptions effective = options != null ? options : BatchRequestOptions.NONE;

        BatchRequest request = new BatchRequest(ids, effective.getClientId(), clock.millis());
        long timeoutMs = resolveTimeoutMs(effective.getTimeoutMs());
        request.setTimeout(scheduler.schedule(
                () -> onRequestTimeout(request, normalizedMode, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));

        QuoteBatch batch;
        while (true) {
            batch = batches.computeIfAbsent(normalizedMode, this::openBatch);
            if (batch.tryAdd(request)) {
                break;
            }
            // Lost the race with a flush that has not detached yet.
            batches.remove(normalizedMode, batch);
        }

        int uniqueCount = batch.uniqueInstrumentCount();
        log.debug(
                "Enqueued quotes request into batch: batchId={}, mode={}, clientId={}, reqInstruments={}, "
                        + "uniqueInstruments={}",
                batch.getBatchId(),
                normalizedMode,
                effective.getClientId(),
                ids.size(),
                uniqueCount);

        int maxUnion = config.getMaxUnion();
        if (uniqueCount >= maxUnion) {
            log.warn(
                    "Batch reached max union, flushing: batchId={}, mode={}, uniqueInstruments={}, cap={}",
                    batch.getBatchId(),
                    normalizedMode,
                    uniqueCount,
                    maxUnion);
            flush(batch, BatchFlushReason.MAX_UNION);
        }

        return request.getFuture();
    }

    /**
     * Flushes the open batch for {@code mode} now. The returned future completes once every
     * caller of that batch has been settled; it is already complete if no batch is open.
     */
    public CompletableFuture<Void> manualFlush(String mode) {
        QuoteBatch batch = batches.get(normalizeMode(mode));
        if (batch == null) {
            return CompletableFuture.completedFuture(null);
        }
        return flush(batch, BatchFlushReason.MANUAL);
    }

    public QuoteBatcherState getState() {
        long now = clock.millis();
        Map<String, QuoteBatcherState.ActiveBatch> active = new LinkedHashMap<>();
        for (Map.Entry<String, QuoteBatch> entry : batches.entrySet()) {
            QuoteBatch batch = entry.getValue();
            active.put(
                    entry.getKey(),
                    QuoteBatcherState.ActiveBatch.builder()
                            .batchId(batch.getBatchId())
                            .uniqueInstrumentCount(batch.uniqueInstrumentCount())
                            .requestCount(batch.activeRequests().size())
                            .ageMs(now - batch.getStartedAt())
                            .windowMs(config.getWindowMs())
                            .maxUnion(config.getMaxUnion())
                            .build());
        }
        return QuoteBatcherState.builder()
                .activeBatches(active)
                .lastFlushMeta(lastFlushMeta)
                .metrics(metrics.snapshot())
                .circuitBreaker(circuitBreaker.snapshot())
                .microCacheEntries(microCache.size())
                .config(QuoteBatcherState.ConfigView.builder()
                        .windowMs(config.getWindowMs())
                        .maxUnion(config.getMaxUnion())
                        .requestTimeoutMs(config.getRequestTimeoutMs())
                        .microCacheTtlMs(config.getMicroCacheTtlMs())
                        .failureThreshold(config.getCircuitBreaker().getFailureThreshold())
                        .halfOpenAfterMs(config.getCircuitBreaker().getHalfOpenAfterMs())
                        .build())
                .build();
    }

    private QuoteBatch openBatch(String mode) {
        long windowMs = config.getWindowMs();
        QuoteBatch batch = new QuoteBatch(newBatchId(mode), mode, clock.millis());
        batch.setWindowTimer(
                scheduler.schedule(() -> flush(batch, BatchFlushReason.TIMER), windowMs, TimeUnit.MILLISECONDS));
        log.info(
                "Quotes batch created: batchId={}, mode={}, windowMs={}, maxUnion={}",
                batch.getBatchId(),
                mode,
                windowMs,
                config.getMaxUnion());
        return batch;
    }

    private CompletableFuture<Void> flush(QuoteBatch batch, BatchFlushReason reason) {
        if (!batch.beginFlush()) {
            return CompletableFuture.completedFuture(null);
        }
        // Detach before any work so the next caller opens a fresh batch.
        batches.remove(batch.getMode(), batch);

        try {
            return doFlush(batch, reason);
        } catch (RuntimeException e) {
            log.error("Batch flush aborted: batchId={}, mode={}", batch.getBatchId(), batch.getMode(), e);
            rejectAll(batch.activeRequests(), e);
            batch.markDone();
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> doFlush(QuoteBatch batch, BatchFlushReason reason) {
        String mode = batch.getMode();
        List<String> uniqueIds = batch.instrumentSnapshot();
        List<BatchRequest> activeRequests = batch.activeRequests();
        long flushStartedAt = clock.millis();
        long waitMs = flushStartedAt - batch.getStartedAt();

        if (uniqueIds.isEmpty() || activeRequests.isEmpty()) {
            log.warn(
                    "Batch flush skipped, nothing active: batchId={}, mode={}, reason={}, uniqueInstruments={}, "
                            + "activeRequests={}, waitMs={}",
                    batch.getBatchId(),
                    mode,
                    reason.getWireName(),
                    uniqueIds.size(),
                    activeRequests.size(),
                    waitMs);
            resolveAll(activeRequests, Map.of());
            batch.markDone();
            return CompletableFuture.completedFuture(null);
        }

        log.info(
                "Batch flush start: batchId={}, mode={}, reason={}, reqCount={}, uniqueInstruments={}, waitMs={}",
                batch.getBatchId(),
                mode,
                reason.getWireName(),
                activeRequests.size(),
                uniqueIds.size(),
                waitMs);

        if (!circuitBreaker.tryAcquirePermission()) {
            CircuitOpenException error = new CircuitOpenException(mode);
            metrics.recordCircuitRejection(flushStartedAt);
            log.error(
                    "Batch flush failed: batchId={}, mode={}, reason={}, error={}",
                    batch.getBatchId(),
                    mode,
                    reason.getWireName(),
                    error.getMessage());
            rejectAll(activeRequests, error);
            batch.markDone();
            return CompletableFuture.completedFuture(null);
        }

        long cacheTtlMs = config.getMicroCacheTtlMs();
        List<String> cacheKey = QuoteMicroCache.key(mode, uniqueIds);
        if (cacheTtlMs > 0) {
            Map<String, Quote> cached = microCache.get(cacheKey);
            if (cached != null) {
                circuitBreaker.releasePermission();
                metrics.recordCacheHit();
                metrics.recordServedBatch(activeRequests.size(), uniqueIds.size());
                lastFlushMeta = flushMetadata(batch, reason.cacheHitName(), uniqueIds, activeRequests, 0, waitMs);
                resolveAll(activeRequests, cached);
                log.info("Batch served from micro-cache: batchId={}, mode={}", batch.getBatchId(), mode);
                batch.markDone();
                return CompletableFuture.completedFuture(null);
            }
        }

        return dispatchQueue
                .enqueue(
                        () -> CompletableFuture.completedFuture(upstreamClient.fetchQuotes(uniqueIds, mode)),
                        DispatchPriority.QUOTES,
                        batch.getBatchId())
                // Settle callers on the scheduler: their continuations must not run on the drain thread.
                .handleAsync(
                        (quotes, error) -> {
                            long upstreamMs = clock.millis() - flushStartedAt;
                            if (error != null) {
                                onUpstreamFailure(batch, reason, unwrap(error), upstreamMs);
                            } else {
                                onUpstreamSuccess(batch, reason, uniqueIds, cacheKey, quotes, upstreamMs, waitMs);
                            }
                            batch.markDone();
                            return null;
                        },
                        scheduler);
    }

    private void onUpstreamSuccess(
            QuoteBatch batch,
            BatchFlushReason reason,
            List<String> uniqueIds,
            List<String> cacheKey,
            Map<String, Quote> quotes,
            long upstreamMs,
            long waitMs) {
        Map<String, Quote> shared = withoutNullEntries(quotes);
        circuitBreaker.onSuccess(upstreamMs);
        metrics.recordUpstreamCall();

        long cacheTtlMs = config.getMicroCacheTtlMs();
        if (cacheTtlMs > 0) {
            microCache.put(cacheKey, shared, cacheTtlMs);
        }

        // Re-read: callers may have timed out while the call was in flight.
        List<BatchRequest> stillPending = batch.activeRequests();
        metrics.recordServedBatch(stillPending.size(), uniqueIds.size());
        lastFlushMeta = flushMetadata(batch, reason.getWireName(), uniqueIds, stillPending, upstreamMs, waitMs);
        resolveAll(stillPending, shared);

        log.info(
                "Batch flush complete: batchId={}, mode={}, upstreamMs={}, deliveredRequests={}, returned={}",
                batch.getBatchId(),
                batch.getMode(),
                upstreamMs,
                stillPending.size(),
                shared.size());
    }

    private void onUpstreamFailure(QuoteBatch batch, BatchFlushReason reason, Throwable error, long upstreamMs) {
        metrics.recordUpstreamFailure(clock.millis());
        circuitBreaker.onError(upstreamMs, error);
        log.error(
                "Batch flush failed: batchId={}, mode={}, reason={}, error={}",
                batch.getBatchId(),
                batch.getMode(),
                reason.getWireName(),
                error.getMessage());
        rejectAll(batch.activeRequests(), error);
    }

    private void onRequestTimeout(BatchRequest request, String mode, long timeoutMs) {
        if (request.reject(new QuoteRequestTimeoutException(mode, timeoutMs))) {
            metrics.recordTimeout();
            log.error(
                    "Quotes batcher request timed out: mode={}, clientId={}, timeoutMs={}",
                    mode,
                    request.getClientId(),
                    timeoutMs);
        }
    }

    private FlushMetadata flushMetadata(
            QuoteBatch batch,
            String reason,
            List<String> uniqueIds,
            List<BatchRequest> served,
            long upstreamMs,
            long waitMs) {
        return FlushMetadata.builder()
                .mode(batch.getMode())
                .batchId(batch.getBatchId())
                .reason(reason)
                .uniqueInstrumentCount(uniqueIds.size())
                .requestCount(served.size())
                .upstreamMs(upstreamMs)
                .waitMs(waitMs)
                .timestamp(Instant.now(clock).toString())
                .build();
    }

    private long resolveTimeoutMs(Long requested) {
        long timeoutMs = requested != null && requested > 0 ? requested : config.getRequestTimeoutMs();
        return Math.max(QuoteBatcherConfig.MIN_REQUEST_TIMEOUT_MS, timeoutMs);
    }

    private String newBatchId(String mode) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(BATCH_ID_ALPHABET.charAt(random.nextInt(BATCH_ID_ALPHABET.length())));
        }
        return mode + "-" + clock.millis() + "-" + suffix;
    }

    private static void resolveAll(List<BatchRequest> requests, Map<String, Quote> quotes) {
        for (BatchRequest request : requests) {
            request.resolveFrom(quotes);
        }
    }

    private static void rejectAll(List<BatchRequest> requests, Throwable error) {
        for (BatchRequest request : requests) {
            request.reject(error);
        }
    }

    private static List<String> normalize(List<String> instrumentIds) {
        if (instrumentIds == null) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : instrumentIds) {
            if (id == null) {
                continue;
            }
            String trimmed = id.trim();
            if (!trimmed.isEmpty()) {
                ids.add(trimmed);
            }
        }
        return new ArrayList<>(ids);
    }

    private static String normalizeMode(String mode) {
        return mode == null || mode.isBlank() ? DEFAULT_MODE : mode.trim();
    }

    private static Map<String, Quote> withoutNullEntries(Map<String, Quote> quotes) {
        Map<String, Quote> shared = new LinkedHashMap<>();
        if (quotes != null) {
            quotes.forEach((id, quote) -> {
                if (id != null && quote != null) {
                    shared.put(id, quote);
                }
            });
        }
        return shared;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
