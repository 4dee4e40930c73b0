package com.vtrader.quote;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.vtrader.domain.model.Quote;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Very short-lived cache of whole upstream results, keyed by mode and the sorted
 * instrument union. Serves bursts of identical batches (e.g. many tabs polling the same
 * watchlist) without another upstream call. A miss is never an error.
 *
 * <p>Each entry keeps the TTL in force when it was stored, so a TTL change at runtime
 * only affects later writes. Time comes from the injected clock.
 */
class QuoteMicroCache {

    private static final int MAX_ENTRIES = 500;

    private final Cache<List<String>, CachedQuotes> entries;

    QuoteMicroCache(Clock clock) {
        this.entries = Caffeine.newBuilder()
                .expireAfter(Expiry.writing(
                        (List<String> key, CachedQuotes cached) -> Duration.ofMillis(cached.getTtlMs())))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .maximumSize(MAX_ENTRIES)
                .build();
    }

    /** Mode first, then the sorted ids, each as its own element so no id can be mistaken for two. */
    static List<String> key(String mode, List<String> instrumentIds) {
        List<String> sorted = new ArrayList<>(instrumentIds);
        Collections.sort(sorted);
        List<String> key = new ArrayList<>(sorted.size() + 1);
        key.add(mode);
        key.addAll(sorted);
        return List.copyOf(key);
    }

    /** Returns the cached result, or null if absent or expired. */
    Map<String, Quote> get(List<String> key) {
        CachedQuotes cached = entries.getIfPresent(key);
        return cached != null ? cached.getQuotes() : null;
    }

    void put(List<String> key, Map<String, Quote> quotes, long ttlMs) {
        entries.put(key, new CachedQuotes(Map.copyOf(quotes), ttlMs));
    }

    int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }
}
