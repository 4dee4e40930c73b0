package com.vtrader.quote;

import com.vtrader.domain.model.Quote;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/**
 * One caller waiting on a batch: the ids it asked for and the future it holds.
 *
 * <p>Settled exactly once, by whichever comes first of the flush outcome and the
 * caller's own timeout. Later attempts are no-ops.
 */
@Getter
class BatchRequest {

    private final List<String> instruments;
    private final String clientId;
    private final long requestedAt;
    private final CompletableFuture<Map<String, Quote>> future = new CompletableFuture<>();
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> timeout;

    BatchRequest(List<String> instruments, String clientId, long requestedAt) {
        this.instruments = Collections.unmodifiableList(instruments);
        this.clientId = clientId;
        this.requestedAt = requestedAt;
    }

    void setTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    boolean isSettled() {
        return settled.get() || future.isDone();
    }

    /** Resolves with the entries of {@code shared} this caller asked for; absent ids are omitted. */
    boolean resolveFrom(Map<String, Quote> shared) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cancelTimeout();
        Map<String, Quote> subset = new LinkedHashMap<>();
        for (String id : instruments) {
            Quote quote = shared.get(id);
            if (quote != null) {
                subset.put(id, quote);
            }
        }
        return future.complete(subset);
    }

    boolean reject(Throwable cause) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cancelTimeout();
        return future.completeExceptionally(cause);
    }

    private void cancelTimeout() {
        ScheduledFuture<?> handle = timeout;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
