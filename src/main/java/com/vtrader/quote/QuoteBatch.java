package com.vtrader.quote;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;

/**
 * Callers and the union of their instrument ids for one mode, collected during one window.
 *
 * <p>State moves OPEN, FLUSHING, DONE. Only an OPEN batch accepts callers, and only one
 * thread wins the OPEN to FLUSHING transition, so a batch is flushed at most once no matter
 * how many triggers (timer, cap, manual) race for it.
 */
class QuoteBatch {

    @Getter
    private final String batchId;

    @Getter
    private final String mode;

    @Getter
    private final long startedAt;

    private final Set<String> instruments = new LinkedHashSet<>();
    private final List<BatchRequest> requests = new ArrayList<>();
    private BatchState state = BatchState.OPEN;
    private ScheduledFuture<?> windowTimer;

    QuoteBatch(String batchId, String mode, long startedAt) {
        this.batchId = batchId;
        this.mode = mode;
        this.startedAt = startedAt;
    }

    /** Adds the caller and its ids in one step. False once the batch has started flushing. */
    synchronized boolean tryAdd(BatchRequest request) {
        if (state != BatchState.OPEN) {
            return false;
        }
        instruments.addAll(request.getInstruments());
        requests.add(request);
        return true;
    }

    /** Wins the single OPEN to FLUSHING transition and stops the window timer. */
    synchronized boolean beginFlush() {
        if (state != BatchState.OPEN) {
            return false;
        }
        state = BatchState.FLUSHING;
        if (windowTimer != null) {
            windowTimer.cancel(false);
            windowTimer = null;
        }
        return true;
    }

    synchronized void markDone() {
        state = BatchState.DONE;
    }

    synchronized void setWindowTimer(ScheduledFuture<?> windowTimer) {
        if (state == BatchState.OPEN) {
            this.windowTimer = windowTimer;
        } else {
            windowTimer.cancel(false);
        }
    }

    synchronized BatchState getState() {
        return state;
    }

    synchronized int uniqueInstrumentCount() {
        return instruments.size();
    }

    synchronized List<String> instrumentSnapshot() {
        return new ArrayList<>(instruments);
    }

    synchronized List<BatchRequest> activeRequests() {
        List<BatchRequest> active = new ArrayList<>();
        for (BatchRequest request : requests) {
            if (!request.isSettled()) {
                active.add(request);
            }
        }
        return active;
    }
}
