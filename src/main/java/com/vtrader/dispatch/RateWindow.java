package com.vtrader.dispatch;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling log of dispatch timestamps. Mutated only by the drain loop, read by status
 * queries from any thread.
 */
class RateWindow {

    private final Deque<Long> dispatchTimes = new ArrayDeque<>();
    private long lastDispatchAt = -1;

    /** Drops every timestamp {@code t} with {@code t <= now - windowMs}. */
    synchronized void prune(long now, long windowMs) {
        long cutoff = now - windowMs;
        while (!dispatchTimes.isEmpty() && dispatchTimes.peekFirst() <= cutoff) {
            dispatchTimes.pollFirst();
        }
    }

    synchronized void record(long dispatchedAt) {
        dispatchTimes.addLast(dispatchedAt);
        lastDispatchAt = dispatchedAt;
    }

    synchronized int size() {
        return dispatchTimes.size();
    }

    synchronized long oldest() {
        Long first = dispatchTimes.peekFirst();
        return first != null ? first : -1;
    }

    /** Counts timestamps still inside the window without mutating it. */
    synchronized int countAfter(long cutoff) {
        int count = 0;
        for (Long t : dispatchTimes) {
            if (t > cutoff) {
                count++;
            }
        }
        return count;
    }

    synchronized boolean hasDispatched() {
        return lastDispatchAt >= 0;
    }

    synchronized long getLastDispatchAt() {
        return lastDispatchAt;
    }
}
