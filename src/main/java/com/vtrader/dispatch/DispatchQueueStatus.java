package com.vtrader.dispatch;

import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the dispatch queue for the admin API. */
@Getter
@Builder
public class DispatchQueueStatus {

    private final int queueLength;
    private final boolean draining;
    private final long totalDispatched;
    private final int requestsInWindow;

    /** Epoch millis of the most recent dispatch, or null if nothing was dispatched yet. */
    private final Long lastDispatchAt;

    private final Long millisSinceLastDispatch;
    private final int maxRequestsPerMinute;
    private final long minIntervalMs;
}
