package com.vtrader.dispatch;

/**
 * Well-known dispatch priorities. Higher values are dispatched first; any int is accepted.
 */
public final class DispatchPriority {

    public static final int DEFAULT = 0;

    /** Coalesced market-data fetches. */
    public static final int QUOTES = 10;

    /** Order placement outranks market data. */
    public static final int ORDERS = 20;

    private DispatchPriority() {}
}
