package com.vtrader.event;

/** Persistent record types whose writes are pushed to their owners. */
public enum RecordKind {
    ORDER,
    POSITION,
    TRADING_ACCOUNT,
    WATCHLIST,
    WATCHLIST_ITEM
}
