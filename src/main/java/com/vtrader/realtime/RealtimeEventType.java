package com.vtrader.realtime;

/** Event kinds pushed to browser sessions. The wire name is what clients switch on. */
public enum RealtimeEventType {
    CONNECTED("connected"),
    ORDER_PLACED("order_placed"),
    ORDER_EXECUTED("order_executed"),
    ORDER_CANCELLED("order_cancelled"),
    POSITION_OPENED("position_opened"),
    POSITION_UPDATED("position_updated"),
    POSITION_CLOSED("position_closed"),
    BALANCE_UPDATED("balance_updated"),
    WATCHLIST_UPDATED("watchlist_updated"),
    WATCHLIST_ITEM_ADDED("watchlist_item_added"),
    WATCHLIST_ITEM_REMOVED("watchlist_item_removed");

    private final String wireName;

    RealtimeEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
