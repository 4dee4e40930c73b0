package com.vtrader.quote;

/** What triggered a batch flush. The wire name appears in flush metadata and logs. */
public enum BatchFlushReason {
    TIMER("timer"),
    MAX_UNION("max_union"),
    MANUAL("manual");

    private final String wireName;

    BatchFlushReason(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /** Reason recorded when the flush was answered from the micro-cache, e.g. {@code timer_cache_hit}. */
    public String cacheHitName() {
        return wireName + "_cache_hit";
    }
}
