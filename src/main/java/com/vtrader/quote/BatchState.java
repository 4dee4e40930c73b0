package com.vtrader.quote;

/** A batch accepts callers only while OPEN and moves forward exactly once per step. */
enum BatchState {
    OPEN,
    FLUSHING,
    DONE
}
