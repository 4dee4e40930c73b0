package com.vtrader.domain.enums;

/**
 * Lifecycle of an order record. Only the transitions into {@link #EXECUTED} and
 * {@link #CANCELLED} produce realtime events beyond the initial placement.
 */
public enum OrderStatus {
    PENDING,
    EXECUTED,
    CANCELLED,
    REJECTED
}
