package com.vtrader.domain.enums;

/** Buy or sell side of an order. Maps to the Vortex {@code transaction_type} field. */
public enum OrderSide {
    BUY,
    SELL
}
