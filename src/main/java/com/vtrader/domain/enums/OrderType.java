package com.vtrader.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT,
    SL,
    SL_M
}
