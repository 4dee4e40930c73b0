package com.vtrader.event;

public enum ChangeAction {
    CREATED,
    UPDATED,
    DELETED
}
