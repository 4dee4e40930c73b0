package com.vtrader.exception;

public class QueueClearedException extends BaseException {

    public QueueClearedException(String requestId) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, "Queue cleared before request " + requestId + " was dispatched");
    }
}
