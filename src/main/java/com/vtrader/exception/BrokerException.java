package com.vtrader.exception;

import java.util.Map;

/**
 * Upstream market-data/broker call failed (network error, 5xx, unreadable payload).
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }

    public BrokerException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, details, cause);
    }
}
