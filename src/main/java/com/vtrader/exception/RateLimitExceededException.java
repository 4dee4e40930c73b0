package com.vtrader.exception;

import java.util.Map;

/**
 * Upstream answered HTTP 429. Surfaced to the caller as an ordinary failure;
 * nothing in the dispatch path retries it.
 */
public class RateLimitExceededException extends BaseException {

    public RateLimitExceededException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.RATE_LIMITED, message, details, cause);
    }
}
