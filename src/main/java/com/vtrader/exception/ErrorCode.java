package com.vtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    UNAUTHORIZED("UNAUTHORIZED", 401, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    RATE_LIMITED("RATE_LIMITED", 429, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    BROKER_ERROR("BROKER_ERROR", 502, false),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", 503, true),
    GATEWAY_TIMEOUT("GATEWAY_TIMEOUT", 504, true);

    private final String code;
    private final int httpStatus;

    /** Whether a client polling for quotes may simply try again later. */
    private final boolean retryable;
}
