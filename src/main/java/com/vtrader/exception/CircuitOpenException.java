package com.vtrader.exception;

import java.util.Map;

public class CircuitOpenException extends BaseException {

    public CircuitOpenException(String mode) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, "CIRCUIT_OPEN", Map.of("mode", mode));
    }
}
