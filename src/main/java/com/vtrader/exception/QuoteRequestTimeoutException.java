package com.vtrader.exception;

import java.util.Map;

/**
 * A single quote caller waited longer than its own safety timeout. Other callers
 * of the same batch are unaffected.
 */
public class QuoteRequestTimeoutException extends BaseException {

    public QuoteRequestTimeoutException(String mode, long timeoutMs) {
        super(ErrorCode.GATEWAY_TIMEOUT, "BATCH_TIMEOUT", Map.of("mode", mode, "timeoutMs", timeoutMs));
    }
}
