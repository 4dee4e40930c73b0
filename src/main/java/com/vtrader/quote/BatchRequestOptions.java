package com.vtrader.quote;

import lombok.Builder;
import lombok.Getter;

/**
 * Per-caller options for {@link QuoteBatcher#requestQuotes}.
 * Both fields are optional.
 */
@Getter
@Builder
public class BatchRequestOptions {

    public static final BatchRequestOptions NONE = BatchRequestOptions.builder().build();

    /** Free-form caller tag for logs. */
    private final String clientId;

    /** Safety timeout for this caller. Null or non-positive uses the configured value; 200ms floor. */
    private final Long timeoutMs;
}
