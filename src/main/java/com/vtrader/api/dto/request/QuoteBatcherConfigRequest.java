package com.vtrader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of the quotes batcher tuning. Omitted fields keep their current value;
 * one out-of-range field rejects the whole update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteBatcherConfigRequest {

    @Min(50)
    @Max(5000)
    private Long windowMs;

    @Min(10)
    @Max(5000)
    private Integer maxUnion;

    @Min(200)
    @Max(30_000)
    private Long requestTimeoutMs;

    @Min(0)
    @Max(5000)
    private Long microCacheTtlMs;

    @Valid
    private CircuitBreakerUpdate circuitBreaker;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CircuitBreakerUpdate {

        @Min(1)
        @Max(50)
        private Integer failureThreshold;

        @Min(1000)
        @Max(60_000)
        private Long halfOpenAfterMs;
    }
}
