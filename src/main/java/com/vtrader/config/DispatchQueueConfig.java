package com.vtrader.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Rate budget for every outbound upstream call.
 *
 * <p>Binds to {@code vtrader.dispatch.*}. Values are read by the
 * {@link com.vtrader.dispatch.DispatchQueue} on every loop iteration, so a change
 * (e.g. via actuator env refresh or a test) applies to the next dispatch.
 *
 * <p>Defaults stay well under the Vortex documented limit: 30 requests in any rolling
 * minute, at least one second apart.
 */
@Configuration
@ConfigurationProperties(prefix = "vtrader.dispatch")
@Validated
@Getter
@Setter
public class DispatchQueueConfig {

    /** Maximum dispatches inside one rolling window. */
    @Min(1)
    private volatile int maxRequestsPerMinute = 30;

    /** Minimum spacing between two consecutive dispatches. */
    @Min(0)
    private volatile long minIntervalMs = 1000;

    /** Horizon of the rolling window. */
    @Min(1000)
    private volatile long windowMs = 60_000;
}
