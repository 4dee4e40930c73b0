package com.vtrader.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Push-stream settings. Binds to {@code vtrader.realtime.*}.
 *
 * <p>The heartbeat is switched off in test runs ({@code heartbeat-enabled=false}) so no
 * background timer outlives a test.
 */
@Configuration
@ConfigurationProperties(prefix = "vtrader.realtime")
@Validated
@Getter
@Setter
public class RealtimeConfig {

    private volatile boolean heartbeatEnabled = true;

    /** Period between keep-alive comment frames. Re-read before every tick. */
    @Min(1000)
    private volatile long heartbeatIntervalMs = 30_000;

    /** Async timeout for one push stream. 0 keeps the stream open until the client leaves. */
    @Min(0)
    private long emitterTimeoutMs = 0;
}
