package com.vtrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common Micrometer tags for every meter the service publishes.
 *
 * <p>Coalescer meters are defined in {@link com.vtrader.quote.QuoteBatcherMetrics};
 * the dispatch queue registers its own gauge and counters.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "vtrader");
    }
}
