package com.setupbrain.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. The custom counters themselves live in
 * {@link com.setupbrain.observability.CustomMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "setup-brain");
    }
}
