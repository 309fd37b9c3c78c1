package com.marketplace.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the service name. The realtime meters themselves live in
 * {@link com.marketplace.observability.RealtimeMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> realtimeCommonTags(
            @Value("${spring.application.name:marketplace-realtime}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
