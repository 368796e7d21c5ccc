package com.alertaggregator.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration.
 *
 * <p>Registers the common {@code application} tag on every meter. The customizer runs before
 * any meter is bound, so the tag also reaches meters registered in service constructors. The
 * alert metrics themselves live in {@link com.alertaggregator.observability.AlertMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags() {
        return registry -> registry.config().commonTags("application", "alert-aggregator");
    }
}
