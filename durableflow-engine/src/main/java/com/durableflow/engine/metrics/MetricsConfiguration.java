package com.durableflow.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the workflow engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The engine's meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "durableflow");
    }

    @Bean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }
}
