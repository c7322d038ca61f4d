package com.example.changeguard.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация метрик Micrometer.
 */
@Configuration
public class MetricsConfig {

    /**
     * Общий тег application для всех метрик.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:changelog-guard}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
