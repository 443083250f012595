package com.cratedownloads.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter. StatsD export itself is configured through
 * management.statsd.metrics.export.* and only enabled when STATSD_ENABLED=true.
 */
@Configuration
public class MetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(MetricsConfig.class);

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:crate-downloads}") String serviceName,
            @Value("${management.statsd.metrics.export.enabled:false}") boolean statsdEnabled,
            @Value("${management.statsd.metrics.export.host:localhost}") String statsdHost) {
        logger.info("Metrics tagged service={}, StatsD export enabled={} (host={})", serviceName, statsdEnabled, statsdHost);
        return registry -> registry.config().commonTags("service", serviceName);
    }
}
