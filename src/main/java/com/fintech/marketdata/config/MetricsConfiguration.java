package com.fintech.marketdata.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration.
 *
 * Provider calls take tens to hundreds of milliseconds, so timer buckets are
 * set around that range instead of the microsecond defaults.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "market-data-ingestion",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() == Meter.Type.TIMER && id.getName().startsWith("history.fetch")) {
                        return DistributionStatisticConfig.builder()
                            .percentiles(0.5, 0.95, 0.99)
                            .percentilePrecision(2)
                            .serviceLevelObjectives(
                                Duration.ofMillis(50).toNanos(),
                                Duration.ofMillis(100).toNanos(),
                                Duration.ofMillis(250).toNanos(),
                                Duration.ofMillis(500).toNanos(),
                                Duration.ofSeconds(1).toNanos(),
                                Duration.ofSeconds(5).toNanos(),
                                Duration.ofSeconds(25).toNanos()
                            )
                            .percentilesHistogram(true)
                            .expiry(Duration.ofMinutes(2))
                            .bufferLength(3)
                            .build()
                            .merge(config);
                    }
                    return config;
                }
            });
        };
    }

    /**
     * Detect environment from the active profile.
     */
    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
