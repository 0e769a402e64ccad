package io.github.chirino.tracker.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.List;

/**
 * Micrometer configuration for tracker-service metrics.
 *
 * <ul>
 *   <li>http_server_requests_seconds_* - HTTP request metrics
 *   <li>tracker_store_operation_seconds_* - Store operation timing, tagged by operation
 *   <li>mongodb_driver_commands_seconds_* - MongoDB command timing
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    static final String APPLICATION = "tracker-service";

    static final List<String> TIMED_PREFIXES =
            List.of("http.server.requests", "tracker.store.operation", "mongodb.driver.commands");

    /** Store reads and appends are expected to finish within a few round trips. */
    static final Duration[] LATENCY_OBJECTIVES = {
        Duration.ofMillis(5), Duration.ofMillis(25), Duration.ofMillis(100), Duration.ofMillis(500)
    };

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", APPLICATION)));
    }

    @Produces
    @Singleton
    public MeterFilter histogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (!isTimed(id.getName())) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilesHistogram(true)
                        .serviceLevelObjectives(toNanos(LATENCY_OBJECTIVES))
                        .build()
                        .merge(config);
            }
        };
    }

    static boolean isTimed(String meterName) {
        for (String prefix : TIMED_PREFIXES) {
            if (meterName.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static double[] toNanos(Duration[] durations) {
        double[] nanos = new double[durations.length];
        for (int i = 0; i < durations.length; i++) {
            nanos[i] = durations[i].toNanos();
        }
        return nanos;
    }
}
