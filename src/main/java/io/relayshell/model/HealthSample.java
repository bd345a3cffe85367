package io.relayshell.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One ping round trip plus whatever host metrics the agent reported with it.
 */
public record HealthSample(String serverName, Instant sampledAt, Duration roundTrip, Map<String, Double> metrics) {
    public static final String LOAD_1 = "load1";
    public static final String CPU_COUNT = "cpuCount";
    public static final String MEMORY_USED_PERCENT = "memoryUsedPercent";
    public static final String DISK_USED_PERCENT = "diskUsedPercent";
    public static final String UPTIME_SECONDS = "uptimeSeconds";

    public HealthSample {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public OptionalDouble metric(String key) {
        Double value = metrics.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
