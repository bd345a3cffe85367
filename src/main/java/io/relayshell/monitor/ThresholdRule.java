package io.relayshell.monitor;

import io.relayshell.model.Alert;
import io.relayshell.model.HealthSample;
import io.relayshell.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fires when a reported metric exceeds a limit. With a divisor metric the comparison uses the
 * ratio, e.g. load average per CPU. Samples missing the metric never fire.
 */
public record ThresholdRule(String metric, String divisorMetric, double limit, Severity severity, String label)
        implements AlertRule {

    public static final double DEFAULT_MEMORY_PERCENT = 90.0;
    public static final double DEFAULT_DISK_PERCENT = 90.0;
    public static final double DEFAULT_LOAD_PER_CPU = 2.0;

    public static ThresholdRule above(String metric, double limit, Severity severity, String label) {
        return new ThresholdRule(metric, null, limit, severity, label);
    }

    public static List<AlertRule> defaults() {
        return List.of(
                above(HealthSample.MEMORY_USED_PERCENT, DEFAULT_MEMORY_PERCENT, Severity.WARNING, "memory usage"),
                above(HealthSample.DISK_USED_PERCENT, DEFAULT_DISK_PERCENT, Severity.WARNING, "disk usage"),
                new ThresholdRule(HealthSample.LOAD_1, HealthSample.CPU_COUNT, DEFAULT_LOAD_PER_CPU, Severity.WARNING, "load per cpu")
        );
    }

    @Override
    public Optional<Alert> evaluate(HealthSample sample) {
        OptionalDouble value = sample.metric(metric);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        double observed = value.getAsDouble();
        if (divisorMetric != null) {
            OptionalDouble divisor = sample.metric(divisorMetric);
            if (divisor.isEmpty() || divisor.getAsDouble() <= 0.0) {
                return Optional.empty();
            }
            observed = observed / divisor.getAsDouble();
        }
        if (observed <= limit) {
            return Optional.empty();
        }
        String message = String.format(Locale.ROOT, "%s %.2f exceeds %.2f", label, observed, limit);
        return Optional.of(Alert.now(severity, sample.serverName(), message));
    }
}
