package io.relayshell.monitor;

import io.relayshell.model.Alert;
import io.relayshell.model.HealthSample;
import io.relayshell.model.Severity;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Evaluated against every health sample a monitor collects.
 */
@FunctionalInterface
public interface AlertRule {
    Optional<Alert> evaluate(HealthSample sample);

    /**
     * Rule that raises {@code message} whenever {@code condition} holds.
     */
    static AlertRule when(Predicate<HealthSample> condition, Severity severity, String message) {
        return sample -> condition.test(sample)
                ? Optional.of(Alert.now(severity, sample.serverName(), message))
                : Optional.empty();
    }
}
