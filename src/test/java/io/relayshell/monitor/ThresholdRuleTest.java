package io.relayshell.monitor;

import io.relayshell.model.Alert;
import io.relayshell.model.HealthSample;
import io.relayshell.model.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

final class ThresholdRuleTest {
    @Test
    void firesOnlyAboveLimit() {
        ThresholdRule rule = ThresholdRule.above(HealthSample.MEMORY_USED_PERCENT, 90.0, Severity.WARNING, "memory usage");

        Assertions.assertTrue(rule.evaluate(sample(Map.of(HealthSample.MEMORY_USED_PERCENT, 90.0))).isEmpty());
        Optional<Alert> alert = rule.evaluate(sample(Map.of(HealthSample.MEMORY_USED_PERCENT, 95.5)));

        Assertions.assertTrue(alert.isPresent());
        Assertions.assertEquals(Severity.WARNING, alert.get().severity());
        Assertions.assertEquals("memory usage 95.50 exceeds 90.00", alert.get().message());
        Assertions.assertEquals("box", alert.get().serverName());
    }

    @Test
    void loadIsComparedPerCpu() {
        AlertRule load = ThresholdRule.defaults().get(2);

        Assertions.assertTrue(load.evaluate(sample(Map.of(HealthSample.LOAD_1, 7.0, HealthSample.CPU_COUNT, 4.0))).isEmpty());
        Assertions.assertTrue(load.evaluate(sample(Map.of(HealthSample.LOAD_1, 9.0, HealthSample.CPU_COUNT, 4.0))).isPresent());
        Assertions.assertTrue(load.evaluate(sample(Map.of(HealthSample.LOAD_1, 9.0))).isEmpty());
    }

    @Test
    void missingMetricNeverFires() {
        for (AlertRule rule : ThresholdRule.defaults()) {
            Assertions.assertTrue(rule.evaluate(sample(Map.of())).isEmpty());
        }
    }

    @Test
    void predicateRule() {
        AlertRule slow = AlertRule.when(s -> s.roundTrip().toMillis() > 100L, Severity.INFO, "slow ping");

        Assertions.assertTrue(slow.evaluate(sample(Map.of())).isEmpty());
        HealthSample laggy = new HealthSample("box", Instant.now(), Duration.ofMillis(250), Map.of());
        Assertions.assertEquals("slow ping", slow.evaluate(laggy).orElseThrow().message());
    }

    private static HealthSample sample(Map<String, Double> metrics) {
        return new HealthSample("box", Instant.now(), Duration.ofMillis(5), metrics);
    }
}
