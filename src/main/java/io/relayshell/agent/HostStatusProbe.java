package io.relayshell.agent;

import java.util.Map;

/**
 * Source of the host metrics returned in ping replies. Keys follow
 * {@link io.relayshell.model.HealthSample}.
 */
@FunctionalInterface
public interface HostStatusProbe {
    Map<String, Double> sample();

    static HostStatusProbe system() {
        return new SystemHostStatusProbe();
    }
}
