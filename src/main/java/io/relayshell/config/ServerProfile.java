package io.relayshell.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of how to reach and authenticate to one remote host.
 *
 * <p>Profiles are compared by value; the session registry keys them by {@link #name()}.
 */
public record ServerProfile(
        String name,
        String host,
        int port,
        boolean useHttpsDisguise,
        List<HostAndPort> proxyChain,
        Duration timeout,
        Duration restartMaxWait,
        Duration monitoringInterval,
        boolean tls,
        int pingFailureThreshold
) {
    public ServerProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("profile name cannot be empty");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be empty for profile " + name);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 1-65535 for profile " + name + ": " + port);
        }
        requirePositive(timeout, "timeout", name);
        requirePositive(restartMaxWait, "restartMaxWait", name);
        requirePositive(monitoringInterval, "monitoringInterval", name);
        if (pingFailureThreshold < 1) {
            throw new IllegalArgumentException("pingFailureThreshold must be >= 1 for profile " + name);
        }
        name = name.trim();
        host = host.trim();
        proxyChain = proxyChain == null ? List.of() : List.copyOf(proxyChain);
    }

    public static Builder builder(String name, String host, int port) {
        return new Builder(name, host, port);
    }

    public HostAndPort target() {
        return new HostAndPort(host, port);
    }

    public boolean relayed() {
        return !proxyChain.isEmpty();
    }

    private static void requirePositive(Duration value, String field, String profile) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive for profile " + profile);
        }
    }

    public static final class Builder {
        private final String name;
        private final String host;
        private final int port;
        private boolean useHttpsDisguise = true;
        private final List<HostAndPort> proxyChain = new ArrayList<>();
        private Duration timeout = RelayShellConfig.DEFAULT_TIMEOUT;
        private Duration restartMaxWait = RelayShellConfig.DEFAULT_RESTART_MAX_WAIT;
        private Duration monitoringInterval = RelayShellConfig.DEFAULT_MONITORING_INTERVAL;
        private boolean tls = true;
        private int pingFailureThreshold = RelayShellConfig.DEFAULT_PING_FAILURE_THRESHOLD;

        private Builder(String name, String host, int port) {
            this.name = name;
            this.host = host;
            this.port = port;
        }

        public Builder useHttpsDisguise(boolean value) {
            this.useHttpsDisguise = value;
            return this;
        }

        public Builder proxyHop(String hopHost, int hopPort) {
            this.proxyChain.add(new HostAndPort(hopHost, hopPort));
            return this;
        }

        public Builder proxyChain(List<HostAndPort> hops) {
            this.proxyChain.clear();
            if (hops != null) {
                this.proxyChain.addAll(hops);
            }
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public Builder restartMaxWait(Duration value) {
            this.restartMaxWait = value;
            return this;
        }

        public Builder monitoringInterval(Duration value) {
            this.monitoringInterval = value;
            return this;
        }

        public Builder tls(boolean value) {
            this.tls = value;
            return this;
        }

        public Builder pingFailureThreshold(int value) {
            this.pingFailureThreshold = value;
            return this;
        }

        public ServerProfile build() {
            return new ServerProfile(
                    name,
                    host,
                    port,
                    useHttpsDisguise,
                    proxyChain,
                    timeout,
                    restartMaxWait,
                    monitoringInterval,
                    tls,
                    pingFailureThreshold
            );
        }
    }
}
