package io.relayshell.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.relayshell.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-level settings plus the named server profiles.
 *
 * <p>The JSON shape mirrors the operator config file:
 * {@code {servers: {name: {host, port, use_https_disguise, proxy_server}}, default_server,
 * timeout, restart_max_wait, monitoring_interval}}. Durations are given in seconds.
 */
public final class RelayShellConfig {
    public static final String DEFAULT_SERVER = "local";
    public static final int DEFAULT_PORT = 443;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RESTART_MAX_WAIT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_MONITORING_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_PING_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_RECONNECT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 5_000L;
    public static final int DEFAULT_ALERT_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_CONNECT_POOL_CORE = 2;
    public static final int DEFAULT_CONNECT_POOL_MAX = 8;
    public static final int DEFAULT_CONNECT_QUEUE_CAPACITY = 64;
    public static final int DEFAULT_DISPATCH_POOL_SIZE = 8;
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 256;
    public static final Duration DEFAULT_RESULT_CACHE_TTL = Duration.ofSeconds(60);

    private final Map<String, ServerProfile> servers;
    private final String defaultServer;
    private final int alertQueueCapacity;
    private final ReconnectSettings reconnect;
    private final String truststorePath;
    private final String truststorePassword;

    public RelayShellConfig(
            Map<String, ServerProfile> servers,
            String defaultServer,
            int alertQueueCapacity,
            ReconnectSettings reconnect,
            String truststorePath,
            String truststorePassword
    ) {
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        this.defaultServer = defaultServer == null || defaultServer.isBlank() ? DEFAULT_SERVER : defaultServer.trim();
        this.alertQueueCapacity = Math.max(1, alertQueueCapacity);
        this.reconnect = reconnect == null ? ReconnectSettings.defaults() : reconnect;
        this.truststorePath = truststorePath;
        this.truststorePassword = truststorePassword;
    }

    public static RelayShellConfig defaults() {
        Map<String, ServerProfile> servers = new LinkedHashMap<>();
        servers.put(DEFAULT_SERVER, ServerProfile.builder(DEFAULT_SERVER, "127.0.0.1", DEFAULT_PORT).build());
        return new RelayShellConfig(servers, DEFAULT_SERVER, DEFAULT_ALERT_QUEUE_CAPACITY, ReconnectSettings.defaults(), null, null);
    }

    public static RelayShellConfig load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        JsonNode root = Jsons.mapper().readTree(file.toFile());
        return fromJson(root);
    }

    public static RelayShellConfig fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("config root must be a JSON object");
        }
        Duration timeout = seconds(root.path("timeout"), DEFAULT_TIMEOUT);
        Duration restartMaxWait = seconds(root.path("restart_max_wait"), DEFAULT_RESTART_MAX_WAIT);
        Duration monitoringInterval = seconds(root.path("monitoring_interval"), DEFAULT_MONITORING_INTERVAL);

        Map<String, ServerProfile> servers = new LinkedHashMap<>();
        JsonNode serversNode = root.path("servers");
        if (serversNode.isObject()) {
            serversNode.fields().forEachRemaining(entry -> servers.put(
                    entry.getKey(),
                    parseServer(entry.getKey(), entry.getValue(), timeout, restartMaxWait, monitoringInterval)
            ));
        }
        if (servers.isEmpty()) {
            servers.putAll(defaults().servers);
        }
        JsonNode reconnectNode = root.path("reconnect");
        ReconnectSettings defaults = ReconnectSettings.defaults();
        ReconnectSettings reconnect = new ReconnectSettings(
                reconnectNode.path("max_attempts").asInt(defaults.maxAttempts()),
                reconnectNode.path("base_backoff_ms").asLong(defaults.baseBackoffMs()),
                reconnectNode.path("max_backoff_ms").asLong(defaults.maxBackoffMs())
        );
        String truststore = textOrNull(root.path("truststore"));
        String truststorePass = textOrNull(root.path("truststore_password"));
        return new RelayShellConfig(
                servers,
                root.path("default_server").asText(DEFAULT_SERVER),
                root.path("alert_queue_capacity").asInt(DEFAULT_ALERT_QUEUE_CAPACITY),
                reconnect,
                truststore,
                truststorePass
        );
    }

    private static ServerProfile parseServer(
            String name,
            JsonNode node,
            Duration timeout,
            Duration restartMaxWait,
            Duration monitoringInterval
    ) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("server entry must be an object: " + name);
        }
        String host = node.path("host").asText("");
        ServerProfile.Builder builder = ServerProfile.builder(name, host, node.path("port").asInt(DEFAULT_PORT))
                .useHttpsDisguise(node.path("use_https_disguise").asBoolean(true))
                .tls(node.path("tls").asBoolean(true))
                .timeout(seconds(node.path("timeout"), timeout))
                .restartMaxWait(seconds(node.path("restart_max_wait"), restartMaxWait))
                .monitoringInterval(seconds(node.path("monitoring_interval"), monitoringInterval))
                .pingFailureThreshold(node.path("ping_failure_threshold").asInt(DEFAULT_PING_FAILURE_THRESHOLD));
        List<HostAndPort> hops = new ArrayList<>();
        JsonNode single = node.path("proxy_server");
        if (!single.isMissingNode() && !single.isNull()) {
            hops.add(parseHop(single, name));
        }
        JsonNode chain = node.path("proxy_chain");
        if (chain.isArray()) {
            for (JsonNode hop : chain) {
                hops.add(parseHop(hop, name));
            }
        }
        return builder.proxyChain(hops).build();
    }

    // Accepts [host, port] (the historical form) or "host:port".
    private static HostAndPort parseHop(JsonNode node, String serverName) {
        if (node.isArray() && node.size() == 2) {
            return new HostAndPort(node.get(0).asText(""), node.get(1).asInt(-1));
        }
        if (node.isTextual()) {
            return HostAndPort.parse(node.asText());
        }
        throw new IllegalArgumentException("proxy hop must be [host, port] or \"host:port\" for server " + serverName);
    }

    private static Duration seconds(JsonNode node, Duration fallback) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.isNumber()) {
            return fallback;
        }
        return Duration.ofMillis(Math.round(node.asDouble() * 1000.0d));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText("");
        return value.isBlank() ? null : value;
    }

    public Map<String, ServerProfile> servers() {
        return servers;
    }

    public String defaultServer() {
        return defaultServer;
    }

    public Optional<ServerProfile> profile(String name) {
        return Optional.ofNullable(servers.get(name == null || name.isBlank() ? defaultServer : name.trim()));
    }

    public ServerProfile requireProfile(String name) {
        String resolved = name == null || name.isBlank() ? defaultServer : name.trim();
        return profile(resolved).orElseThrow(() -> new IllegalArgumentException("Unknown server: " + resolved));
    }

    public int alertQueueCapacity() {
        return alertQueueCapacity;
    }

    public ReconnectSettings reconnect() {
        return reconnect;
    }

    public String truststorePath() {
        return truststorePath;
    }

    public String truststorePassword() {
        return truststorePassword;
    }

    public record ReconnectSettings(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        public ReconnectSettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("reconnect maxAttempts must be >= 1");
            }
            if (baseBackoffMs < 0L || maxBackoffMs < baseBackoffMs) {
                throw new IllegalArgumentException("reconnect backoff must satisfy 0 <= base <= max");
            }
        }

        public static ReconnectSettings defaults() {
            return new ReconnectSettings(DEFAULT_RECONNECT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF_MS, DEFAULT_MAX_BACKOFF_MS);
        }
    }
}
