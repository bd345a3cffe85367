package io.relayshell.support;

import io.relayshell.agent.CommandExecutor;
import io.relayshell.agent.HostStatusProbe;
import io.relayshell.agent.RemoteAgentServer;
import io.relayshell.config.RelayShellConfig;
import io.relayshell.config.ServerProfile;
import io.relayshell.model.HealthSample;
import io.relayshell.security.AuthorizedKeys;
import io.relayshell.security.KeyAuthenticator;
import io.relayshell.security.KeyMaterial;
import io.relayshell.security.StaticCredentialSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RemoteAgentServer} on a loopback port plus matching client credentials.
 */
public final class LoopbackAgent implements AutoCloseable {
    public static final String CLIENT_IDENTITY = "tester";
    public static final Map<String, Double> METRICS = Map.of(
            HealthSample.LOAD_1, 0.5,
            HealthSample.CPU_COUNT, 4.0,
            HealthSample.MEMORY_USED_PERCENT, 40.0,
            HealthSample.DISK_USED_PERCENT, 30.0
    );

    private final KeyPair hostKeys = KeyMaterial.generateIdentity();
    private final KeyPair clientKeys = KeyMaterial.generateIdentity();
    private final CommandExecutor executor;
    private final boolean disguise;
    private volatile HostStatusProbe probe = () -> METRICS;
    private volatile RemoteAgentServer server;
    private volatile int port;

    private LoopbackAgent(CommandExecutor executor, boolean disguise) {
        this.executor = executor;
        this.disguise = disguise;
    }

    public static LoopbackAgent start(CommandExecutor executor) {
        return start(executor, false);
    }

    public static LoopbackAgent start(CommandExecutor executor, boolean disguise) {
        LoopbackAgent agent = new LoopbackAgent(executor, disguise);
        agent.listen(0);
        return agent;
    }

    public int port() {
        return port;
    }

    public KeyPair hostKeys() {
        return hostKeys;
    }

    public KeyPair clientKeys() {
        return clientKeys;
    }

    public void probe(HostStatusProbe value) {
        this.probe = value;
    }

    public ServerProfile.Builder profile(String name) {
        return ServerProfile.builder(name, "127.0.0.1", port)
                .tls(false)
                .useHttpsDisguise(disguise)
                .timeout(Duration.ofSeconds(5));
    }

    public StaticCredentialSource credentials(String... profileNames) {
        Map<String, PublicKey> pinned = new LinkedHashMap<>();
        for (String name : profileNames) {
            pinned.put(name, hostKeys.getPublic());
        }
        return new StaticCredentialSource(CLIENT_IDENTITY, clientKeys, pinned);
    }

    public KeyAuthenticator authenticator(String... profileNames) {
        return new KeyAuthenticator(credentials(profileNames));
    }

    public static RelayShellConfig config(ServerProfile... profiles) {
        Map<String, ServerProfile> servers = new LinkedHashMap<>();
        for (ServerProfile profile : profiles) {
            servers.put(profile.name(), profile);
        }
        return new RelayShellConfig(
                servers,
                profiles[0].name(),
                16,
                new RelayShellConfig.ReconnectSettings(2, 50L, 200L),
                null,
                null
        );
    }

    public void disconnectClients() {
        server.disconnectClients();
    }

    public void stop() {
        RemoteAgentServer current = server;
        if (current != null) {
            current.close();
        }
    }

    /**
     * Stops now and listens again on the same port after {@code downtime}, in the background.
     */
    public Thread restartAfter(Duration downtime) {
        stop();
        Thread restarter = new Thread(() -> {
            try {
                Thread.sleep(downtime.toMillis());
                listen(port);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "loopback-agent-restart");
        restarter.setDaemon(true);
        restarter.start();
        return restarter;
    }

    @Override
    public void close() {
        stop();
    }

    private void listen(int requestedPort) {
        AuthorizedKeys authorized = new AuthorizedKeys().authorize(CLIENT_IDENTITY, clientKeys.getPublic());
        RemoteAgentServer fresh = new RemoteAgentServer(
                new RemoteAgentServer.Options("127.0.0.1", requestedPort, disguise, null, 8),
                hostKeys,
                authorized,
                executor,
                () -> probe.sample()
        );
        try {
            fresh.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        server = fresh;
        port = fresh.port();
    }
}
