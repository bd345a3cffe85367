package io.relayshell.runtime;

import io.relayshell.config.RelayShellConfig;
import io.relayshell.config.ServerProfile;
import io.relayshell.dispatch.CommandDispatcher;
import io.relayshell.dispatch.ResultCache;
import io.relayshell.error.RelayShellException;
import io.relayshell.model.Alert;
import io.relayshell.model.BatchMode;
import io.relayshell.model.BatchResult;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.model.SessionState;
import io.relayshell.monitor.AlertQueue;
import io.relayshell.monitor.AlertRule;
import io.relayshell.monitor.Monitor;
import io.relayshell.monitor.ThresholdRule;
import io.relayshell.restart.RestartCoordinator;
import io.relayshell.security.CredentialSource;
import io.relayshell.security.KeyAuthenticator;
import io.relayshell.session.ReconnectPolicy;
import io.relayshell.session.Session;
import io.relayshell.session.SessionRegistry;
import io.relayshell.transport.SocketTransportChannel;
import io.relayshell.transport.TransportChannel;
import io.relayshell.transport.TransportTls;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point that wires transport, authentication, sessions, dispatch, restart handling and
 * monitoring for one configuration. Each runtime owns its own session registry and alert queue.
 */
public final class RelayShellRuntime implements AutoCloseable {
    private final RelayShellConfig config;
    private final AutoCloseable ownedChannel;
    private final AlertQueue alerts;
    private final SessionRegistry registry;
    private final CommandDispatcher dispatcher;
    private final Monitor monitor;

    public RelayShellRuntime(RelayShellConfig config, TransportChannel channel, KeyAuthenticator authenticator) {
        this(config, channel, authenticator, RestartCoordinator.MIN_POLL_INTERVAL, null);
    }

    public RelayShellRuntime(
            RelayShellConfig config,
            TransportChannel channel,
            KeyAuthenticator authenticator,
            Duration restartPollInterval
    ) {
        this(config, channel, authenticator, restartPollInterval, null);
    }

    private RelayShellRuntime(
            RelayShellConfig config,
            TransportChannel channel,
            KeyAuthenticator authenticator,
            Duration restartPollInterval,
            AutoCloseable ownedChannel
    ) {
        this.config = config;
        this.ownedChannel = ownedChannel;
        this.alerts = new AlertQueue(config.alertQueueCapacity());
        ReconnectPolicy reconnect = ReconnectPolicy.from(config.reconnect());
        this.registry = new SessionRegistry(channel, authenticator, reconnect, alerts);
        RestartCoordinator restarts = new RestartCoordinator(
                registry,
                profile -> new Session(profile, channel, authenticator, ReconnectPolicy.singleAttempt(), alerts),
                restartPollInterval
        );
        this.dispatcher = new CommandDispatcher(
                registry,
                restarts,
                RelayShellConfig.DEFAULT_DISPATCH_POOL_SIZE,
                RelayShellConfig.DEFAULT_DISPATCH_QUEUE_CAPACITY,
                new ResultCache(RelayShellConfig.DEFAULT_RESULT_CACHE_TTL)
        );
        this.monitor = new Monitor(registry, alerts, ThresholdRule.defaults());
    }

    /**
     * Builds a runtime on plain sockets, trusting TLS certificates through the configured
     * truststore when one is set.
     */
    public static RelayShellRuntime open(RelayShellConfig config, CredentialSource credentials) {
        SocketTransportChannel channel;
        try {
            channel = new SocketTransportChannel(
                    TransportTls.clientContext(config.truststorePath(), config.truststorePassword(), "PKCS12"),
                    RelayShellConfig.DEFAULT_CONNECT_POOL_CORE,
                    RelayShellConfig.DEFAULT_CONNECT_POOL_MAX,
                    RelayShellConfig.DEFAULT_CONNECT_QUEUE_CAPACITY
            );
        } catch (Exception e) {
            throw new RelayShellException("failed to initialize TLS client context", e);
        }
        return new RelayShellRuntime(
                config,
                channel,
                new KeyAuthenticator(credentials),
                RestartCoordinator.MIN_POLL_INTERVAL,
                channel
        );
    }

    public RelayShellConfig config() {
        return config;
    }

    public ServerProfile profile(String server) {
        return config.requireProfile(server);
    }

    public Session acquireSession(String server) {
        return registry.acquire(profile(server));
    }

    /**
     * Opens the session for {@code server} ahead of the first command, or returns the live one.
     */
    public Session connect(String server) {
        return acquireSession(server);
    }

    /**
     * Closes the session for {@code server} and forgets its cached results. The next command
     * connects again.
     *
     * @return {@code false} if no session was open
     */
    public boolean disconnect(String server) {
        String name = profile(server).name();
        dispatcher.invalidateCache(name);
        return registry.evict(name);
    }

    /**
     * Current state of every open session, keyed by server name.
     */
    public Map<String, SessionState> listSessions() {
        return registry.states();
    }

    public CommandResult execute(String server, String command) {
        return execute(server, Command.of(command));
    }

    public CommandResult execute(String server, Command command) {
        return dispatcher.execute(profile(server), command);
    }

    /**
     * Same as {@link #execute(String, String)} when {@code useCache} is false; otherwise a result
     * for the same command on the same server younger than
     * {@link RelayShellConfig#DEFAULT_RESULT_CACHE_TTL} is returned without contacting the host.
     */
    public CommandResult execute(String server, String command, boolean useCache) {
        Command parsed = Command.of(command);
        return useCache ? dispatcher.executeCached(profile(server), parsed) : dispatcher.execute(profile(server), parsed);
    }

    public BatchResult executeBatch(String server, List<String> commands, BatchMode mode) {
        return dispatcher.executeBatch(profile(server), toCommands(commands), mode);
    }

    public BatchResult executeCommands(String server, List<Command> commands, BatchMode mode) {
        return dispatcher.executeBatch(profile(server), commands, mode);
    }

    public CompletableFuture<CommandResult> executeAsync(String server, Command command) {
        return dispatcher.executeAsync(profile(server), command);
    }

    public CompletableFuture<BatchResult> executeBatchAsync(String server, List<String> commands, BatchMode mode) {
        return dispatcher.executeBatchAsync(profile(server), toCommands(commands), mode);
    }

    public boolean startMonitoring(String server) {
        return monitor.start(profile(server));
    }

    public void stopMonitoring(String server) {
        monitor.stop(config.requireProfile(server).name());
    }

    public void stopAllMonitoring() {
        monitor.stopAll();
    }

    public boolean isMonitoring(String server) {
        return monitor.isRunning(profile(server).name());
    }

    public void addAlertRule(AlertRule rule) {
        monitor.addRule(rule);
    }

    /**
     * Removes and returns the buffered alerts, oldest first.
     */
    public List<Alert> getAlerts() {
        return alerts.drain();
    }

    public long droppedAlerts() {
        return alerts.dropped();
    }

    public SessionRegistry sessions() {
        return registry;
    }

    public Monitor monitor() {
        return monitor;
    }

    public void closeAll() {
        registry.closeAll();
    }

    @Override
    public void close() {
        monitor.stopAll();
        dispatcher.close();
        registry.closeAll();
        if (ownedChannel != null) {
            try {
                ownedChannel.close();
            } catch (Exception e) {
                throw new RelayShellException("failed to close transport", e);
            }
        }
    }

    private static List<Command> toCommands(List<String> commands) {
        List<Command> out = new ArrayList<>(commands.size());
        for (String command : commands) {
            out.add(Command.of(command));
        }
        return out;
    }
}
