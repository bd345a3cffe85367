package io.relayshell.session;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.AuthFailureException;
import io.relayshell.error.ConnectionLostException;
import io.relayshell.error.ProtocolViolationException;
import io.relayshell.error.RelayShellException;
import io.relayshell.error.RequestTimeoutException;
import io.relayshell.model.Alert;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.model.HealthSample;
import io.relayshell.model.SessionState;
import io.relayshell.model.Severity;
import io.relayshell.security.KeyAuthenticator;
import io.relayshell.transport.BatchRequest;
import io.relayshell.transport.CommandReply;
import io.relayshell.transport.CommandRequest;
import io.relayshell.transport.Connection;
import io.relayshell.transport.Frame;
import io.relayshell.transport.FrameType;
import io.relayshell.transport.TransportChannel;
import io.relayshell.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One authenticated connection to a server profile, healed on demand.
 *
 * <p>Connection work ({@link #ensureReady()}) is serialized per session. Requests may be issued
 * from any number of threads: writes are serialized by the frame stream and a per-connection
 * reader thread completes waiters by correlation id. When the connection breaks, every in-flight
 * request fails with {@link ConnectionLostException} and the session drops back to
 * {@link SessionState#CONNECTING}; the next request reconnects.
 */
public final class Session implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final ServerProfile profile;
    private final TransportChannel channel;
    private final KeyAuthenticator authenticator;
    private final ReconnectPolicy reconnect;
    private final Consumer<Alert> alertSink;
    private final Object connectLock = new Object();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);
    private final AtomicLong lastCorrelationId = new AtomicLong();
    private final Map<Long, CompletableFuture<Frame>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger consecutivePingFailures = new AtomicInteger();
    private volatile Link link;

    public Session(
            ServerProfile profile,
            TransportChannel channel,
            KeyAuthenticator authenticator,
            ReconnectPolicy reconnect,
            Consumer<Alert> alertSink
    ) {
        this.profile = profile;
        this.channel = channel;
        this.authenticator = authenticator;
        this.reconnect = reconnect;
        this.alertSink = alertSink == null ? alert -> { } : alertSink;
    }

    public ServerProfile profile() {
        return profile;
    }

    public String name() {
        return profile.name();
    }

    public SessionState state() {
        return state.get();
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Brings the session to {@link SessionState#READY}, connecting and authenticating with bounded
     * retries if needed. Host-identity and signature failures are not retried.
     */
    public void ensureReady() {
        synchronized (connectLock) {
            SessionState current = state.get();
            if (current.terminal()) {
                throw new ConnectionLostException("session " + name() + " is closed", null);
            }
            Link active = link;
            if (current == SessionState.READY && active != null && !active.closed.get()) {
                return;
            }
            if (current != SessionState.CONNECTING) {
                transition(current, SessionState.CONNECTING);
            }
            RelayShellException last = null;
            for (int attempt = 1; attempt <= reconnect.maxAttempts(); attempt++) {
                if (attempt > 1) {
                    pause(reconnect.backoffMs(attempt - 1));
                }
                try {
                    connectOnce();
                    return;
                } catch (AuthFailureException e) {
                    state.compareAndSet(SessionState.AUTHENTICATING, SessionState.CONNECTING);
                    if (!e.isRetryable()) {
                        log.warn("Authentication to {} rejected: {}", name(), e.getMessage());
                        throw e;
                    }
                    last = e;
                } catch (RelayShellException e) {
                    state.compareAndSet(SessionState.AUTHENTICATING, SessionState.CONNECTING);
                    if (state.get().terminal()) {
                        throw e;
                    }
                    last = e;
                }
                log.info("Connect attempt {}/{} to {} failed: {}", attempt, reconnect.maxAttempts(), name(), last.getMessage());
            }
            throw last;
        }
    }

    public CommandResult execute(Command command) {
        return execute(command.text(), command.timeoutOr(profile.timeout()));
    }

    /**
     * Runs one command and waits for its reply. A non-zero exit code is returned as data.
     *
     * @throws RequestTimeoutException when no reply arrives within {@code timeout}; the request is
     *                                 abandoned locally and the session stays usable
     */
    public CommandResult execute(String text, Duration timeout) {
        long started = System.nanoTime();
        log.debug("Executing on {}: {}", name(), text);
        Frame reply = request(FrameType.COMMAND, new CommandRequest(text, timeout.toMillis()), timeout);
        return toResult(text, reply, elapsedSince(started));
    }

    /**
     * Writes every command in one {@link FrameType#BATCH} frame and collects the replies, which may
     * arrive in any order. The returned list follows submission order; per-command failures are
     * captured in {@link CommandResult#protocolError()}.
     */
    public List<CommandResult> executePipelined(List<Command> commands) {
        long started = System.nanoTime();
        ensureReady();
        Link active = link;
        List<Long> ids = new ArrayList<>(commands.size());
        List<CompletableFuture<Frame>> waiters = new ArrayList<>(commands.size());
        List<BatchRequest.Item> items = new ArrayList<>(commands.size());
        for (Command command : commands) {
            long id = lastCorrelationId.incrementAndGet();
            CompletableFuture<Frame> waiter = new CompletableFuture<>();
            pending.put(id, waiter);
            ids.add(id);
            waiters.add(waiter);
            items.add(new BatchRequest.Item(id, command.text(), command.timeoutOr(profile.timeout()).toMillis()));
        }
        try {
            active.connection.frames().write(Frame.json(FrameType.BATCH, 0L, new BatchRequest(items)));
        } catch (IOException e) {
            ConnectionLostException lost = new ConnectionLostException("connection to " + name() + " lost while sending batch", e);
            ids.forEach(pending::remove);
            onLinkFailure(active, lost);
            throw lost;
        } catch (RuntimeException e) {
            ids.forEach(pending::remove);
            throw e;
        }

        List<CommandResult> results = new ArrayList<>(commands.size());
        for (int i = 0; i < commands.size(); i++) {
            Command command = commands.get(i);
            Duration timeout = command.timeoutOr(profile.timeout());
            long remainingMs = Math.max(0L, timeout.toMillis() - elapsedSince(started).toMillis());
            try {
                Frame reply = await(ids.get(i), waiters.get(i), Duration.ofMillis(remainingMs), timeout);
                results.add(toResult(command.text(), reply, elapsedSince(started)));
            } catch (RelayShellException e) {
                results.add(CommandResult.failed(command.text(), e, elapsedSince(started)));
            }
        }
        return results;
    }

    /**
     * One ping round trip. Consecutive failures reaching the profile's threshold force a reconnect
     * and publish a {@link Severity#WARNING} alert.
     */
    public HealthSample ping(Duration timeout) {
        long started = System.nanoTime();
        try {
            Frame reply = request(FrameType.PING, Map.of(), timeout);
            CommandReply body = decodeReply(reply);
            if (body.failed()) {
                throw new RelayShellException("ping rejected by " + name() + ": " + body.error());
            }
            consecutivePingFailures.set(0);
            return new HealthSample(name(), Instant.now(), elapsedSince(started), body.metrics());
        } catch (RelayShellException e) {
            int failures = consecutivePingFailures.incrementAndGet();
            if (failures >= profile.pingFailureThreshold()) {
                consecutivePingFailures.set(0);
                Link active = link;
                if (active != null) {
                    onLinkFailure(active, new ConnectionLostException("forcing reconnect of " + name() + " after failed pings", e));
                }
                alertSink.accept(Alert.now(Severity.WARNING, name(), "session degraded after " + failures + " failed pings: " + e.getMessage()));
            }
            throw e;
        }
    }

    @Override
    public void close() {
        while (true) {
            SessionState current = state.get();
            if (current.terminal()) {
                return;
            }
            if (state.compareAndSet(current, SessionState.CLOSING)) {
                break;
            }
        }
        Link active = link;
        if (active != null) {
            shutdownLink(active, new ConnectionLostException("session " + name() + " closed", null));
        }
        failPending(new ConnectionLostException("session " + name() + " closed", null));
        state.set(SessionState.CLOSED);
        log.debug("Session {} closed", name());
    }

    private void connectOnce() {
        Connection connection = channel.connect(profile);
        try {
            transition(SessionState.CONNECTING, SessionState.AUTHENTICATING);
            authenticator.authenticate(connection, profile, profile.timeout());
            Link fresh = new Link(connection);
            link = fresh;
            transition(SessionState.AUTHENTICATING, SessionState.READY);
            fresh.reader.start();
            consecutivePingFailures.set(0);
            log.info("Session {} ready via {}", name(), connection.description());
        } catch (RuntimeException e) {
            try {
                connection.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private void transition(SessionState from, SessionState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("illegal session transition " + from + " -> " + to);
        }
        if (!state.compareAndSet(from, to)) {
            throw new ConnectionLostException("session " + name() + " changed state to " + state.get() + " while connecting", null);
        }
    }

    private Frame request(FrameType type, Object body, Duration timeout) {
        ensureReady();
        Link active = link;
        long id = lastCorrelationId.incrementAndGet();
        CompletableFuture<Frame> waiter = new CompletableFuture<>();
        pending.put(id, waiter);
        try {
            active.connection.frames().write(Frame.json(type, id, body));
        } catch (IOException e) {
            pending.remove(id);
            ConnectionLostException lost = new ConnectionLostException("connection to " + name() + " lost while sending", e);
            onLinkFailure(active, lost);
            throw lost;
        } catch (RuntimeException e) {
            pending.remove(id);
            throw e;
        }
        return await(id, waiter, timeout, timeout);
    }

    private Frame await(long id, CompletableFuture<Frame> waiter, Duration wait, Duration reported) {
        try {
            return waiter.get(Math.max(1L, wait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(id);
            throw new RequestTimeoutException(RequestTimeoutException.Phase.COMMAND, reported, "no reply from " + name() + " for request " + id);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RelayShellException failure) {
                throw failure;
            }
            throw new RelayShellException("request " + id + " to " + name() + " failed", e.getCause());
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw new RelayShellException("interrupted waiting for " + name(), e);
        }
    }

    private void readLoop(Link active) {
        try {
            while (!active.closed.get()) {
                Frame frame = active.connection.frames().read();
                if (frame.type() != FrameType.RESPONSE) {
                    throw new ProtocolViolationException(
                            ProtocolViolationException.Reason.MALFORMED,
                            "unexpected " + frame.type() + " frame from " + name()
                    );
                }
                CompletableFuture<Frame> waiter = pending.remove(frame.correlationId());
                if (waiter != null) {
                    waiter.complete(frame);
                } else if (frame.correlationId() > 0L && frame.correlationId() <= lastCorrelationId.get()) {
                    log.debug("Dropping late reply {} from {}", frame.correlationId(), name());
                } else {
                    throw new ProtocolViolationException(
                            ProtocolViolationException.Reason.CORRELATION_MISMATCH,
                            "reply for correlation id " + frame.correlationId() + " that was never issued"
                    );
                }
            }
        } catch (RelayShellException e) {
            onLinkFailure(active, e);
        } catch (IOException e) {
            onLinkFailure(active, new ConnectionLostException("connection to " + name() + " lost", e));
        }
    }

    private void onLinkFailure(Link failed, RelayShellException cause) {
        if (!shutdownLink(failed, cause)) {
            return;
        }
        failPending(cause);
        if (state.compareAndSet(SessionState.READY, SessionState.CONNECTING)) {
            log.warn("Session {} lost its connection ({}); reconnecting on next request", name(), cause.getMessage());
        }
    }

    private boolean shutdownLink(Link target, RelayShellException cause) {
        if (!target.closed.compareAndSet(false, true)) {
            return false;
        }
        try {
            target.connection.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
        return true;
    }

    private void failPending(RelayShellException cause) {
        for (Long id : new ArrayList<>(pending.keySet())) {
            CompletableFuture<Frame> waiter = pending.remove(id);
            if (waiter != null) {
                waiter.completeExceptionally(cause);
            }
        }
    }

    private CommandResult toResult(String text, Frame reply, Duration elapsed) {
        CommandReply body = decodeReply(reply);
        if (body.failed()) {
            return CommandResult.failed(text, new RelayShellException(name() + " could not run command: " + body.error()), elapsed);
        }
        Duration duration = body.durationMs() == null ? elapsed : Duration.ofMillis(body.durationMs());
        int exitCode = body.exitCode() == null ? CommandResult.NO_EXIT_CODE : body.exitCode();
        return CommandResult.completed(text, body.stdout(), body.stderr(), exitCode, duration);
    }

    private CommandReply decodeReply(Frame reply) {
        try {
            return Jsons.fromWireBytes(reply.payload(), CommandReply.class);
        } catch (IOException e) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.DECODE, "unreadable reply from " + name(), e);
        }
    }

    private void pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionLostException("interrupted while reconnecting to " + name(), e);
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private final class Link {
        private final Connection connection;
        private final Thread reader;
        private final AtomicBoolean closed = new AtomicBoolean();

        private Link(Connection connection) {
            this.connection = connection;
            this.reader = new Thread(() -> readLoop(this), "relayshell-reader-" + profile.name());
            this.reader.setDaemon(true);
        }
    }
}
