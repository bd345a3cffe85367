package io.relayshell.session;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.AuthFailureException;
import io.relayshell.error.ConnectionLostException;
import io.relayshell.error.ProtocolViolationException;
import io.relayshell.error.RequestTimeoutException;
import io.relayshell.model.Alert;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.model.HealthSample;
import io.relayshell.model.SessionState;
import io.relayshell.model.Severity;
import io.relayshell.security.AuthorizedKeys;
import io.relayshell.security.HandshakeResponder;
import io.relayshell.security.KeyAuthenticator;
import io.relayshell.security.KeyMaterial;
import io.relayshell.security.NonceRegistry;
import io.relayshell.security.StaticCredentialSource;
import io.relayshell.support.LoopbackAgent;
import io.relayshell.support.ScriptedExecutor;
import io.relayshell.transport.CommandReply;
import io.relayshell.transport.Connection;
import io.relayshell.transport.Frame;
import io.relayshell.transport.FrameType;
import io.relayshell.transport.PlainEnvelope;
import io.relayshell.transport.SocketTransportChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class SessionTest {
    private ScriptedExecutor executor;
    private LoopbackAgent agent;
    private SocketTransportChannel channel;
    private final List<Alert> alerts = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startAgent() {
        executor = new ScriptedExecutor();
        agent = LoopbackAgent.start(executor);
        channel = new SocketTransportChannel(null);
    }

    @AfterEach
    void stopAgent() {
        channel.close();
        agent.close();
    }

    @Test
    void firstRequestConnectsAndExitCodesAreData() {
        try (Session session = session(agent.profile("box").build())) {
            Assertions.assertEquals(SessionState.DISCONNECTED, session.state());

            CommandResult failed = session.execute("exit 3", Duration.ofSeconds(5));

            Assertions.assertEquals(SessionState.READY, session.state());
            Assertions.assertEquals(3, failed.exitCode());
            Assertions.assertFalse(failed.hasProtocolError());
            Assertions.assertFalse(failed.succeeded());
        }
    }

    @Test
    void timedOutRequestIsAbandonedAndSessionKeepsWorking() throws Exception {
        try (Session session = session(agent.profile("box").build())) {
            RequestTimeoutException timeout = Assertions.assertThrows(
                    RequestTimeoutException.class,
                    () -> session.execute("sleep 800", Duration.ofMillis(200))
            );
            Assertions.assertEquals(RequestTimeoutException.Phase.COMMAND, timeout.phase());

            Assertions.assertEquals("ok\n", session.execute("echo ok", Duration.ofSeconds(5)).stdout());

            // the late reply to the abandoned request arrives and must be ignored
            Thread.sleep(1_000L);
            Assertions.assertEquals(SessionState.READY, session.state());
            Assertions.assertEquals("again\n", session.execute("echo again", Duration.ofSeconds(5)).stdout());
        }
    }

    @Test
    void lostConnectionFailsInFlightRequestsAndHealsOnNextRequest() throws Exception {
        try (Session session = session(agent.profile("box").build())) {
            session.ensureReady();
            CompletableFuture<CommandResult> inFlight = CompletableFuture.supplyAsync(
                    () -> session.execute("sleep 3000", Duration.ofSeconds(10))
            );
            waitUntil(() -> executor.executed() >= 1);

            agent.disconnectClients();

            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> inFlight.get(5, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(ConnectionLostException.class, error.getCause());
            waitUntil(() -> session.state() == SessionState.CONNECTING);

            Assertions.assertEquals("healed\n", session.execute("echo healed", Duration.ofSeconds(5)).stdout());
            Assertions.assertEquals(SessionState.READY, session.state());
        }
    }

    @Test
    void unknownHostIsNotRetried() {
        ServerProfile profile = agent.profile("box").build();
        KeyAuthenticator unpinned = new KeyAuthenticator(
                new StaticCredentialSource(LoopbackAgent.CLIENT_IDENTITY, agent.clientKeys(), Map.of())
        );
        try (Session session = new Session(profile, channel, unpinned, new ReconnectPolicy(5, 2_000L, 5_000L), null)) {
            long started = System.nanoTime();
            AuthFailureException error = Assertions.assertThrows(AuthFailureException.class, session::ensureReady);
            Assertions.assertEquals(AuthFailureException.Reason.UNKNOWN_HOST, error.reason());
            Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 2_000L, "retried an unknown host");
            Assertions.assertEquals(SessionState.CONNECTING, session.state());
        }
    }

    @Test
    void pingReportsAgentMetrics() {
        try (Session session = session(agent.profile("box").build())) {
            HealthSample sample = session.ping(Duration.ofSeconds(5));

            Assertions.assertEquals("box", sample.serverName());
            Assertions.assertEquals(0.5, sample.metric(HealthSample.LOAD_1).orElseThrow());
            Assertions.assertFalse(sample.roundTrip().isNegative());
        }
    }

    @Test
    void repeatedPingFailuresPublishDegradedAlert() throws Exception {
        ServerProfile profile = agent.profile("box").pingFailureThreshold(2).timeout(Duration.ofSeconds(1)).build();
        try (Session session = new Session(profile, channel, agent.authenticator("box"), ReconnectPolicy.singleAttempt(), alerts::add)) {
            session.ping(Duration.ofSeconds(5));
            agent.stop();
            waitUntil(() -> session.state() == SessionState.CONNECTING);

            Assertions.assertThrows(RuntimeException.class, () -> session.ping(Duration.ofMillis(500)));
            Assertions.assertTrue(alerts.isEmpty());
            Assertions.assertThrows(RuntimeException.class, () -> session.ping(Duration.ofMillis(500)));

            Assertions.assertEquals(1, alerts.size());
            Assertions.assertEquals(Severity.WARNING, alerts.get(0).severity());
            Assertions.assertEquals("box", alerts.get(0).serverName());
        }
    }

    @Test
    void replyForUnissuedIdFailsInFlightRequestsThenHeals() throws Exception {
        KeyPair hostKeys = KeyMaterial.generateIdentity();
        try (MisroutingAgent rogue = new MisroutingAgent(hostKeys, agent.clientKeys())) {
            ServerProfile profile = ServerProfile.builder("rogue", "127.0.0.1", rogue.port())
                    .tls(false)
                    .useHttpsDisguise(false)
                    .timeout(Duration.ofSeconds(5))
                    .build();
            KeyAuthenticator authenticator = new KeyAuthenticator(new StaticCredentialSource(
                    LoopbackAgent.CLIENT_IDENTITY,
                    agent.clientKeys(),
                    Map.of("rogue", hostKeys.getPublic())
            ));
            try (Session session = new Session(profile, channel, authenticator, ReconnectPolicy.singleAttempt(), null)) {
                ProtocolViolationException error = Assertions.assertThrows(
                        ProtocolViolationException.class,
                        () -> session.execute("echo first", Duration.ofSeconds(5))
                );
                Assertions.assertEquals(ProtocolViolationException.Reason.CORRELATION_MISMATCH, error.reason());
                waitUntil(() -> session.state() == SessionState.CONNECTING);

                Assertions.assertEquals("second\n", session.execute("echo second", Duration.ofSeconds(5)).stdout());
            }
        }
    }

    @Test
    void oversizedRequestIsRejectedWithoutLeakingWaiters() {
        String huge = "echo " + "x".repeat(17 * 1024 * 1024);
        try (Session session = session(agent.profile("box").build())) {
            session.ensureReady();

            Assertions.assertThrows(ProtocolViolationException.class, () -> session.execute(huge, Duration.ofSeconds(5)));
            Assertions.assertEquals(0, session.pendingCount());

            Assertions.assertThrows(
                    ProtocolViolationException.class,
                    () -> session.executePipelined(List.of(Command.of("echo small"), Command.of(huge)))
            );
            Assertions.assertEquals(0, session.pendingCount());

            Assertions.assertEquals(SessionState.READY, session.state());
            Assertions.assertEquals("still here\n", session.execute("echo still here", Duration.ofSeconds(5)).stdout());
        }
    }

    @Test
    void closedSessionRefusesWork() {
        Session session = session(agent.profile("box").build());
        session.ensureReady();
        session.close();

        Assertions.assertEquals(SessionState.CLOSED, session.state());
        Assertions.assertThrows(ConnectionLostException.class, () -> session.execute("echo late", Duration.ofSeconds(1)));
    }

    private Session session(ServerProfile profile) {
        return new Session(profile, channel, agent.authenticator(profile.name()), new ReconnectPolicy(2, 50L, 100L), alerts::add);
    }

    static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not met within 5s");
            }
            Thread.sleep(20L);
        }
    }

    /**
     * Answers the first command of the first connection with a correlation id that was never
     * issued; behaves on every later connection.
     */
    private static final class MisroutingAgent implements AutoCloseable {
        private final ServerSocket server;
        private final HandshakeResponder responder;
        private final AtomicInteger connections = new AtomicInteger();

        private MisroutingAgent(KeyPair hostKeys, KeyPair clientKeys) throws IOException {
            this.server = new ServerSocket(0);
            AuthorizedKeys authorized = new AuthorizedKeys().authorize(LoopbackAgent.CLIENT_IDENTITY, clientKeys.getPublic());
            this.responder = new HandshakeResponder(hostKeys, authorized, new NonceRegistry());
            Thread acceptor = new Thread(this::acceptLoop, "misrouting-agent");
            acceptor.setDaemon(true);
            acceptor.start();
        }

        int port() {
            return server.getLocalPort();
        }

        private void acceptLoop() {
            while (!server.isClosed()) {
                try {
                    Socket socket = server.accept();
                    boolean misroute = connections.incrementAndGet() == 1;
                    Thread handler = new Thread(() -> serve(socket, misroute), "misrouting-agent-conn");
                    handler.setDaemon(true);
                    handler.start();
                } catch (IOException e) {
                    return;
                }
            }
        }

        private void serve(Socket socket, boolean misroute) {
            try (Connection connection = new Connection(socket, new PlainEnvelope(), "rogue")) {
                responder.respond(connection.frames());
                while (true) {
                    Frame request = connection.frames().read();
                    long id = misroute ? request.correlationId() + 1_000L : request.correlationId();
                    String text = new String(request.payload(), StandardCharsets.UTF_8);
                    String word = text.contains("second") ? "second" : "first";
                    connection.frames().write(Frame.json(FrameType.RESPONSE, id, CommandReply.completed(word + "\n", "", 0, 1L)));
                }
            } catch (IOException | RuntimeException e) {
                // connection over
            }
        }

        @Override
        public void close() throws IOException {
            server.close();
        }
    }
}
