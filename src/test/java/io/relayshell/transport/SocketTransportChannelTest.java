package io.relayshell.transport;

import io.relayshell.agent.RelayServer;
import io.relayshell.config.HostAndPort;
import io.relayshell.config.ServerProfile;
import io.relayshell.error.ConnectFailureException;
import io.relayshell.model.CommandResult;
import io.relayshell.session.ReconnectPolicy;
import io.relayshell.session.Session;
import io.relayshell.support.LoopbackAgent;
import io.relayshell.support.ScriptedExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

final class SocketTransportChannelTest {
    private final SocketTransportChannel channel = new SocketTransportChannel(null);

    @AfterEach
    void closeChannel() {
        channel.close();
    }

    @Test
    void refusedDirectConnectIsReportedAsRefused() throws Exception {
        ServerProfile profile = plainProfile("direct", freePort()).build();
        ConnectFailureException error = Assertions.assertThrows(ConnectFailureException.class, () -> channel.connect(profile));
        Assertions.assertEquals(ConnectFailureException.Reason.REFUSED, error.reason());
    }

    @Test
    void unreachableFirstRelayIsHopOne() throws Exception {
        ServerProfile profile = plainProfile("chained", 22)
                .proxyHop("127.0.0.1", freePort())
                .build();
        ConnectFailureException error = Assertions.assertThrows(ConnectFailureException.class, () -> channel.connect(profile));
        Assertions.assertEquals(ConnectFailureException.Reason.HOP, error.reason());
        Assertions.assertEquals(1, error.hop());
    }

    @Test
    void secondHopFailureNamesHopTwo() throws Exception {
        try (RelayServer first = new RelayServer("127.0.0.1", 0, Duration.ofSeconds(2))) {
            first.start();
            ServerProfile profile = plainProfile("chained", 22)
                    .proxyChain(List.of(
                            new HostAndPort("127.0.0.1", first.port()),
                            new HostAndPort("127.0.0.1", freePort())
                    ))
                    .build();

            ConnectFailureException error = Assertions.assertThrows(ConnectFailureException.class, () -> channel.connect(profile));
            Assertions.assertEquals(ConnectFailureException.Reason.HOP, error.reason());
            Assertions.assertEquals(2, error.hop());
        }
    }

    @Test
    void lastRelayThatCannotReachTargetIsRefused() throws Exception {
        try (RelayServer relay = new RelayServer("127.0.0.1", 0, Duration.ofSeconds(2))) {
            relay.start();
            ServerProfile profile = plainProfile("chained", freePort())
                    .proxyHop("127.0.0.1", relay.port())
                    .build();

            ConnectFailureException error = Assertions.assertThrows(ConnectFailureException.class, () -> channel.connect(profile));
            Assertions.assertEquals(ConnectFailureException.Reason.REFUSED, error.reason());
        }
    }

    @Test
    void relayAnsweringGarbageIsBlamedOnThatHop() throws Exception {
        try (ServerSocket fake = new ServerSocket(0)) {
            Thread responder = new Thread(() -> {
                try (Socket client = fake.accept()) {
                    OutputStream out = client.getOutputStream();
                    out.write("SSH-2.0-OpenSSH_9.0\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                    client.getInputStream().read();
                } catch (IOException ignored) {
                }
            });
            responder.setDaemon(true);
            responder.start();
            ServerProfile profile = plainProfile("chained", 22)
                    .proxyHop("127.0.0.1", fake.getLocalPort())
                    .build();

            ConnectFailureException error = Assertions.assertThrows(ConnectFailureException.class, () -> channel.connect(profile));
            Assertions.assertEquals(1, error.hop());
        }
    }

    @Test
    void commandsTravelThroughTwoRelays() throws Exception {
        try (LoopbackAgent agent = LoopbackAgent.start(new ScriptedExecutor(), true);
             RelayServer first = new RelayServer("127.0.0.1", 0, Duration.ofSeconds(2));
             RelayServer second = new RelayServer("127.0.0.1", 0, Duration.ofSeconds(2))) {
            first.start();
            second.start();
            ServerProfile profile = agent.profile("relayed")
                    .proxyChain(List.of(
                            new HostAndPort("127.0.0.1", first.port()),
                            new HostAndPort("127.0.0.1", second.port())
                    ))
                    .build();
            try (Session session = new Session(profile, channel, agent.authenticator("relayed"), ReconnectPolicy.singleAttempt(), null)) {
                CommandResult result = session.execute("echo through", Duration.ofSeconds(5));
                Assertions.assertEquals("through\n", result.stdout());
                Assertions.assertEquals(0, result.exitCode());
            }
        }
    }

    private static ServerProfile.Builder plainProfile(String name, int port) {
        return ServerProfile.builder(name, "127.0.0.1", port)
                .tls(false)
                .useHttpsDisguise(false)
                .timeout(Duration.ofSeconds(3));
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
