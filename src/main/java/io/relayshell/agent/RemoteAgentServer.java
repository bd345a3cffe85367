package io.relayshell.agent;

import io.relayshell.error.AuthFailureException;
import io.relayshell.error.RelayShellException;
import io.relayshell.security.AuthorizedKeys;
import io.relayshell.security.HandshakeResponder;
import io.relayshell.security.NonceRegistry;
import io.relayshell.transport.BatchRequest;
import io.relayshell.transport.CommandReply;
import io.relayshell.transport.CommandRequest;
import io.relayshell.transport.Connection;
import io.relayshell.transport.Envelope;
import io.relayshell.transport.Frame;
import io.relayshell.transport.FrameStream;
import io.relayshell.transport.FrameType;
import io.relayshell.transport.HttpDisguiseEnvelope;
import io.relayshell.transport.PlainEnvelope;
import io.relayshell.transport.TransportTls;
import io.relayshell.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLServerSocket;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.KeyPair;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The remote end of the protocol: authenticates clients with {@link HandshakeResponder}, then
 * answers {@code COMMAND}, {@code BATCH} and {@code PING} frames on the same connection.
 *
 * <p>Commands run on a bounded worker pool so a slow command never blocks pings or other
 * requests; replies are written as each command finishes.
 */
public final class RemoteAgentServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RemoteAgentServer.class);
    private static final Duration HANDSHAKE_TIMEOUT = Duration.ofSeconds(30);

    private final Options options;
    private final HandshakeResponder responder;
    private final CommandExecutor executor;
    private final HostStatusProbe probe;
    private final ExecutorService connectionPool;
    private final ThreadPoolExecutor commandPool;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile ServerSocket serverSocket;

    public RemoteAgentServer(
            Options options,
            KeyPair hostKeys,
            AuthorizedKeys authorizedKeys,
            CommandExecutor executor,
            HostStatusProbe probe
    ) {
        this.options = options;
        this.responder = new HandshakeResponder(hostKeys, authorizedKeys, new NonceRegistry());
        this.executor = executor;
        this.probe = probe;
        AtomicInteger connections = new AtomicInteger();
        this.connectionPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "relayshell-agent-conn-" + connections.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger workers = new AtomicInteger();
        int threads = Math.max(1, options.workerThreads());
        this.commandPool = new ThreadPoolExecutor(
                threads,
                threads,
                30L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(16, threads * 32)),
                runnable -> {
                    Thread thread = new Thread(runnable, "relayshell-agent-worker-" + workers.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        this.commandPool.allowCoreThreadTimeOut(true);
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("agent already started");
        }
        ServerSocket socket = options.tls() == null
                ? new ServerSocket()
                : options.tls().getServerSocketFactory().createServerSocket();
        if (socket instanceof SSLServerSocket tlsSocket) {
            tlsSocket.setEnabledProtocols(TransportTls.protocols());
        }
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(options.bindHost(), options.port()));
        serverSocket = socket;
        Thread acceptThread = new Thread(this::acceptLoop, "relayshell-agent-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info(
                "Agent listening on {}:{} (tls={}, disguise={}, host key {})",
                options.bindHost(),
                port(),
                options.tls() != null,
                options.httpDisguise(),
                responder.hostFingerprint()
        );
    }

    public int port() {
        ServerSocket socket = serverSocket;
        return socket == null ? options.port() : socket.getLocalPort();
    }

    /**
     * Drops every client connection while continuing to accept new ones.
     */
    public void disconnectClients() {
        for (Socket client : clients) {
            closeQuietly(client);
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ServerSocket socket = serverSocket;
        if (socket != null) {
            closeQuietly(socket);
        }
        disconnectClients();
        connectionPool.shutdownNow();
        commandPool.shutdownNow();
        log.info("Agent on port {} stopped", port());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("Accept failed: {}", e.toString());
                }
                continue;
            }
            clients.add(client);
            try {
                connectionPool.execute(() -> serve(client));
            } catch (RejectedExecutionException e) {
                clients.remove(client);
                closeQuietly(client);
            }
        }
    }

    private void serve(Socket socket) {
        Envelope envelope = options.httpDisguise() ? HttpDisguiseEnvelope.agent() : new PlainEnvelope();
        String peer = String.valueOf(socket.getRemoteSocketAddress());
        try (Connection connection = new Connection(socket, envelope, peer)) {
            connection.readTimeout(HANDSHAKE_TIMEOUT);
            String identity = responder.respond(connection.frames());
            connection.readTimeout(Duration.ZERO);
            FrameStream frames = connection.frames();
            while (running.get()) {
                dispatch(frames, frames.read(), identity);
            }
        } catch (EOFException e) {
            log.debug("Client {} disconnected", peer);
        } catch (SocketTimeoutException e) {
            log.info("Client {} did not complete the handshake in time", peer);
        } catch (AuthFailureException e) {
            log.info("Client {} failed authentication: {}", peer, e.getMessage());
        } catch (IOException | RelayShellException e) {
            if (running.get()) {
                log.debug("Connection with {} ended: {}", peer, e.toString());
            }
        } finally {
            clients.remove(socket);
        }
    }

    private void dispatch(FrameStream frames, Frame frame, String identity) throws IOException {
        switch (frame.type()) {
            case COMMAND -> {
                CommandRequest request = Jsons.fromWireBytes(frame.payload(), CommandRequest.class);
                log.debug("{} runs [{}] as request {}", identity, request.command(), frame.correlationId());
                submit(frames, frame.correlationId(), request.command(), request.timeoutMs());
            }
            case BATCH -> {
                BatchRequest batch = Jsons.fromWireBytes(frame.payload(), BatchRequest.class);
                log.debug("{} submitted a batch of {}", identity, batch.items().size());
                for (BatchRequest.Item item : batch.items()) {
                    submit(frames, item.correlationId(), item.command(), item.timeoutMs());
                }
            }
            case PING -> reply(frames, frame.correlationId(), CommandReply.metrics(probe.sample()));
            default -> reply(frames, frame.correlationId(), CommandReply.error("unsupported frame type " + frame.type()));
        }
    }

    private void submit(FrameStream frames, long correlationId, String command, long timeoutMs) {
        try {
            commandPool.execute(() -> reply(frames, correlationId, run(command, timeoutMs)));
        } catch (RejectedExecutionException e) {
            reply(frames, correlationId, CommandReply.error("agent is overloaded"));
        }
    }

    private CommandReply run(String command, long timeoutMs) {
        try {
            return executor.execute(command, Duration.ofMillis(Math.max(1L, timeoutMs)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandReply.error("interrupted");
        } catch (Exception e) {
            log.warn("Command failed to run: {}", e.toString());
            return CommandReply.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private void reply(FrameStream frames, long correlationId, CommandReply reply) {
        try {
            frames.write(Frame.json(FrameType.RESPONSE, correlationId, reply));
        } catch (IOException e) {
            log.debug("Reply {} not delivered: {}", correlationId, e.toString());
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.toString());
        }
    }

    /**
     * @param tls {@code null} for a plain listener
     */
    public record Options(String bindHost, int port, boolean httpDisguise, SSLContext tls, int workerThreads) {
        public Options {
            if (bindHost == null || bindHost.isBlank()) {
                bindHost = "0.0.0.0";
            }
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("port must be in 0..65535");
            }
        }

        public static Options plain(String bindHost, int port) {
            return new Options(bindHost, port, false, null, 8);
        }

        public Options withDisguise(boolean value) {
            return new Options(bindHost, port, value, tls, workerThreads);
        }

        public Options withTls(SSLContext value) {
            return new Options(bindHost, port, httpDisguise, value, workerThreads);
        }
    }
}
