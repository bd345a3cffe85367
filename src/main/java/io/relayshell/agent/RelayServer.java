package io.relayshell.agent;

import io.relayshell.config.HostAndPort;
import io.relayshell.error.RelayShellException;
import io.relayshell.transport.HttpHead;
import io.relayshell.transport.RelayTunnel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A transparent relay hop. Answers {@code CONNECT host:port} by opening a socket to the named
 * address and then copying bytes both ways until either side closes. The relay never inspects
 * the tunnelled stream.
 *
 * <p>Status codes: 200 once the next hop is connected, 504 when connecting times out, 502 for
 * any other failure to reach it, 400 for a request that is not a well-formed CONNECT.
 */
public final class RelayServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);
    private static final int COPY_BUFFER_BYTES = 16 * 1024;

    private final String bindHost;
    private final int requestedPort;
    private final Duration connectTimeout;
    private final ExecutorService pool;
    private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile ServerSocket serverSocket;

    public RelayServer(String bindHost, int port, Duration connectTimeout) {
        this.bindHost = bindHost == null || bindHost.isBlank() ? "0.0.0.0" : bindHost;
        this.requestedPort = port;
        this.connectTimeout = connectTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "relayshell-relay-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("relay already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(bindHost, requestedPort));
        serverSocket = socket;
        Thread acceptThread = new Thread(this::acceptLoop, "relayshell-relay-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Relay listening on {}:{}", bindHost, port());
    }

    public int port() {
        ServerSocket socket = serverSocket;
        return socket == null ? requestedPort : socket.getLocalPort();
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
        for (Socket open : sockets) {
            closeQuietly(open);
        }
        pool.shutdownNow();
        log.info("Relay on port {} stopped", port());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("Relay accept failed: {}", e.toString());
                }
                continue;
            }
            sockets.add(client);
            try {
                pool.execute(() -> handle(client));
            } catch (RejectedExecutionException e) {
                release(client);
            }
        }
    }

    private void handle(Socket client) {
        Socket upstream = null;
        try {
            InputStream clientIn = client.getInputStream();
            OutputStream clientOut = client.getOutputStream();
            HostAndPort next;
            try {
                next = parseConnect(HttpHead.read(clientIn));
            } catch (IllegalArgumentException | RelayShellException e) {
                respond(clientOut, 400);
                return;
            }
            try {
                upstream = new Socket();
                sockets.add(upstream);
                upstream.connect(new InetSocketAddress(next.host(), next.port()), (int) Math.max(1L, connectTimeout.toMillis()));
            } catch (SocketTimeoutException e) {
                log.info("Relay timed out reaching {}", next);
                respond(clientOut, RelayTunnel.STATUS_GATEWAY_TIMEOUT);
                return;
            } catch (IOException e) {
                log.info("Relay cannot reach {}: {}", next, e.toString());
                respond(clientOut, RelayTunnel.STATUS_BAD_GATEWAY);
                return;
            }
            respond(clientOut, RelayTunnel.STATUS_ESTABLISHED);
            log.debug("Relaying {} -> {}", client.getRemoteSocketAddress(), next);
            Socket target = upstream;
            pool.execute(() -> pipe(target, client));
            pipe(client, target);
        } catch (IOException | RejectedExecutionException e) {
            log.debug("Relay connection ended: {}", e.toString());
        } finally {
            release(client);
            if (upstream != null) {
                release(upstream);
            }
        }
    }

    private static HostAndPort parseConnect(HttpHead head) {
        String[] parts = head.startLine().split(" ");
        if (parts.length != 3 || !"CONNECT".equals(parts[0]) || !parts[2].startsWith("HTTP/")) {
            throw new IllegalArgumentException("not a CONNECT request: " + head.startLine());
        }
        return HostAndPort.parse(parts[1]);
    }

    private void pipe(Socket from, Socket to) {
        byte[] buffer = new byte[COPY_BUFFER_BYTES];
        try {
            InputStream in = from.getInputStream();
            OutputStream out = to.getOutputStream();
            int read;
            while ((read = in.read(buffer)) >= 0) {
                out.write(buffer, 0, read);
                out.flush();
            }
        } catch (IOException e) {
            log.trace("Relay pipe closed: {}", e.toString());
        } finally {
            release(from);
            release(to);
        }
    }

    private static void respond(OutputStream out, int status) throws IOException {
        out.write((RelayTunnel.statusLine(status) + "\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    private void release(Socket socket) {
        sockets.remove(socket);
        closeQuietly(socket);
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.toString());
        }
    }
}
