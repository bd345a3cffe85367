package io.relayshell.transport;

import io.relayshell.config.HostAndPort;
import io.relayshell.config.RelayShellConfig;
import io.relayshell.config.ServerProfile;
import io.relayshell.error.ConnectFailureException;
import io.relayshell.error.ConnectFailureException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NoRouteToHostException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain-socket transport. Name resolution and the raw connect run on a bounded worker pool so a
 * slow resolver never stalls a caller past its deadline.
 */
public final class SocketTransportChannel implements TransportChannel, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SocketTransportChannel.class);

    private final ThreadPoolExecutor connectPool;
    private final SSLContext sslContext;

    public SocketTransportChannel(SSLContext sslContext) {
        this(
                sslContext,
                RelayShellConfig.DEFAULT_CONNECT_POOL_CORE,
                RelayShellConfig.DEFAULT_CONNECT_POOL_MAX,
                RelayShellConfig.DEFAULT_CONNECT_QUEUE_CAPACITY
        );
    }

    public SocketTransportChannel(SSLContext sslContext, int coreThreads, int maxThreads, int queueCapacity) {
        this.sslContext = sslContext;
        AtomicInteger counter = new AtomicInteger();
        this.connectPool = new ThreadPoolExecutor(
                Math.max(1, coreThreads),
                Math.max(Math.max(1, coreThreads), maxThreads),
                30L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                runnable -> {
                    Thread thread = new Thread(runnable, "relayshell-connect-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        this.connectPool.allowCoreThreadTimeOut(true);
    }

    @Override
    public Connection connect(ServerProfile profile) {
        long deadlineNanos = System.nanoTime() + profile.timeout().toNanos();
        List<HostAndPort> chain = profile.proxyChain();
        HostAndPort first = chain.isEmpty() ? profile.target() : chain.get(0);
        Socket socket;
        try {
            socket = openSocket(first, remaining(deadlineNanos));
        } catch (ConnectFailureException e) {
            if (chain.isEmpty()) {
                throw e;
            }
            throw ConnectFailureException.atHop(1, "cannot reach relay " + first + " (" + e.reason() + ")", e);
        }
        try {
            for (int i = 0; i < chain.size(); i++) {
                boolean lastHop = i == chain.size() - 1;
                HostAndPort next = lastHop ? profile.target() : chain.get(i + 1);
                tunnelThroughHop(socket, i + 1, next, lastHop, remaining(deadlineNanos));
            }
            if (profile.tls()) {
                socket = upgradeToTls(socket, profile, remaining(deadlineNanos));
            }
            socket.setSoTimeout(0);
            socket.setTcpNoDelay(true);
            Envelope envelope = profile.useHttpsDisguise()
                    ? HttpDisguiseEnvelope.client(profile.host())
                    : new PlainEnvelope();
            Connection connection = new Connection(socket, envelope, describe(profile));
            log.debug("Transport established: {}", connection.description());
            return connection;
        } catch (ConnectFailureException e) {
            closeOnFailure(socket, e);
            throw e;
        } catch (IOException e) {
            ConnectFailureException failure = ConnectFailureException.of(Reason.REFUSED, "stream setup failed: " + e.getMessage(), e);
            closeOnFailure(socket, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeOnFailure(socket, e);
            throw e;
        }
    }

    private void tunnelThroughHop(Socket socket, int hopIndex, HostAndPort next, boolean nextIsTarget, Duration timeout) {
        int status;
        try {
            status = RelayTunnel.establish(socket, next, timeout);
        } catch (IOException e) {
            throw ConnectFailureException.atHop(hopIndex, "relay did not answer CONNECT " + next + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw ConnectFailureException.atHop(hopIndex, "relay answered CONNECT " + next + " with garbage: " + e.getMessage(), e);
        }
        if (status == RelayTunnel.STATUS_ESTABLISHED) {
            log.debug("Relay hop {} tunnelled to {}", hopIndex, next);
            return;
        }
        if (!nextIsTarget) {
            throw ConnectFailureException.atHop(hopIndex + 1, "relay " + hopIndex + " could not reach " + next + " (status " + status + ")", null);
        }
        Reason reason = status == RelayTunnel.STATUS_GATEWAY_TIMEOUT ? Reason.TIMEOUT : Reason.REFUSED;
        throw ConnectFailureException.of(reason, "last relay could not reach target " + next + " (status " + status + ")", null);
    }

    private Socket openSocket(HostAndPort address, Duration timeout) {
        int timeoutMs = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        Future<Socket> pending;
        try {
            pending = connectPool.submit(() -> {
                InetAddress resolved = InetAddress.getByName(address.host());
                Socket socket = new Socket();
                try {
                    socket.connect(new InetSocketAddress(resolved, address.port()), timeoutMs);
                    return socket;
                } catch (IOException e) {
                    socket.close();
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            throw ConnectFailureException.of(Reason.TIMEOUT, "connect pool saturated while reaching " + address, e);
        }
        try {
            return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(pending);
            throw ConnectFailureException.of(Reason.TIMEOUT, "no connection to " + address + " within " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(pending);
            throw ConnectFailureException.of(Reason.TIMEOUT, "interrupted while connecting to " + address, e);
        } catch (ExecutionException e) {
            throw classify(address, e.getCause());
        }
    }

    // A connect that finishes after the caller gave up must not leak its socket.
    private void abandon(Future<Socket> pending) {
        if (pending.cancel(true)) {
            return;
        }
        try {
            Socket late = pending.get();
            late.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | IOException e) {
            log.debug("Abandoned connect attempt ended with {}", e.toString());
        }
    }

    private static ConnectFailureException classify(HostAndPort address, Throwable cause) {
        if (cause instanceof UnknownHostException) {
            return ConnectFailureException.of(Reason.DNS, "cannot resolve " + address.host(), cause);
        }
        if (cause instanceof SocketTimeoutException) {
            return ConnectFailureException.of(Reason.TIMEOUT, "connect to " + address + " timed out", cause);
        }
        if (cause instanceof ConnectException || cause instanceof NoRouteToHostException) {
            return ConnectFailureException.of(Reason.REFUSED, "connection to " + address + " refused: " + cause.getMessage(), cause);
        }
        return ConnectFailureException.of(Reason.REFUSED, "cannot connect to " + address + ": " + cause, cause);
    }

    private Socket upgradeToTls(Socket plain, ServerProfile profile, Duration timeout) {
        if (sslContext == null) {
            throw ConnectFailureException.of(Reason.TLS, "profile " + profile.name() + " requires TLS but no TLS context is configured", null);
        }
        try {
            SSLSocket tls = (SSLSocket) sslContext.getSocketFactory().createSocket(plain, profile.host(), profile.port(), true);
            tls.setEnabledProtocols(TransportTls.protocols());
            tls.setSoTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis())));
            tls.startHandshake();
            return tls;
        } catch (SocketTimeoutException e) {
            throw ConnectFailureException.of(Reason.TIMEOUT, "TLS handshake with " + profile.target() + " timed out", e);
        } catch (SSLException e) {
            throw ConnectFailureException.of(Reason.TLS, "TLS handshake with " + profile.target() + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw ConnectFailureException.of(Reason.TLS, "TLS setup with " + profile.target() + " failed: " + e.getMessage(), e);
        }
    }

    private static Duration remaining(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        if (left <= 0L) {
            throw ConnectFailureException.of(Reason.TIMEOUT, "connect deadline exceeded", null);
        }
        return Duration.ofNanos(left);
    }

    private static void closeOnFailure(Socket socket, Exception failure) {
        try {
            socket.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static String describe(ServerProfile profile) {
        StringBuilder sb = new StringBuilder(profile.name()).append('@').append(profile.target());
        if (profile.relayed()) {
            sb.append(" via ").append(profile.proxyChain());
        }
        if (profile.useHttpsDisguise()) {
            sb.append(" [disguised]");
        }
        return sb.toString();
    }

    @Override
    public void close() {
        connectPool.shutdownNow();
    }
}
