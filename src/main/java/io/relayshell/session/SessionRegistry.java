package io.relayshell.session;

import io.relayshell.config.ServerProfile;
import io.relayshell.model.Alert;
import io.relayshell.model.SessionState;
import io.relayshell.security.KeyAuthenticator;
import io.relayshell.transport.TransportChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * At most one live {@link Session} per profile name. Callers that need isolation create their own
 * registry.
 */
public final class SessionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Object mutex = new Object();
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final Map<Session, Integer> acquiring = new IdentityHashMap<>();
    private final Function<ServerProfile, Session> factory;

    public SessionRegistry(Function<ServerProfile, Session> factory) {
        this.factory = factory;
    }

    public SessionRegistry(
            TransportChannel channel,
            KeyAuthenticator authenticator,
            ReconnectPolicy reconnect,
            Consumer<Alert> alertSink
    ) {
        this(profile -> new Session(profile, channel, authenticator, reconnect, alertSink));
    }

    /**
     * Returns the live session for {@code profile}, creating it if needed, and makes sure it is
     * ready. Concurrent callers for the same name share one session. A cached session that has
     * closed, or was created from a different profile definition, is replaced. When the session
     * cannot be made ready and no other caller is still waiting on it, it is closed and removed.
     */
    public Session acquire(ServerProfile profile) {
        Session session;
        synchronized (mutex) {
            session = sessions.get(profile.name());
            if (session != null && (session.state().terminal() || !session.profile().equals(profile))) {
                sessions.remove(profile.name());
                session.close();
                session = null;
            }
            if (session == null) {
                session = factory.apply(profile);
                sessions.put(profile.name(), session);
            }
            acquiring.merge(session, 1, Integer::sum);
        }
        boolean ready = false;
        try {
            session.ensureReady();
            ready = true;
            return session;
        } finally {
            release(session, ready);
        }
    }

    private void release(Session session, boolean ready) {
        boolean discard;
        synchronized (mutex) {
            int remaining = acquiring.merge(session, -1, Integer::sum);
            if (remaining <= 0) {
                acquiring.remove(session);
            }
            discard = !ready
                    && remaining <= 0
                    && session.state() != SessionState.READY
                    && sessions.remove(session.name(), session);
        }
        if (discard) {
            session.close();
            log.debug("Dropped session {} after failed acquire", session.name());
        }
    }

    public Optional<Session> find(String name) {
        synchronized (mutex) {
            return Optional.ofNullable(sessions.get(name));
        }
    }

    /**
     * Closes and forgets the session registered under {@code name}.
     *
     * @return {@code false} when nothing was registered
     */
    public boolean evict(String name) {
        Session removed;
        synchronized (mutex) {
            removed = sessions.remove(name);
        }
        if (removed == null) {
            return false;
        }
        removed.close();
        log.debug("Evicted session {}", name);
        return true;
    }

    /**
     * Registered session names and their current state, in registration order.
     */
    public Map<String, SessionState> states() {
        Map<String, SessionState> out = new LinkedHashMap<>();
        synchronized (mutex) {
            sessions.values().removeIf(s -> s.state() == SessionState.CLOSED);
            sessions.forEach((name, session) -> out.put(name, session.state()));
        }
        return out;
    }

    public int size() {
        synchronized (mutex) {
            sessions.values().removeIf(s -> s.state() == SessionState.CLOSED);
            return sessions.size();
        }
    }

    public void closeAll() {
        List<Session> snapshot;
        synchronized (mutex) {
            snapshot = new ArrayList<>(sessions.values());
            sessions.clear();
        }
        for (Session session : snapshot) {
            session.close();
        }
        if (!snapshot.isEmpty()) {
            log.info("Closed {} session(s)", snapshot.size());
        }
    }

    /**
     * Registers a JVM shutdown hook that closes every session.
     */
    public Thread installShutdownHook() {
        Thread hook = new Thread(this::closeAll, "relayshell-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    @Override
    public void close() {
        closeAll();
    }
}
