package io.relayshell.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Session lifecycle. Transitions only move forward except the self-heal edge
 * {@code READY -> CONNECTING}. Before a session is first authenticated, a transient handshake
 * failure may also go {@code AUTHENTICATING -> CONNECTING} for the next bounded attempt.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    READY,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    public boolean terminal() {
        return this == CLOSING || this == CLOSED;
    }

    private Set<SessionState> allowedNext() {
        return switch (this) {
            case DISCONNECTED -> EnumSet.of(CONNECTING, CLOSING);
            case CONNECTING -> EnumSet.of(AUTHENTICATING, CLOSING);
            case AUTHENTICATING -> EnumSet.of(READY, CONNECTING, CLOSING);
            case READY -> EnumSet.of(CONNECTING, CLOSING);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(SessionState.class);
        };
    }
}
