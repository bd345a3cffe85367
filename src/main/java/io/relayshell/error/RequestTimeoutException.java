package io.relayshell.error;

import java.time.Duration;

public final class RequestTimeoutException extends RelayShellException {
    public enum Phase {
        COMMAND,
        HANDSHAKE
    }

    private final Phase phase;
    private final Duration timeout;

    public RequestTimeoutException(Phase phase, Duration timeout, String message) {
        super(phase.name().toLowerCase() + " timed out after " + timeout.toMillis() + "ms: " + message);
        this.phase = phase;
        this.timeout = timeout;
    }

    public Phase phase() {
        return phase;
    }

    public Duration timeout() {
        return timeout;
    }
}
