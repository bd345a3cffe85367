package io.relayshell.error;

public final class ConnectFailureException extends RelayShellException {
    public enum Reason {
        DNS,
        REFUSED,
        TIMEOUT,
        TLS,
        HOP
    }

    private final Reason reason;
    private final int hop;

    private ConnectFailureException(Reason reason, int hop, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.hop = hop;
    }

    public static ConnectFailureException of(Reason reason, String message, Throwable cause) {
        if (reason == Reason.HOP) {
            throw new IllegalArgumentException("hop failures must name the hop index");
        }
        return new ConnectFailureException(reason, 0, reason.name().toLowerCase() + ": " + message, cause);
    }

    public static ConnectFailureException atHop(int hop, String message, Throwable cause) {
        if (hop < 1) {
            throw new IllegalArgumentException("hop index starts at 1: " + hop);
        }
        return new ConnectFailureException(Reason.HOP, hop, "hop:" + hop + ": " + message, cause);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * 1-based index of the failing relay hop, or 0 when the failure is not hop specific.
     */
    public int hop() {
        return hop;
    }
}
