package io.relayshell.error;

public final class ProtocolViolationException extends RelayShellException {
    public enum Reason {
        MALFORMED,
        DECODE,
        CORRELATION_MISMATCH
    }

    private final Reason reason;

    public ProtocolViolationException(Reason reason, String message) {
        super(reason.name().toLowerCase() + ": " + message);
        this.reason = reason;
    }

    public ProtocolViolationException(Reason reason, String message, Throwable cause) {
        super(reason.name().toLowerCase() + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
