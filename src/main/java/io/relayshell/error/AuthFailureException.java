package io.relayshell.error;

import java.util.Locale;

public final class AuthFailureException extends RelayShellException {
    public enum Reason {
        UNKNOWN_HOST,
        BAD_SIGNATURE,
        EXPIRED,
        REPLAY;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Reason fromWire(String raw) {
            if (raw == null || raw.isBlank()) {
                return BAD_SIGNATURE;
            }
            for (Reason value : values()) {
                if (value.wireName().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
            return BAD_SIGNATURE;
        }
    }

    private final Reason reason;

    public AuthFailureException(Reason reason, String message) {
        super(reason.wireName() + ": " + message);
        this.reason = reason;
    }

    public AuthFailureException(Reason reason, String message, Throwable cause) {
        super(reason.wireName() + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    // Host identity and key problems will not fix themselves on a retry.
    public boolean isRetryable() {
        return reason == Reason.EXPIRED || reason == Reason.REPLAY;
    }
}
