package io.relayshell.model;

import java.time.Duration;

/**
 * A command line to run remotely. A {@code null} timeout means the profile default applies.
 */
public record Command(String text, Duration timeout, boolean waitForRestart) {
    public Command {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("command text cannot be empty");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("command timeout must be positive");
        }
    }

    public static Command of(String text) {
        return new Command(text, null, false);
    }

    public static Command of(String text, Duration timeout) {
        return new Command(text, timeout, false);
    }

    public static Command restarting(String text) {
        return new Command(text, null, true);
    }

    public Duration timeoutOr(Duration fallback) {
        return timeout == null ? fallback : timeout;
    }
}
