package io.relayshell.model;

import java.time.Instant;

public record Alert(Instant timestamp, Severity severity, String message, String serverName) {
    public Alert {
        if (severity == null) {
            throw new IllegalArgumentException("alert severity is required");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        message = message == null ? "" : message;
    }

    public static Alert now(Severity severity, String serverName, String message) {
        return new Alert(Instant.now(), severity, message, serverName);
    }
}
