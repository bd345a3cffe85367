package io.relayshell.model;

import io.relayshell.error.RelayShellException;

import java.time.Duration;

/**
 * Outcome of one remote command.
 *
 * <p>{@code exitCode} is whatever the remote process returned. {@code protocolError} is only
 * set when the command never produced a remote outcome (timeout, lost connection, bad frame),
 * in which case {@code exitCode} is {@link #NO_EXIT_CODE}.
 */
public record CommandResult(
        String command,
        String stdout,
        String stderr,
        int exitCode,
        Duration duration,
        RelayShellException protocolError
) {
    public static final int NO_EXIT_CODE = -1;

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static CommandResult completed(String command, String stdout, String stderr, int exitCode, Duration duration) {
        return new CommandResult(command, stdout, stderr, exitCode, duration, null);
    }

    public static CommandResult failed(String command, RelayShellException error, Duration duration) {
        return new CommandResult(command, "", "", NO_EXIT_CODE, duration, error);
    }

    public boolean hasProtocolError() {
        return protocolError != null;
    }

    public boolean succeeded() {
        return protocolError == null && exitCode == 0;
    }
}
