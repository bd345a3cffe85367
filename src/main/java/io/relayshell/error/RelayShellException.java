package io.relayshell.error;

/**
 * Root of every failure raised by the protocol engine.
 *
 * <p>Exit codes of remote commands are never reported through this hierarchy; they are
 * plain data on {@link io.relayshell.model.CommandResult}.
 */
public class RelayShellException extends RuntimeException {
    public RelayShellException(String message) {
        super(message);
    }

    public RelayShellException(String message, Throwable cause) {
        super(message, cause);
    }
}
