package io.relayshell.error;

/**
 * The transport went away while a request was in flight.
 */
public final class ConnectionLostException extends RelayShellException {
    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
