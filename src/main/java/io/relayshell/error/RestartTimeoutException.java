package io.relayshell.error;

import java.time.Duration;

public final class RestartTimeoutException extends RelayShellException {
    private final Duration elapsed;

    public RestartTimeoutException(String serverName, Duration elapsed, Duration maxWait) {
        super("host " + serverName + " did not come back within " + maxWait.toMillis()
                + "ms (elapsed " + elapsed.toMillis() + "ms)");
        this.elapsed = elapsed;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
