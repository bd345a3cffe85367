package io.relayshell.session;

import io.relayshell.config.RelayShellConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded reconnect attempts with exponential backoff. Delays double from the base, are capped at
 * the maximum, and carry up to 250 ms of jitter without ever exceeding the cap.
 */
public record ReconnectPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    private static final long MAX_JITTER_MS = 250L;

    public ReconnectPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 0L || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("backoff bounds must satisfy 0 <= base <= max");
        }
    }

    public static ReconnectPolicy from(RelayShellConfig.ReconnectSettings settings) {
        return new ReconnectPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
    }

    public static ReconnectPolicy defaults() {
        return from(RelayShellConfig.ReconnectSettings.defaults());
    }

    public static ReconnectPolicy singleAttempt() {
        return new ReconnectPolicy(1, 0L, 0L);
    }

    /**
     * Delay to wait before retry number {@code attempt} (1-based).
     */
    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        if (maxBackoffMs == 0L) {
            return 0L;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0L, MAX_JITTER_MS + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
