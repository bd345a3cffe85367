package io.relayshell.security;

import io.relayshell.error.AuthFailureException;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers nonces for as long as their timestamp could still pass the skew check, and refuses
 * any nonce seen before.
 */
public final class NonceRegistry {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(30);
    private static final int PURGE_THRESHOLD = 1_024;

    private final Clock clock;
    private final long windowMs;
    private final Map<String, Long> seen = new ConcurrentHashMap<>();

    public NonceRegistry(Clock clock, Duration window) {
        this.clock = clock;
        this.windowMs = window.toMillis();
    }

    public NonceRegistry() {
        this(Clock.systemUTC(), DEFAULT_WINDOW);
    }

    public Clock clock() {
        return clock;
    }

    public void checkFresh(String nonce, long timestampMs) {
        long nowMs = clock.millis();
        if (Math.abs(nowMs - timestampMs) > windowMs) {
            throw new AuthFailureException(
                    AuthFailureException.Reason.EXPIRED,
                    "timestamp " + timestampMs + " outside +/-" + windowMs + "ms of " + nowMs
            );
        }
        if (nonce == null || nonce.isBlank()) {
            throw new AuthFailureException(AuthFailureException.Reason.REPLAY, "missing nonce");
        }
        if (seen.size() >= PURGE_THRESHOLD) {
            purge(nowMs);
        }
        Long previous = seen.putIfAbsent(nonce, timestampMs + 2L * windowMs);
        if (previous != null) {
            throw new AuthFailureException(AuthFailureException.Reason.REPLAY, "nonce already used");
        }
    }

    int size() {
        return seen.size();
    }

    private void purge(long nowMs) {
        Iterator<Map.Entry<String, Long>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() < nowMs) {
                it.remove();
            }
        }
    }
}
