package io.relayshell.dispatch;

import io.relayshell.error.RelayShellException;
import io.relayshell.model.CommandResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

final class ResultCacheTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final ResultCache cache = new ResultCache(Duration.ofSeconds(60), clock);

    @Test
    void freshResultIsReusedUntilItExpires() {
        CommandResult result = completed("uptime");
        cache.put("box", result);

        clock.advance(Duration.ofSeconds(59));
        Assertions.assertSame(result, cache.get("box", "uptime").orElseThrow());
        Assertions.assertTrue(cache.get("other", "uptime").isEmpty());

        clock.advance(Duration.ofSeconds(1));
        Assertions.assertTrue(cache.get("box", "uptime").isEmpty());
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void failedResultsAreNotStored() {
        cache.put("box", CommandResult.failed("uptime", new RelayShellException("link down"), Duration.ZERO));

        Assertions.assertTrue(cache.get("box", "uptime").isEmpty());
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void putPurgesExpiredEntriesAndInvalidateIsPerServer() {
        cache.put("box", completed("df -h"));
        clock.advance(Duration.ofSeconds(61));
        cache.put("box", completed("uptime"));
        cache.put("edge", completed("uptime"));
        Assertions.assertEquals(2, cache.size());

        cache.invalidate("box");

        Assertions.assertTrue(cache.get("box", "uptime").isEmpty());
        Assertions.assertTrue(cache.get("edge", "uptime").isPresent());
    }

    @Test
    void ttlMustBePositive() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ResultCache(Duration.ZERO));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ResultCache(Duration.ofSeconds(-1)));
    }

    private static CommandResult completed(String command) {
        return CommandResult.completed(command, "ok\n", "", 0, Duration.ofMillis(3));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
