package io.relayshell.security;

import io.relayshell.error.AuthFailureException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

final class NonceRegistryTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void acceptsFreshNonceOnce() {
        NonceRegistry registry = new NonceRegistry(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));
        registry.checkFresh("n-1", NOW.toEpochMilli());

        AuthFailureException replay = Assertions.assertThrows(
                AuthFailureException.class,
                () -> registry.checkFresh("n-1", NOW.toEpochMilli())
        );
        Assertions.assertEquals(AuthFailureException.Reason.REPLAY, replay.reason());
        Assertions.assertEquals(1, registry.size());
    }

    @Test
    void rejectsTimestampsOutsideTheWindowEitherWay() {
        NonceRegistry registry = new NonceRegistry(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));

        registry.checkFresh("edge", NOW.minusSeconds(30).toEpochMilli());
        AuthFailureException past = Assertions.assertThrows(
                AuthFailureException.class,
                () -> registry.checkFresh("old", NOW.minusSeconds(31).toEpochMilli())
        );
        AuthFailureException future = Assertions.assertThrows(
                AuthFailureException.class,
                () -> registry.checkFresh("ahead", NOW.plusSeconds(31).toEpochMilli())
        );
        Assertions.assertEquals(AuthFailureException.Reason.EXPIRED, past.reason());
        Assertions.assertEquals(AuthFailureException.Reason.EXPIRED, future.reason());
    }
}
