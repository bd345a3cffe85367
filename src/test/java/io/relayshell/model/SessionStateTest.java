package io.relayshell.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class SessionStateTest {

    @Test
    void onlyTheReconnectEdgesGoBackwards() {
        List<String> backwards = new ArrayList<>();
        for (SessionState from : SessionState.values()) {
            for (SessionState to : SessionState.values()) {
                if (from.canTransitionTo(to) && to.ordinal() <= from.ordinal()) {
                    backwards.add(from + "->" + to);
                }
            }
        }

        Assertions.assertEquals(List.of("AUTHENTICATING->CONNECTING", "READY->CONNECTING"), backwards);
    }

    @Test
    void closingOnlyEndsInClosed() {
        Assertions.assertTrue(SessionState.CLOSING.canTransitionTo(SessionState.CLOSED));
        Assertions.assertFalse(SessionState.CLOSING.canTransitionTo(SessionState.CONNECTING));
        for (SessionState next : SessionState.values()) {
            Assertions.assertFalse(SessionState.CLOSED.canTransitionTo(next), "CLOSED -> " + next);
        }
        Assertions.assertFalse(SessionState.DISCONNECTED.canTransitionTo(SessionState.READY));
    }
}
