package io.relayshell.security;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON body of an {@code AUTH} frame. Which fields are set depends on {@link #step()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HandshakeMessage(
        String step,
        String identity,
        String nonce,
        Long timestampMs,
        String ephemeralKey,
        String hostKeyFingerprint,
        String signature,
        String reason,
        String message
) {
    public static final String HELLO = "hello";
    public static final String CHALLENGE = "challenge";
    public static final String PROOF = "proof";
    public static final String OK = "ok";
    public static final String ERROR = "error";

    public static HandshakeMessage hello(String identity, String nonce, long timestampMs, String ephemeralKey) {
        return new HandshakeMessage(HELLO, identity, nonce, timestampMs, ephemeralKey, null, null, null, null);
    }

    public static HandshakeMessage challenge(String nonce, long timestampMs, String ephemeralKey, String hostKeyFingerprint, String signature) {
        return new HandshakeMessage(CHALLENGE, null, nonce, timestampMs, ephemeralKey, hostKeyFingerprint, signature, null, null);
    }

    public static HandshakeMessage proof(String signature) {
        return new HandshakeMessage(PROOF, null, null, null, null, null, signature, null, null);
    }

    public static HandshakeMessage ok() {
        return new HandshakeMessage(OK, null, null, null, null, null, null, null, null);
    }

    public static HandshakeMessage error(String reason, String message) {
        return new HandshakeMessage(ERROR, null, null, null, null, null, null, reason, message);
    }

    public boolean is(String expectedStep) {
        return expectedStep.equals(step);
    }
}
