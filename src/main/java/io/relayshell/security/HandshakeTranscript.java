package io.relayshell.security;

import io.relayshell.util.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * The values both parties sign. Binding the ephemeral keys into the signatures is what ties the
 * derived session key to the authenticated identities.
 */
record HandshakeTranscript(
        String identity,
        String clientNonce,
        long clientTimestampMs,
        String clientEphemeral,
        String serverNonce,
        long serverTimestampMs,
        String serverEphemeral,
        String hostKeyFingerprint
) {
    private static final String VERSION = "relayshell-v1";
    private static final byte[] SESSION_LABEL = "relayshell/session".getBytes(StandardCharsets.US_ASCII);

    static HandshakeTranscript of(HandshakeMessage hello, HandshakeMessage challenge) {
        return new HandshakeTranscript(
                hello.identity(),
                hello.nonce(),
                hello.timestampMs(),
                hello.ephemeralKey(),
                challenge.nonce(),
                challenge.timestampMs(),
                challenge.ephemeralKey(),
                challenge.hostKeyFingerprint()
        );
    }

    byte[] hostSigningInput() {
        return ("host|" + canonical()).getBytes(StandardCharsets.UTF_8);
    }

    byte[] clientSigningInput() {
        return ("client|" + canonical()).getBytes(StandardCharsets.UTF_8);
    }

    byte[] sessionKey(byte[] sharedSecret) {
        return Hashing.hmacSha256(sharedSecret, SESSION_LABEL, Hashing.sha256(canonical().getBytes(StandardCharsets.UTF_8)));
    }

    private String canonical() {
        return String.join("|",
                VERSION,
                identity,
                clientNonce,
                Long.toString(clientTimestampMs),
                clientEphemeral,
                serverNonce,
                Long.toString(serverTimestampMs),
                serverEphemeral,
                hostKeyFingerprint
        );
    }
}
