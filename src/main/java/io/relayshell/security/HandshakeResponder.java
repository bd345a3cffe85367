package io.relayshell.security;

import io.relayshell.error.AuthFailureException;
import io.relayshell.error.AuthFailureException.Reason;
import io.relayshell.transport.FrameStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.KeyPair;
import java.security.PublicKey;

/**
 * Agent half of the handshake driven by {@link KeyAuthenticator}. Rejections are reported to the
 * client as an {@code error} step before the exception propagates.
 */
public final class HandshakeResponder {
    private static final Logger log = LoggerFactory.getLogger(HandshakeResponder.class);

    private final KeyPair hostKeys;
    private final AuthorizedKeys authorizedKeys;
    private final NonceRegistry nonces;
    private final String hostFingerprint;

    public HandshakeResponder(KeyPair hostKeys, AuthorizedKeys authorizedKeys, NonceRegistry nonces) {
        this.hostKeys = hostKeys;
        this.authorizedKeys = authorizedKeys;
        this.nonces = nonces;
        this.hostFingerprint = KeyMaterial.fingerprint(hostKeys.getPublic());
    }

    /**
     * @return the authenticated client identity
     */
    public String respond(FrameStream frames) throws IOException {
        HandshakeMessage hello = AuthFrames.receive(frames, HandshakeMessage.HELLO);
        PublicKey clientKey;
        try {
            if (hello.timestampMs() == null || hello.ephemeralKey() == null) {
                throw new AuthFailureException(Reason.BAD_SIGNATURE, "incomplete hello");
            }
            nonces.checkFresh(hello.nonce(), hello.timestampMs());
            clientKey = authorizedKeys.lookup(hello.identity()).orElseThrow(() -> new AuthFailureException(
                    Reason.BAD_SIGNATURE,
                    "identity " + hello.identity() + " is not authorized"
            ));
        } catch (AuthFailureException e) {
            reject(frames, e);
            throw e;
        }

        KeyPair ephemeral = KeyMaterial.generateEphemeral();
        HandshakeMessage unsigned = HandshakeMessage.challenge(
                AuthFrames.newNonce(),
                nonces.clock().millis(),
                KeyMaterial.encodePublic(ephemeral.getPublic()),
                hostFingerprint,
                null
        );
        HandshakeTranscript transcript = HandshakeTranscript.of(hello, unsigned);
        byte[] signature = KeyMaterial.sign(hostKeys.getPrivate(), transcript.hostSigningInput());
        AuthFrames.send(frames, HandshakeMessage.challenge(
                unsigned.nonce(),
                unsigned.timestampMs(),
                unsigned.ephemeralKey(),
                hostFingerprint,
                AuthFrames.encodeSignature(signature)
        ));

        HandshakeMessage proof = AuthFrames.receive(frames, HandshakeMessage.PROOF);
        if (!KeyMaterial.verify(clientKey, transcript.clientSigningInput(), AuthFrames.decodeSignature(proof.signature()))) {
            AuthFailureException failure = new AuthFailureException(Reason.BAD_SIGNATURE, "client proof for " + hello.identity() + " does not verify");
            reject(frames, failure);
            throw failure;
        }
        AuthFrames.send(frames, HandshakeMessage.ok());
        byte[] shared = KeyMaterial.agree(ephemeral.getPrivate(), KeyMaterial.decodeEphemeralPublic(hello.ephemeralKey()));
        frames.enableIntegrity(MessageIntegrity.forAgent(transcript.sessionKey(shared)));
        log.info("Client {} authenticated", hello.identity());
        return hello.identity();
    }

    public String hostFingerprint() {
        return hostFingerprint;
    }

    private void reject(FrameStream frames, AuthFailureException failure) {
        log.warn("Handshake rejected: {}", failure.getMessage());
        try {
            AuthFrames.send(frames, HandshakeMessage.error(failure.reason().wireName(), failure.getMessage()));
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
