package io.relayshell.security;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.AuthFailureException;
import io.relayshell.error.AuthFailureException.Reason;
import io.relayshell.error.ConnectionLostException;
import io.relayshell.error.RequestTimeoutException;
import io.relayshell.transport.Connection;
import io.relayshell.transport.FrameStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Duration;

/**
 * Client half of the mutual key handshake.
 *
 * <ol>
 *   <li>HELLO: identity, fresh nonce, timestamp, ephemeral X25519 key.</li>
 *   <li>CHALLENGE: the agent's nonce, timestamp and ephemeral key, signed with its host key. The
 *       host key must match the key pinned for the profile; there is no trust on first use.</li>
 *   <li>PROOF: the client's signature over the same transcript, checked by the agent against its
 *       authorized keys.</li>
 *   <li>OK: both sides switch the stream to per-frame MACs keyed by the derived session key.</li>
 * </ol>
 */
public final class KeyAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(KeyAuthenticator.class);

    private final CredentialSource credentials;
    private final NonceRegistry nonces;

    public KeyAuthenticator(CredentialSource credentials) {
        this(credentials, new NonceRegistry());
    }

    public KeyAuthenticator(CredentialSource credentials, NonceRegistry nonces) {
        this.credentials = credentials;
        this.nonces = nonces;
    }

    /**
     * Runs the handshake on a fresh connection and, on success, enables frame integrity on it.
     *
     * @throws AuthFailureException when either side rejects the other
     * @throws RequestTimeoutException when a handshake round trip exceeds {@code timeout}
     * @throws ConnectionLostException when the stream closes mid-handshake
     */
    public AuthenticatedPeer authenticate(Connection connection, ServerProfile profile, Duration timeout) {
        PublicKey pinned = credentials.pinnedHostKey(profile).orElseThrow(() -> new AuthFailureException(
                Reason.UNKNOWN_HOST,
                "no pinned host key for " + profile.name() + "; refusing to trust on first use"
        ));
        FrameStream frames = connection.frames();
        try {
            connection.readTimeout(timeout);
            KeyPair ephemeral = KeyMaterial.generateEphemeral();
            HandshakeMessage hello = HandshakeMessage.hello(
                    credentials.identity(),
                    AuthFrames.newNonce(),
                    nonces.clock().millis(),
                    KeyMaterial.encodePublic(ephemeral.getPublic())
            );
            AuthFrames.send(frames, hello);

            HandshakeMessage challenge = AuthFrames.receive(frames, HandshakeMessage.CHALLENGE);
            String pinnedFingerprint = KeyMaterial.fingerprint(pinned);
            if (!pinnedFingerprint.equalsIgnoreCase(challenge.hostKeyFingerprint())) {
                throw new AuthFailureException(
                        Reason.UNKNOWN_HOST,
                        "host key for " + profile.name() + " does not match the pinned key (got "
                                + challenge.hostKeyFingerprint() + ")"
                );
            }
            if (challenge.timestampMs() == null || challenge.ephemeralKey() == null) {
                throw new AuthFailureException(Reason.BAD_SIGNATURE, "incomplete challenge from " + profile.name());
            }
            HandshakeTranscript transcript = HandshakeTranscript.of(hello, challenge);
            if (!KeyMaterial.verify(pinned, transcript.hostSigningInput(), AuthFrames.decodeSignature(challenge.signature()))) {
                throw new AuthFailureException(Reason.BAD_SIGNATURE, "host signature from " + profile.name() + " does not verify");
            }
            nonces.checkFresh(challenge.nonce(), challenge.timestampMs());

            byte[] proof = KeyMaterial.sign(credentials.identityKeys().getPrivate(), transcript.clientSigningInput());
            AuthFrames.send(frames, HandshakeMessage.proof(AuthFrames.encodeSignature(proof)));
            AuthFrames.receive(frames, HandshakeMessage.OK);

            byte[] shared = KeyMaterial.agree(ephemeral.getPrivate(), KeyMaterial.decodeEphemeralPublic(challenge.ephemeralKey()));
            frames.enableIntegrity(MessageIntegrity.forClient(transcript.sessionKey(shared)));
            connection.readTimeout(Duration.ZERO);
            log.debug("Authenticated to {} as {} (host key {})", profile.name(), credentials.identity(), pinnedFingerprint);
            return new AuthenticatedPeer(profile.name(), pinnedFingerprint);
        } catch (SocketTimeoutException e) {
            throw new RequestTimeoutException(RequestTimeoutException.Phase.HANDSHAKE, timeout, "no handshake reply from " + profile.name());
        } catch (IOException e) {
            throw new ConnectionLostException("connection closed during handshake with " + profile.name(), e);
        }
    }

    public record AuthenticatedPeer(String serverName, String hostKeyFingerprint) {
    }
}
