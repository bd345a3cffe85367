package io.relayshell.security;

import io.relayshell.error.AuthFailureException;
import io.relayshell.error.ProtocolViolationException;
import io.relayshell.transport.Frame;
import io.relayshell.transport.FrameStream;
import io.relayshell.transport.FrameType;
import io.relayshell.util.Jsons;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.Base64;

final class AuthFrames {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int NONCE_BYTES = 32;

    private AuthFrames() {
    }

    static void send(FrameStream frames, HandshakeMessage message) throws IOException {
        frames.write(Frame.json(FrameType.AUTH, 0L, message));
    }

    static HandshakeMessage receive(FrameStream frames, String expectedStep) throws IOException {
        Frame frame = frames.read();
        if (frame.type() != FrameType.AUTH) {
            throw new ProtocolViolationException(
                    ProtocolViolationException.Reason.MALFORMED,
                    "expected AUTH frame during handshake, got " + frame.type()
            );
        }
        HandshakeMessage message;
        try {
            message = Jsons.fromWireBytes(frame.payload(), HandshakeMessage.class);
        } catch (IOException e) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.DECODE, "unreadable handshake message", e);
        }
        if (message.is(HandshakeMessage.ERROR)) {
            throw new AuthFailureException(
                    AuthFailureException.Reason.fromWire(message.reason()),
                    "peer rejected handshake: " + message.message()
            );
        }
        if (!message.is(expectedStep)) {
            throw new ProtocolViolationException(
                    ProtocolViolationException.Reason.MALFORMED,
                    "expected handshake step " + expectedStep + ", got " + message.step()
            );
        }
        return message;
    }

    static String newNonce() {
        byte[] raw = new byte[NONCE_BYTES];
        RANDOM.nextBytes(raw);
        return Base64.getEncoder().encodeToString(raw);
    }

    static byte[] decodeSignature(String base64) {
        if (base64 == null || base64.isBlank()) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            return new byte[0];
        }
    }

    static String encodeSignature(byte[] signature) {
        return Base64.getEncoder().encodeToString(signature);
    }
}
