package io.relayshell.security;

import io.relayshell.util.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-connection frame MACs keyed by the handshake session key. Each direction has its own
 * derived key and an implicit sequence number, so reordered, replayed or dropped frames fail
 * verification even if the outer transport were stripped.
 */
public final class MessageIntegrity {
    public static final int MAC_BYTES = 32;
    private static final byte[] CLIENT_TO_AGENT = "relayshell/c2a".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] AGENT_TO_CLIENT = "relayshell/a2c".getBytes(StandardCharsets.US_ASCII);

    private final byte[] sendKey;
    private final byte[] receiveKey;
    private final AtomicLong sendSequence = new AtomicLong();
    private final AtomicLong receiveSequence = new AtomicLong();

    private MessageIntegrity(byte[] sendKey, byte[] receiveKey) {
        this.sendKey = sendKey;
        this.receiveKey = receiveKey;
    }

    public static MessageIntegrity forClient(byte[] sessionKey) {
        return new MessageIntegrity(Hashing.hmacSha256(sessionKey, CLIENT_TO_AGENT), Hashing.hmacSha256(sessionKey, AGENT_TO_CLIENT));
    }

    public static MessageIntegrity forAgent(byte[] sessionKey) {
        return new MessageIntegrity(Hashing.hmacSha256(sessionKey, AGENT_TO_CLIENT), Hashing.hmacSha256(sessionKey, CLIENT_TO_AGENT));
    }

    // Callers serialize writes, so sequence numbers follow wire order.
    public byte[] seal(byte[] body) {
        return mac(sendKey, sendSequence.getAndIncrement(), body);
    }

    public boolean verify(byte[] body, byte[] mac) {
        byte[] expected = mac(receiveKey, receiveSequence.getAndIncrement(), body);
        return Hashing.constantTimeEquals(expected, mac);
    }

    private static byte[] mac(byte[] key, long sequence, byte[] body) {
        return Hashing.hmacSha256(key, ByteBuffer.allocate(8).putLong(sequence).array(), body);
    }
}
