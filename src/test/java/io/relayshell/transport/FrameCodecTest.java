package io.relayshell.transport;

import io.relayshell.error.ProtocolViolationException;
import io.relayshell.security.MessageIntegrity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

final class FrameCodecTest {
    private static final byte[] KEY = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    @Test
    void decodesWhatItEncodes() {
        Frame frame = new Frame(FrameType.COMMAND, 42L, "{\"command\":\"uptime\"}".getBytes(StandardCharsets.UTF_8));
        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame, null), null);
        Assertions.assertEquals(frame, decoded);
    }

    @Test
    void rejectsUnknownTypeAndBadLengths() {
        byte[] encoded = FrameCodec.encode(new Frame(FrameType.PING, 1L, new byte[]{1, 2, 3}), null);

        byte[] unknownType = encoded.clone();
        unknownType[0] = 99;
        assertReason(ProtocolViolationException.Reason.MALFORMED, unknownType, null);

        byte[] truncated = Arrays.copyOf(encoded, encoded.length - 1);
        assertReason(ProtocolViolationException.Reason.MALFORMED, truncated, null);

        assertReason(ProtocolViolationException.Reason.MALFORMED, new byte[]{1, 0, 0}, null);
    }

    @Test
    void integrityFailureIsDecodeError() {
        MessageIntegrity sender = MessageIntegrity.forClient(KEY);
        MessageIntegrity receiver = MessageIntegrity.forAgent(KEY);
        byte[] sealed = FrameCodec.encode(Frame.json(FrameType.COMMAND, 7L, Map.of("command", "id")), sender);
        byte[] tampered = sealed.clone();
        tampered[FrameCodec.HEADER_BYTES] ^= 0x01;
        assertReason(ProtocolViolationException.Reason.DECODE, tampered, receiver);
    }

    @Test
    void sealedFramesVerifyInOrderOnly() {
        MessageIntegrity sender = MessageIntegrity.forClient(KEY);
        MessageIntegrity receiver = MessageIntegrity.forAgent(KEY);
        byte[] first = FrameCodec.encode(new Frame(FrameType.PING, 1L, new byte[0]), sender);
        byte[] second = FrameCodec.encode(new Frame(FrameType.PING, 2L, new byte[0]), sender);

        Assertions.assertEquals(1L, FrameCodec.decode(first, receiver).correlationId());
        Assertions.assertEquals(2L, FrameCodec.decode(second, receiver).correlationId());
        // replaying an earlier frame fails because the sequence moved on
        assertReason(ProtocolViolationException.Reason.DECODE, first, receiver);
    }

    private static void assertReason(ProtocolViolationException.Reason expected, byte[] body, MessageIntegrity integrity) {
        ProtocolViolationException error = Assertions.assertThrows(
                ProtocolViolationException.class,
                () -> FrameCodec.decode(body, integrity)
        );
        Assertions.assertEquals(expected, error.reason());
    }
}
