package io.relayshell.transport;

import io.relayshell.error.ProtocolViolationException;
import io.relayshell.security.MessageIntegrity;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Binary layout of a frame body, before any envelope is applied:
 * {@code type(1) | correlationId(8) | payloadLength(4) | payload | mac(32, once keyed)}.
 */
public final class FrameCodec {
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;
    static final int HEADER_BYTES = 1 + 8 + 4;

    private FrameCodec() {
    }

    public static byte[] encode(Frame frame, MessageIntegrity integrity) {
        int macBytes = integrity == null ? 0 : MessageIntegrity.MAC_BYTES;
        int total = HEADER_BYTES + frame.payload().length + macBytes;
        if (total > MAX_FRAME_BYTES) {
            throw new ProtocolViolationException(
                    ProtocolViolationException.Reason.MALFORMED,
                    "frame of " + total + " bytes exceeds limit " + MAX_FRAME_BYTES
            );
        }
        ByteBuffer buffer = ByteBuffer.allocate(total);
        buffer.put(frame.type().code());
        buffer.putLong(frame.correlationId());
        buffer.putInt(frame.payload().length);
        buffer.put(frame.payload());
        if (integrity != null) {
            buffer.put(integrity.seal(Arrays.copyOf(buffer.array(), HEADER_BYTES + frame.payload().length)));
        }
        return buffer.array();
    }

    public static Frame decode(byte[] body, MessageIntegrity integrity) {
        if (body == null || body.length < HEADER_BYTES) {
            throw malformed("frame shorter than header: " + (body == null ? 0 : body.length) + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(body);
        byte code = buffer.get();
        FrameType type = FrameType.fromCode(code);
        if (type == null) {
            throw malformed("unknown frame type " + code);
        }
        long correlationId = buffer.getLong();
        int payloadLength = buffer.getInt();
        int macBytes = integrity == null ? 0 : MessageIntegrity.MAC_BYTES;
        if (payloadLength < 0 || HEADER_BYTES + payloadLength + macBytes != body.length) {
            throw malformed("payload length " + payloadLength + " does not match frame of " + body.length + " bytes");
        }
        byte[] payload = new byte[payloadLength];
        buffer.get(payload);
        if (integrity != null) {
            byte[] mac = new byte[macBytes];
            buffer.get(mac);
            if (!integrity.verify(Arrays.copyOf(body, HEADER_BYTES + payloadLength), mac)) {
                throw new ProtocolViolationException(
                        ProtocolViolationException.Reason.DECODE,
                        "integrity check failed for " + type + " frame " + correlationId
                );
            }
        }
        return new Frame(type, correlationId, payload);
    }

    private static ProtocolViolationException malformed(String message) {
        return new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, message);
    }
}
