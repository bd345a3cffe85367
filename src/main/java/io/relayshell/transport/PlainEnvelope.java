package io.relayshell.transport;

import io.relayshell.error.ProtocolViolationException;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * 4-byte big-endian length prefix followed by the body.
 */
public final class PlainEnvelope implements Envelope {

    @Override
    public void write(OutputStream out, byte[] body) throws IOException {
        out.write(ByteBuffer.allocate(4).putInt(body.length).array());
        out.write(body);
    }

    @Override
    public byte[] read(InputStream in) throws IOException {
        int first = in.read();
        if (first < 0) {
            throw new EOFException("stream closed");
        }
        DataInputStream data = new DataInputStream(in);
        int length = (first << 24) | (data.readUnsignedByte() << 16) | (data.readUnsignedByte() << 8) | data.readUnsignedByte();
        if (length < 0 || length > FrameCodec.MAX_FRAME_BYTES) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "invalid frame length " + length);
        }
        byte[] body = new byte[length];
        data.readFully(body);
        return body;
    }
}
