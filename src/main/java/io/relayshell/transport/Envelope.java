package io.relayshell.transport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Delimits frame bodies on the byte stream. Implementations decide what the traffic looks
 * like on the wire; none of them add confidentiality.
 */
public interface Envelope {

    void write(OutputStream out, byte[] body) throws IOException;

    /**
     * Reads the next body.
     *
     * @throws java.io.EOFException when the peer closed the stream between envelopes
     */
    byte[] read(InputStream in) throws IOException;

    default byte[] wrap(byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length + 64);
        try {
            write(out, body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    default byte[] unwrap(byte[] wrapped) {
        try {
            return read(new ByteArrayInputStream(wrapped));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
