package io.relayshell.transport;

import io.relayshell.security.MessageIntegrity;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Frame-level view of a connected byte stream. Writes are serialized; reads are expected from
 * a single thread at a time.
 */
public final class FrameStream {
    private final InputStream in;
    private final OutputStream out;
    private final Envelope envelope;
    private final Object writeLock = new Object();
    private volatile MessageIntegrity integrity;

    public FrameStream(InputStream in, OutputStream out, Envelope envelope) {
        this.in = in;
        this.out = out;
        this.envelope = envelope;
    }

    public void write(Frame frame) throws IOException {
        synchronized (writeLock) {
            envelope.write(out, FrameCodec.encode(frame, integrity));
            out.flush();
        }
    }

    /**
     * Writes several frames back to back without interleaving other writers.
     */
    public void writeAll(Iterable<Frame> frames) throws IOException {
        synchronized (writeLock) {
            for (Frame frame : frames) {
                envelope.write(out, FrameCodec.encode(frame, integrity));
            }
            out.flush();
        }
    }

    public Frame read() throws IOException {
        return FrameCodec.decode(envelope.read(in), integrity);
    }

    public void enableIntegrity(MessageIntegrity value) {
        synchronized (writeLock) {
            this.integrity = value;
        }
    }

    public boolean integrityEnabled() {
        return integrity != null;
    }

    public Envelope envelope() {
        return envelope;
    }
}
