package io.relayshell.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;

/**
 * An established byte stream to the target (after any relay hops and TLS), framed.
 */
public final class Connection implements Closeable {
    private final Socket socket;
    private final FrameStream frames;
    private final String description;

    public Connection(Socket socket, Envelope envelope, String description) throws IOException {
        this.socket = socket;
        this.frames = new FrameStream(
                new BufferedInputStream(socket.getInputStream()),
                new BufferedOutputStream(socket.getOutputStream()),
                envelope
        );
        this.description = description;
    }

    public FrameStream frames() {
        return frames;
    }

    public String description() {
        return description;
    }

    /**
     * Bounds blocking reads; {@link Duration#ZERO} disables the bound.
     */
    public void readTimeout(Duration timeout) throws SocketException {
        socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    public boolean isOpen() {
        return !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return "Connection(" + description + ")";
    }
}
