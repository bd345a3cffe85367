package io.relayshell.transport;

import io.relayshell.error.ProtocolViolationException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Shapes each frame like an ordinary HTTP/1.1 exchange: the client side emits {@code POST}
 * requests, the agent side emits {@code 200 OK} responses, both delimited by
 * {@code Content-Length}. Either shape is accepted when reading.
 */
public final class HttpDisguiseEnvelope implements Envelope {
    static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String REQUEST_PATH = "/api/v2/sync";

    public enum Role {
        CLIENT,
        AGENT
    }

    private final Role role;
    private final String hostHeader;

    private HttpDisguiseEnvelope(Role role, String hostHeader) {
        this.role = role;
        this.hostHeader = hostHeader == null || hostHeader.isBlank() ? "localhost" : hostHeader;
    }

    public static HttpDisguiseEnvelope client(String hostHeader) {
        return new HttpDisguiseEnvelope(Role.CLIENT, hostHeader);
    }

    public static HttpDisguiseEnvelope agent() {
        return new HttpDisguiseEnvelope(Role.AGENT, null);
    }

    @Override
    public void write(OutputStream out, byte[] body) throws IOException {
        StringBuilder head = new StringBuilder(256);
        if (role == Role.CLIENT) {
            head.append("POST ").append(REQUEST_PATH).append(" HTTP/1.1\r\n");
            head.append("Host: ").append(hostHeader).append("\r\n");
            head.append("User-Agent: ").append(USER_AGENT).append("\r\n");
            head.append("Accept: */*\r\n");
        } else {
            head.append("HTTP/1.1 200 OK\r\n");
            head.append("Server: nginx\r\n");
            head.append("Cache-Control: no-store\r\n");
        }
        head.append("Content-Type: application/octet-stream\r\n");
        head.append("Content-Length: ").append(body.length).append("\r\n");
        head.append("Connection: keep-alive\r\n");
        head.append("\r\n");
        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        out.write(body);
    }

    @Override
    public byte[] read(InputStream in) throws IOException {
        HttpHead head = HttpHead.read(in);
        String start = head.startLine();
        if (!start.startsWith("POST ") && head.statusCode() != 200) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "unexpected start line: " + start);
        }
        String rawLength = head.header("Content-Length").orElseThrow(() -> new ProtocolViolationException(
                ProtocolViolationException.Reason.MALFORMED,
                "missing Content-Length"
        ));
        int length;
        try {
            length = Integer.parseInt(rawLength);
        } catch (NumberFormatException e) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "bad Content-Length: " + rawLength, e);
        }
        if (length < 0 || length > FrameCodec.MAX_FRAME_BYTES) {
            throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "invalid Content-Length " + length);
        }
        byte[] body = in.readNBytes(length);
        if (body.length != length) {
            throw new EOFException("stream closed inside disguised body");
        }
        return body;
    }

    public Role role() {
        return role;
    }
}
