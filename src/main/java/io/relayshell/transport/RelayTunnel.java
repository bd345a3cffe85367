package io.relayshell.transport;

import io.relayshell.config.HostAndPort;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client half of the relay-establish exchange: an HTTP {@code CONNECT} naming the next hop.
 */
public final class RelayTunnel {
    public static final int STATUS_ESTABLISHED = 200;
    public static final int STATUS_BAD_GATEWAY = 502;
    public static final int STATUS_GATEWAY_TIMEOUT = 504;

    private RelayTunnel() {
    }

    /**
     * Asks the relay at the other end of {@code socket} to open a tunnel to {@code next}.
     *
     * @return the relay's HTTP status code
     * @throws IOException when the relay itself does not answer properly
     */
    public static int establish(Socket socket, HostAndPort next, Duration timeout) throws IOException {
        socket.setSoTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis())));
        OutputStream out = socket.getOutputStream();
        String request = "CONNECT " + next + " HTTP/1.1\r\n"
                + "Host: " + next + "\r\n"
                + "User-Agent: " + HttpDisguiseEnvelope.USER_AGENT + "\r\n"
                + "Proxy-Connection: keep-alive\r\n"
                + "\r\n";
        out.write(request.getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
        InputStream in = socket.getInputStream();
        HttpHead head = HttpHead.read(in);
        int status = head.statusCode();
        if (status < 0) {
            throw new IOException("relay answered with a non-HTTP status line: " + head.startLine());
        }
        return status;
    }

    public static String statusLine(int status) {
        return switch (status) {
            case STATUS_ESTABLISHED -> "HTTP/1.1 200 Connection established";
            case STATUS_GATEWAY_TIMEOUT -> "HTTP/1.1 504 Gateway Timeout";
            case 400 -> "HTTP/1.1 400 Bad Request";
            default -> "HTTP/1.1 502 Bad Gateway";
        };
    }
}
