package io.relayshell.transport;

import io.relayshell.error.ProtocolViolationException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads an HTTP/1.1 start line and headers byte by byte, so nothing after the blank line is
 * consumed from the underlying stream.
 */
public record HttpHead(String startLine, List<String> headers) {
    public static final int MAX_HEAD_BYTES = 8 * 1024;

    public static HttpHead read(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int total = 0;
        int previous = -1;
        while (true) {
            int b = in.read();
            if (b < 0) {
                if (total == 0) {
                    throw new EOFException("stream closed");
                }
                throw new EOFException("stream closed inside HTTP head");
            }
            total++;
            if (total > MAX_HEAD_BYTES) {
                throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "HTTP head exceeds " + MAX_HEAD_BYTES + " bytes");
            }
            if (b == '\n' && previous == '\r') {
                byte[] raw = line.toByteArray();
                String text = new String(raw, 0, Math.max(0, raw.length - 1), StandardCharsets.ISO_8859_1);
                if (text.isEmpty()) {
                    if (lines.isEmpty()) {
                        throw new ProtocolViolationException(ProtocolViolationException.Reason.MALFORMED, "empty HTTP head");
                    }
                    return new HttpHead(lines.get(0), List.copyOf(lines.subList(1, lines.size())));
                }
                lines.add(text);
                line.reset();
            } else {
                line.write(b);
            }
            previous = b;
        }
    }

    public Optional<String> header(String name) {
        String prefix = name.toLowerCase(Locale.ROOT) + ":";
        for (String header : headers) {
            if (header.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return Optional.of(header.substring(prefix.length()).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Status code of a response start line such as {@code HTTP/1.1 200 OK}, or -1.
     */
    public int statusCode() {
        String[] parts = startLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            return -1;
        }
        try {
            return Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
