package io.relayshell.transport;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

final class EnvelopeTest {

    @Test
    void everyEnvelopeReturnsTheBodyItWrapped() {
        byte[] binary = new byte[70_000];
        new Random(7L).nextBytes(binary);
        List<byte[]> bodies = List.of(
                new byte[0],
                "hello".getBytes(StandardCharsets.UTF_8),
                "\r\n\r\nPOST / HTTP/1.1\r\n".getBytes(StandardCharsets.US_ASCII),
                binary
        );
        List<Envelope> envelopes = List.of(
                new PlainEnvelope(),
                HttpDisguiseEnvelope.client("example.com"),
                HttpDisguiseEnvelope.agent()
        );
        for (Envelope envelope : envelopes) {
            for (byte[] body : bodies) {
                Assertions.assertArrayEquals(body, envelope.unwrap(envelope.wrap(body)), envelope.getClass().getSimpleName());
            }
        }
    }

    @Test
    void disguisedTrafficLooksLikeHttp() {
        String request = new String(HttpDisguiseEnvelope.client("example.com").wrap(new byte[]{1, 2}), StandardCharsets.ISO_8859_1);
        String response = new String(HttpDisguiseEnvelope.agent().wrap(new byte[]{1, 2}), StandardCharsets.ISO_8859_1);

        Assertions.assertTrue(request.startsWith("POST "), request);
        Assertions.assertTrue(request.contains("Host: example.com\r\n"), request);
        Assertions.assertTrue(request.contains("Content-Length: 2\r\n"), request);
        Assertions.assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"), response);
    }

    @Test
    void consecutiveBodiesShareOneStream() throws Exception {
        Envelope envelope = HttpDisguiseEnvelope.client("example.com");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        envelope.write(out, "first".getBytes(StandardCharsets.UTF_8));
        envelope.write(out, "second".getBytes(StandardCharsets.UTF_8));

        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());
        Assertions.assertEquals("first", new String(envelope.read(in), StandardCharsets.UTF_8));
        Assertions.assertEquals("second", new String(envelope.read(in), StandardCharsets.UTF_8));
        Assertions.assertThrows(EOFException.class, () -> envelope.read(in));
    }
}
