package io.relayshell.transport;

import io.relayshell.util.Jsons;

import java.util.Arrays;

public record Frame(FrameType type, long correlationId, byte[] payload) {
    public Frame {
        if (type == null) {
            throw new IllegalArgumentException("frame type is required");
        }
        payload = payload == null ? new byte[0] : payload;
    }

    public static Frame json(FrameType type, long correlationId, Object body) {
        return new Frame(type, correlationId, Jsons.toWireBytes(body));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Frame frame)) {
            return false;
        }
        return type == frame.type
                && correlationId == frame.correlationId
                && Arrays.equals(payload, frame.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + Long.hashCode(correlationId)) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame(" + type + ", id=" + correlationId + ", " + payload.length + " bytes)";
    }
}
