package io.relayshell.transport;

import java.util.List;

/**
 * Payload of a {@link FrameType#BATCH} frame. Every item carries its own correlation id and is
 * answered by its own {@link FrameType#RESPONSE} frame, in whatever order the agent finishes them.
 */
public record BatchRequest(List<Item> items) {
    public BatchRequest {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public record Item(long correlationId, String command, long timeoutMs) {
    }
}
