package io.relayshell.transport;

/**
 * Payload of a {@link FrameType#COMMAND} frame.
 */
public record CommandRequest(String command, long timeoutMs) {
}
