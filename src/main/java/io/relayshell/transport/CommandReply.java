package io.relayshell.transport;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Payload of a {@link FrameType#RESPONSE} frame. Command replies fill the output fields, ping
 * replies fill {@code metrics}, and a request the agent could not run carries only {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandReply(
        String stdout,
        String stderr,
        Integer exitCode,
        Long durationMs,
        Map<String, Double> metrics,
        String error
) {
    public static CommandReply completed(String stdout, String stderr, int exitCode, long durationMs) {
        return new CommandReply(stdout, stderr, exitCode, durationMs, null, null);
    }

    public static CommandReply metrics(Map<String, Double> metrics) {
        return new CommandReply(null, null, null, null, metrics, null);
    }

    public static CommandReply error(String message) {
        return new CommandReply(null, null, null, null, null, message);
    }

    public boolean failed() {
        return error != null;
    }
}
