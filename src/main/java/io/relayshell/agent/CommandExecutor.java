package io.relayshell.agent;

import io.relayshell.transport.CommandReply;

import java.time.Duration;

/**
 * Runs one command on the agent host. Exceptions are reported to the client as an error reply.
 */
@FunctionalInterface
public interface CommandExecutor {
    CommandReply execute(String command, Duration timeout) throws Exception;
}
