package io.relayshell.support;

import io.relayshell.agent.CommandExecutor;
import io.relayshell.transport.CommandReply;

import java.time.Duration;

/**
 * {@link ScriptedExecutor} plus {@code restart <ms>}, which takes the agent down and brings it back
 * after the given downtime, and {@code shutdown}, which takes it down for good.
 */
public final class RestartableExecutor implements CommandExecutor {
    private final ScriptedExecutor scripted = new ScriptedExecutor();
    private volatile LoopbackAgent agent;

    public void attach(LoopbackAgent value) {
        this.agent = value;
    }

    @Override
    public CommandReply execute(String command, Duration timeout) throws Exception {
        if (command.startsWith("restart ")) {
            agent.restartAfter(Duration.ofMillis(Long.parseLong(command.substring(8).trim())));
            return CommandReply.completed("restarting\n", "", 0, 0L);
        }
        if (command.equals("shutdown")) {
            agent.stop();
            return CommandReply.completed("", "", 0, 0L);
        }
        return scripted.execute(command, timeout);
    }

    public int executed() {
        return scripted.executed();
    }
}
