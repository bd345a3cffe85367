package io.relayshell.dispatch;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.RequestTimeoutException;
import io.relayshell.model.BatchMode;
import io.relayshell.model.BatchResult;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.restart.RestartCoordinator;
import io.relayshell.session.ReconnectPolicy;
import io.relayshell.session.Session;
import io.relayshell.session.SessionRegistry;
import io.relayshell.support.LoopbackAgent;
import io.relayshell.support.RestartableExecutor;
import io.relayshell.transport.SocketTransportChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class CommandDispatcherTest {
    private final RestartableExecutor executor = new RestartableExecutor();
    private LoopbackAgent agent;
    private SocketTransportChannel channel;
    private SessionRegistry registry;
    private RestartCoordinator restarts;
    private CommandDispatcher dispatcher;
    private ServerProfile profile;

    @BeforeEach
    void setUp() {
        agent = LoopbackAgent.start(executor);
        executor.attach(agent);
        channel = new SocketTransportChannel(null);
        registry = new SessionRegistry(p -> session(p, new ReconnectPolicy(2, 50L, 100L)));
        restarts = new RestartCoordinator(registry, p -> session(p, ReconnectPolicy.singleAttempt()), Duration.ZERO);
        dispatcher = new CommandDispatcher(registry, restarts, 4, 16);
        profile = agent.profile("box").restartMaxWait(Duration.ofSeconds(20)).build();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        registry.close();
        channel.close();
        agent.close();
    }

    @ParameterizedTest
    @EnumSource(BatchMode.class)
    void batchResultsFollowSubmissionOrder(BatchMode mode) {
        BatchResult batch = dispatcher.executeBatch(
                profile,
                List.of(Command.of("sleep 300"), Command.of("echo a"), Command.of("echo b")),
                mode
        );

        Assertions.assertEquals(3, batch.size());
        List<CommandResult> ordered = batch.ordered();
        Assertions.assertEquals("slept\n", ordered.get(0).stdout());
        Assertions.assertEquals("a\n", ordered.get(1).stdout());
        Assertions.assertEquals("b\n", ordered.get(2).stdout());
        Assertions.assertEquals(3, batch.successCount());
        Assertions.assertEquals("b\n", batch.get("echo b", 2).stdout());
    }

    @ParameterizedTest
    @EnumSource(BatchMode.class)
    void perCommandFailuresAreCapturedNotThrown(BatchMode mode) {
        BatchResult batch = dispatcher.executeBatch(
                profile,
                List.of(
                        Command.of("echo first"),
                        Command.of("sleep 1500", Duration.ofMillis(200)),
                        Command.of("exit 2"),
                        Command.of("echo last")
                ),
                mode
        );

        List<CommandResult> ordered = batch.ordered();
        Assertions.assertEquals(4, ordered.size());
        Assertions.assertTrue(ordered.get(0).succeeded());
        Assertions.assertInstanceOf(RequestTimeoutException.class, ordered.get(1).protocolError());
        Assertions.assertEquals(2, ordered.get(2).exitCode());
        Assertions.assertFalse(ordered.get(2).hasProtocolError());
        Assertions.assertEquals(2, batch.failureCount());
    }

    @Test
    void duplicateCommandsKeepTheirOwnSlots() {
        BatchResult batch = dispatcher.executeBatch(
                profile,
                List.of(Command.of("echo same"), Command.of("echo same")),
                BatchMode.PIPELINED
        );

        Assertions.assertEquals(2, batch.size());
        Assertions.assertNotNull(batch.get("echo same", 0));
        Assertions.assertNotNull(batch.get("echo same", 1));
    }

    @Test
    void asyncExecutionCompletesOffTheCallerThread() throws Exception {
        CompletableFuture<CommandResult> single = dispatcher.executeAsync(profile, Command.of("echo async"));
        CompletableFuture<BatchResult> batch = dispatcher.executeBatchAsync(
                profile,
                List.of(Command.of("echo x"), Command.of("echo y")),
                BatchMode.PIPELINED
        );

        Assertions.assertEquals("async\n", single.get(10, TimeUnit.SECONDS).stdout());
        Assertions.assertEquals(2, batch.get(10, TimeUnit.SECONDS).successCount());
    }

    @Test
    void restartingCommandIsRoutedThroughCoordinator() {
        CommandResult result = dispatcher.execute(profile, Command.restarting("restart 300"));

        Assertions.assertTrue(result.stdout().contains("box reconnected after"), result.stdout());
        Assertions.assertEquals("back\n", dispatcher.execute(profile, Command.of("echo back")).stdout());
    }

    @Test
    void cachedExecutionSkipsRestartCommandsAndDisabledCaches() {
        ResultCache cache = new ResultCache(Duration.ofSeconds(60));
        try (CommandDispatcher cached = new CommandDispatcher(registry, restarts, 2, 8, cache)) {
            CommandResult first = cached.executeCached(profile, Command.of("echo once"));
            int executed = executor.executed();
            Assertions.assertSame(first, cached.executeCached(profile, Command.of("echo once")));
            Assertions.assertEquals(executed, executor.executed());

            CommandResult restart = cached.executeCached(profile, Command.restarting("restart 300"));
            Assertions.assertTrue(restart.stdout().contains("box reconnected after"), restart.stdout());
            Assertions.assertEquals(1, cache.size());

            cached.invalidateCache("box");
            Assertions.assertEquals(0, cache.size());
        }

        dispatcher.executeCached(profile, Command.of("echo twice"));
        int executed = executor.executed();
        dispatcher.executeCached(profile, Command.of("echo twice"));
        Assertions.assertEquals(executed + 1, executor.executed());
    }

    private Session session(ServerProfile p, ReconnectPolicy policy) {
        return new Session(p, channel, agent.authenticator(p.name()), policy, null);
    }
}
