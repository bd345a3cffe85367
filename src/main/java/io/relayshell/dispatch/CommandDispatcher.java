package io.relayshell.dispatch;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.RelayShellException;
import io.relayshell.model.BatchMode;
import io.relayshell.model.BatchResult;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.restart.RestartCoordinator;
import io.relayshell.session.Session;
import io.relayshell.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Routes commands to the right session: single, batched, or asynchronous on a bounded pool.
 * Commands flagged {@link Command#waitForRestart()} go through the {@link RestartCoordinator}.
 *
 * <p>Cancelling a returned future only stops the local wait; the remote command keeps running.
 */
public final class CommandDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final SessionRegistry registry;
    private final RestartCoordinator restarts;
    private final ThreadPoolExecutor pool;
    private final ResultCache cache;

    public CommandDispatcher(SessionRegistry registry, RestartCoordinator restarts, int poolSize, int queueCapacity) {
        this(registry, restarts, poolSize, queueCapacity, null);
    }

    /**
     * @param cache consulted only by {@link #executeCached}; {@code null} disables caching
     */
    public CommandDispatcher(
            SessionRegistry registry,
            RestartCoordinator restarts,
            int poolSize,
            int queueCapacity,
            ResultCache cache
    ) {
        this.registry = registry;
        this.restarts = restarts;
        this.cache = cache;
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(1, poolSize);
        this.pool = new ThreadPoolExecutor(
                threads,
                threads,
                30L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                runnable -> {
                    Thread thread = new Thread(runnable, "relayshell-dispatch-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        this.pool.allowCoreThreadTimeOut(true);
    }

    public CommandResult execute(ServerProfile profile, Command command) {
        if (command.waitForRestart()) {
            return restarts.executeAndWait(profile, command);
        }
        return registry.acquire(profile).execute(command);
    }

    /**
     * Like {@link #execute} but answers from the result cache while a previous result for the same
     * command on the same server is fresh. Restart commands are never cached.
     */
    public CommandResult executeCached(ServerProfile profile, Command command) {
        if (cache == null || command.waitForRestart()) {
            return execute(profile, command);
        }
        Optional<CommandResult> hit = cache.get(profile.name(), command.text());
        if (hit.isPresent()) {
            log.debug("Cache hit on {}: {}", profile.name(), command.text());
            return hit.get();
        }
        CommandResult result = execute(profile, command);
        cache.put(profile.name(), result);
        return result;
    }

    /**
     * Drops cached results for {@code server}.
     */
    public void invalidateCache(String server) {
        if (cache != null) {
            cache.invalidate(server);
        }
    }

    /**
     * Runs every command and returns exactly one result per input, in submission order. Failures
     * are captured per command rather than thrown. {@link BatchMode#PIPELINED} falls back to
     * sequential execution when a command waits for a restart.
     */
    public BatchResult executeBatch(ServerProfile profile, List<Command> commands, BatchMode mode) {
        long started = System.nanoTime();
        List<CommandResult> results;
        if (mode == BatchMode.PIPELINED && commands.stream().noneMatch(Command::waitForRestart)) {
            results = pipelined(profile, commands);
        } else {
            results = sequential(profile, commands);
        }
        BatchResult batch = BatchResult.ofOrdered(results, Duration.ofNanos(System.nanoTime() - started));
        log.debug("Batch of {} on {} finished: {} ok, {} failed", batch.size(), profile.name(), batch.successCount(), batch.failureCount());
        return batch;
    }

    public CompletableFuture<CommandResult> executeAsync(ServerProfile profile, Command command) {
        return submit(() -> execute(profile, command));
    }

    public CompletableFuture<BatchResult> executeBatchAsync(ServerProfile profile, List<Command> commands, BatchMode mode) {
        return submit(() -> executeBatch(profile, commands, mode));
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5L, TimeUnit.SECONDS)) {
                log.warn("Dispatch pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<CommandResult> sequential(ServerProfile profile, List<Command> commands) {
        List<CommandResult> results = new ArrayList<>(commands.size());
        for (Command command : commands) {
            long started = System.nanoTime();
            try {
                results.add(execute(profile, command));
            } catch (RelayShellException e) {
                results.add(CommandResult.failed(command.text(), e, Duration.ofNanos(System.nanoTime() - started)));
            }
        }
        return results;
    }

    private List<CommandResult> pipelined(ServerProfile profile, List<Command> commands) {
        long started = System.nanoTime();
        try {
            Session session = registry.acquire(profile);
            return session.executePipelined(commands);
        } catch (RelayShellException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            List<CommandResult> results = new ArrayList<>(commands.size());
            for (Command command : commands) {
                results.add(CommandResult.failed(command.text(), e, elapsed));
            }
            return results;
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> work) {
        try {
            return CompletableFuture.supplyAsync(work, pool);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new RelayShellException("dispatch queue is full", e));
        }
    }
}
