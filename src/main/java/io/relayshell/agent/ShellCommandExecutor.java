package io.relayshell.agent;

import io.relayshell.transport.CommandReply;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs commands through the platform shell ({@code sh -c}, or {@code cmd /c} on Windows).
 * A command that outlives its timeout is killed and reported with exit code {@value #TIMEOUT_EXIT_CODE}.
 */
public final class ShellCommandExecutor implements CommandExecutor {
    public static final int TIMEOUT_EXIT_CODE = 124;

    private static final AtomicInteger DRAIN_THREADS = new AtomicInteger();
    private static final ExecutorService DRAIN_POOL = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "relayshell-exec-drain-" + DRAIN_THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final List<String> shell;

    public ShellCommandExecutor() {
        this(defaultShell());
    }

    public ShellCommandExecutor(List<String> shell) {
        if (shell == null || shell.isEmpty()) {
            throw new IllegalArgumentException("shell command cannot be empty");
        }
        this.shell = List.copyOf(shell);
    }

    @Override
    public CommandReply execute(String command, Duration timeout) throws IOException, InterruptedException {
        long started = System.nanoTime();
        List<String> argv = new ArrayList<>(shell);
        argv.add(command);
        Process process = new ProcessBuilder(argv).start();
        process.getOutputStream().close();
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            boolean finished = process.waitFor(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                process.waitFor(1, TimeUnit.SECONDS);
                String err = partial(stderr) + "command timed out after " + timeout.toMillis() + "ms\n";
                return CommandReply.completed(partial(stdout), err, TIMEOUT_EXIT_CODE, elapsedMs(started));
            }
            return CommandReply.completed(stdout.join(), stderr.join(), process.exitValue(), elapsedMs(started));
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }
    }

    // Background children keep the output pipes open, so they go first.
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAIN_POOL);
    }

    private static String partial(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(1, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static List<String> defaultShell() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") ? List.of("cmd", "/c") : List.of("sh", "-c");
    }
}
