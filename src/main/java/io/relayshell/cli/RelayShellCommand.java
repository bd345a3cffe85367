package io.relayshell.cli;

import io.relayshell.agent.HostStatusProbe;
import io.relayshell.agent.RelayServer;
import io.relayshell.agent.RemoteAgentServer;
import io.relayshell.agent.ShellCommandExecutor;
import io.relayshell.config.RelayShellConfig;
import io.relayshell.model.Alert;
import io.relayshell.model.BatchMode;
import io.relayshell.model.BatchResult;
import io.relayshell.model.CommandResult;
import io.relayshell.runtime.RelayShellRuntime;
import io.relayshell.security.KeyMaterial;
import io.relayshell.transport.TransportTls;
import io.relayshell.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import javax.net.ssl.SSLContext;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "relayshell",
        mixinStandardHelpOptions = true,
        description = "RelayShell remote command client and agent",
        subcommands = {
                RelayShellCommand.ExecCommand.class,
                RelayShellCommand.BatchCommand.class,
                RelayShellCommand.RunCommand.class,
                RelayShellCommand.MonitorCommand.class,
                RelayShellCommand.ServeAgentCommand.class,
                RelayShellCommand.ServeRelayCommand.class,
                RelayShellCommand.KeygenCommand.class
        }
)
public final class RelayShellCommand implements Runnable {
    @Option(names = {"--config"}, description = "Config file (JSON)", defaultValue = "relayshell.json")
    String config;

    @Option(names = {"--keys"}, description = "Key file (JSON)", defaultValue = "relayshell-keys.json")
    String keys;

    @Option(names = {"--server"}, description = "Server profile name; defaults to default_server")
    String server;

    @Override
    public void run() {
        System.out.println("Use subcommands: exec | batch | run | monitor | serve-agent | serve-relay | keygen");
    }

    RelayShellRuntime runtime() throws Exception {
        RelayShellConfig loaded = RelayShellConfig.load(Path.of(config));
        return RelayShellRuntime.open(loaded, KeyFileCredentialSource.load(Path.of(keys)));
    }

    static ResultView view(CommandResult result) {
        return new ResultView(
                result.command(),
                result.stdout(),
                result.stderr(),
                result.exitCode(),
                result.duration().toMillis(),
                result.hasProtocolError() ? result.protocolError().getMessage() : null
        );
    }

    static int exitStatus(CommandResult result) {
        if (result.hasProtocolError()) {
            return 2;
        }
        return result.exitCode() == 0 ? 0 : 1;
    }

    @Command(name = "exec", description = "Run one command on a server")
    static final class ExecCommand implements Callable<Integer> {
        @ParentCommand
        RelayShellCommand parent;

        @Parameters(index = "0", description = "Command line to run")
        String command;

        @Option(names = {"--timeout-seconds"}, description = "Per-command timeout; defaults to the profile timeout")
        Long timeoutSeconds;

        @Option(names = {"--wait-for-restart"}, defaultValue = "false", description = "Wait for the host to come back after the command")
        boolean waitForRestart;

        @Override
        public Integer call() throws Exception {
            try (RelayShellRuntime runtime = parent.runtime()) {
                Duration timeout = timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
                CommandResult result = runtime.execute(parent.server, new io.relayshell.model.Command(command, timeout, waitForRestart));
                System.out.println(Jsons.toJson(view(result)));
                return exitStatus(result);
            }
        }
    }

    @Command(name = "batch", description = "Run several commands on a server")
    static final class BatchCommand implements Callable<Integer> {
        @ParentCommand
        RelayShellCommand parent;

        @Parameters(description = "Command lines, or none with --file")
        List<String> commands;

        @Option(names = {"--file"}, description = "File with one command per line")
        String file;

        @Option(names = {"--mode"}, defaultValue = "SEQUENTIAL", description = "SEQUENTIAL or PIPELINED")
        BatchMode mode;

        @Override
        public Integer call() throws Exception {
            List<String> lines = new ArrayList<>();
            if (commands != null) {
                lines.addAll(commands);
            }
            if (file != null) {
                for (String line : Files.readAllLines(Path.of(file))) {
                    if (!line.isBlank() && !line.trim().startsWith("#")) {
                        lines.add(line.trim());
                    }
                }
            }
            if (lines.isEmpty()) {
                throw new IllegalArgumentException("no commands given");
            }
            try (RelayShellRuntime runtime = parent.runtime()) {
                BatchResult batch = runtime.executeBatch(parent.server, lines, mode);
                List<ResultView> views = batch.ordered().stream().map(RelayShellCommand::view).toList();
                System.out.println(Jsons.toJson(Map.of(
                        "results", views,
                        "succeeded", batch.successCount(),
                        "failed", batch.failureCount(),
                        "totalMs", batch.totalTime().toMillis()
                )));
                return batch.failureCount() == 0 ? 0 : 1;
            }
        }
    }

    @Command(name = "run", description = "Run a named shortcut (ls, cat, df, systemctl, ...)")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        RelayShellCommand parent;

        @Parameters(index = "0", description = "Shortcut name")
        String shortcut;

        @Parameters(index = "1..*", description = "Shortcut arguments")
        List<String> args;

        @Override
        public Integer call() throws Exception {
            io.relayshell.model.Command resolved = CommandShortcuts.resolve(shortcut, args);
            try (RelayShellRuntime runtime = parent.runtime()) {
                CommandResult result = runtime.execute(parent.server, resolved);
                System.out.println(Jsons.toJson(view(result)));
                return exitStatus(result);
            }
        }
    }

    @Command(name = "monitor", description = "Probe a server in the background and print alerts")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        RelayShellCommand parent;

        @Option(names = {"--duration-seconds"}, defaultValue = "0", description = "Stop after this long; 0 runs until interrupted")
        long durationSeconds;

        @Override
        public Integer call() throws Exception {
            try (RelayShellRuntime runtime = parent.runtime()) {
                CountDownLatch stop = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(stop::countDown, "relayshell-shutdown-hook"));
                runtime.startMonitoring(parent.server);
                long deadline = durationSeconds > 0 ? System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds) : Long.MAX_VALUE;
                while (!stop.await(1L, TimeUnit.SECONDS) && System.nanoTime() < deadline) {
                    for (Alert alert : runtime.getAlerts()) {
                        System.out.println(Jsons.toJson(alert));
                    }
                }
                runtime.stopMonitoring(parent.server);
                for (Alert alert : runtime.getAlerts()) {
                    System.out.println(Jsons.toJson(alert));
                }
                if (runtime.droppedAlerts() > 0) {
                    System.out.println(Jsons.toJson(Map.of("droppedAlerts", runtime.droppedAlerts())));
                }
                return 0;
            }
        }
    }

    @Command(name = "serve-agent", description = "Run the remote agent that executes commands")
    static final class ServeAgentCommand implements Callable<Integer> {
        @ParentCommand
        RelayShellCommand parent;

        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind address")
        String bind;

        @Option(names = {"--port"}, defaultValue = "443", description = "Listen port")
        int port;

        @Option(names = {"--disguise"}, defaultValue = "true", negatable = true, description = "Shape traffic as HTTPS requests and responses")
        boolean disguise;

        @Option(names = {"--keystore"}, description = "PKCS12 keystore for TLS; plain TCP when absent")
        String keystore;

        @Option(names = {"--keystore-password"}, defaultValue = "", description = "Keystore password")
        String keystorePassword;

        @Option(names = {"--workers"}, defaultValue = "8", description = "Command worker threads")
        int workers;

        @Override
        public Integer call() throws Exception {
            KeyFileCredentialSource.KeyFile keyFile = KeyFileCredentialSource.readKeyFile(Path.of(parent.keys));
            SSLContext tls = keystore == null ? null : TransportTls.agentContext(keystore, keystorePassword, "PKCS12").sslContext();
            RemoteAgentServer.Options options = new RemoteAgentServer.Options(bind, port, disguise, tls, workers);
            try (RemoteAgentServer agent = new RemoteAgentServer(
                    options,
                    keyFile.keyPair(),
                    keyFile.toAuthorizedKeys(),
                    new ShellCommandExecutor(),
                    HostStatusProbe.system()
            )) {
                agent.start();
                System.out.println(Jsons.toJson(Map.of(
                        "port", agent.port(),
                        "hostKeyFingerprint", KeyMaterial.fingerprint(keyFile.keyPair().getPublic())
                )));
                awaitShutdown();
            }
            return 0;
        }
    }

    @Command(name = "serve-relay", description = "Run a transparent CONNECT relay hop")
    static final class ServeRelayCommand implements Callable<Integer> {
        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind address")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8443", description = "Listen port")
        int port;

        @Option(names = {"--connect-timeout-seconds"}, defaultValue = "10", description = "Timeout for reaching the next hop")
        long connectTimeoutSeconds;

        @Override
        public Integer call() throws Exception {
            try (RelayServer relay = new RelayServer(bind, port, Duration.ofSeconds(connectTimeoutSeconds))) {
                relay.start();
                System.out.println(Jsons.toJson(Map.of("port", relay.port())));
                awaitShutdown();
            }
            return 0;
        }
    }

    @Command(name = "keygen", description = "Generate an Ed25519 identity key file")
    static final class KeygenCommand implements Callable<Integer> {
        @Option(names = {"--identity"}, required = true, description = "Identity name")
        String identity;

        @Option(names = {"--out"}, required = true, description = "Key file to write")
        String out;

        @Option(names = {"--force"}, defaultValue = "false", description = "Overwrite an existing file")
        boolean force;

        @Override
        public Integer call() throws Exception {
            Path target = Path.of(out);
            if (Files.exists(target) && !force) {
                throw new IllegalArgumentException("refusing to overwrite " + target + " (use --force)");
            }
            KeyFileCredentialSource.KeyFile keyFile = KeyFileCredentialSource.KeyFile.generate(identity);
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Jsons.mapper().writeValue(target.toFile(), keyFile);
            System.out.println(Jsons.toJson(Map.of(
                    "identity", identity,
                    "publicKey", keyFile.publicKey(),
                    "fingerprint", KeyMaterial.fingerprint(keyFile.keyPair().getPublic()),
                    "file", target.toAbsolutePath().toString()
            )));
            return 0;
        }
    }

    private static void awaitShutdown() throws InterruptedException {
        CountDownLatch stop = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(stop::countDown, "relayshell-shutdown-hook"));
        stop.await();
    }

    record ResultView(String command, String stdout, String stderr, int exitCode, long durationMs, String error) {
    }
}
