package io.relayshell.restart;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.ConnectionLostException;
import io.relayshell.error.RelayShellException;
import io.relayshell.error.RequestTimeoutException;
import io.relayshell.error.RestartTimeoutException;
import io.relayshell.model.Command;
import io.relayshell.model.CommandResult;
import io.relayshell.session.Session;
import io.relayshell.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Runs a command that is expected to take the remote agent down (a service or host restart) and
 * waits for the host to come back.
 *
 * <p>The drop that follows submission is tolerated. The cached session is evicted, then a fresh
 * single-attempt probe session is connected and pinged every poll interval until one succeeds or
 * {@link ServerProfile#restartMaxWait()} runs out. Probes are always closed; once one succeeds the
 * registry builds the live session again with its own reconnect policy.
 */
public final class RestartCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RestartCoordinator.class);

    public static final Duration MIN_POLL_INTERVAL = Duration.ofSeconds(2);

    private final SessionRegistry registry;
    private final Function<ServerProfile, Session> probeFactory;
    private final Duration pollInterval;

    /**
     * @param probeFactory creates unregistered sessions used for the reconnect probes; they should
     *                     make a single connect attempt each
     * @param pollInterval raised to {@link #MIN_POLL_INTERVAL} when shorter
     */
    public RestartCoordinator(SessionRegistry registry, Function<ServerProfile, Session> probeFactory, Duration pollInterval) {
        this.registry = registry;
        this.probeFactory = probeFactory;
        this.pollInterval = pollInterval == null || pollInterval.compareTo(MIN_POLL_INTERVAL) < 0
                ? MIN_POLL_INTERVAL
                : pollInterval;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * @return a synthetic result whose duration is the observed downtime
     * @throws RestartTimeoutException when the host is still unreachable after the profile's
     *                                 restart window
     */
    public CommandResult executeAndWait(ServerProfile profile, Command command) {
        long started = System.nanoTime();
        CommandResult submitted = null;
        try {
            Session session = registry.acquire(profile);
            submitted = session.execute(command.text(), command.timeoutOr(profile.timeout()));
            log.info("Restart command on {} returned exit code {}", profile.name(), submitted.exitCode());
        } catch (ConnectionLostException | RequestTimeoutException e) {
            log.info("Connection to {} dropped after restart command ({}); waiting for it to return", profile.name(), e.getMessage());
        }
        registry.evict(profile.name());

        long downSince = System.nanoTime();
        Duration maxWait = profile.restartMaxWait();
        int probes = 0;
        while (true) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            Duration remaining = maxWait.minus(elapsed);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new RestartTimeoutException(profile.name(), elapsed, maxWait);
            }
            sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
            probes++;
            Session probe = probeFactory.apply(profile);
            try {
                probe.ensureReady();
                probe.ping(profile.timeout());
            } catch (RelayShellException e) {
                log.debug("Probe {} of {} failed: {}", probes, profile.name(), e.getMessage());
                continue;
            } finally {
                probe.close();
            }
            try {
                registry.acquire(profile);
            } catch (RelayShellException e) {
                log.info("{} answered a probe but the session could not be re-established: {}", profile.name(), e.getMessage());
                continue;
            }
            Duration downtime = Duration.ofNanos(System.nanoTime() - downSince);
            log.info("{} is back after {} probe(s), down for {}ms", profile.name(), probes, downtime.toMillis());
            return backOnline(profile, command, submitted, downtime);
        }
    }

    private static CommandResult backOnline(ServerProfile profile, Command command, CommandResult submitted, Duration downtime) {
        String note = String.format(
                Locale.ROOT,
                "%s reconnected after %.1fs downtime%n",
                profile.name(),
                downtime.toMillis() / 1000.0
        );
        if (submitted == null) {
            return CommandResult.completed(command.text(), note, "", 0, downtime);
        }
        return CommandResult.completed(command.text(), submitted.stdout() + note, submitted.stderr(), submitted.exitCode(), downtime);
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(Math.max(1L, delay.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayShellException("interrupted while waiting for restart", e);
        }
    }
}
