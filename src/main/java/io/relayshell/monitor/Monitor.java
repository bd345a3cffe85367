package io.relayshell.monitor;

import io.relayshell.config.ServerProfile;
import io.relayshell.error.RelayShellException;
import io.relayshell.model.Alert;
import io.relayshell.model.HealthSample;
import io.relayshell.model.Severity;
import io.relayshell.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Background health probes, one loop thread per monitored profile.
 *
 * <p>Each probe acquires the profile's session and pings it. A failed probe publishes a
 * {@link Severity#CRITICAL} alert; the first healthy probe after a failure publishes an
 * {@link Severity#INFO} recovery alert; every healthy sample is run through the alert rules.
 * Nothing a probe does is thrown back to callers.
 */
public final class Monitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Monitor.class);

    private final SessionRegistry registry;
    private final Consumer<Alert> alerts;
    private final List<AlertRule> rules;
    private final Map<String, Loop> loops = new ConcurrentHashMap<>();
    private final Map<String, HealthSample> latest = new ConcurrentHashMap<>();

    public Monitor(SessionRegistry registry, Consumer<Alert> alerts, List<AlertRule> rules) {
        this.registry = registry;
        this.alerts = alerts;
        this.rules = new CopyOnWriteArrayList<>(rules);
    }

    public void addRule(AlertRule rule) {
        rules.add(rule);
    }

    /**
     * Starts the loop for {@code profile}.
     *
     * @return {@code false} when the profile is already monitored
     */
    public boolean start(ServerProfile profile) {
        synchronized (loops) {
            if (loops.containsKey(profile.name())) {
                return false;
            }
            Loop loop = new Loop(profile);
            loops.put(profile.name(), loop);
            loop.thread.start();
        }
        log.info("Monitoring {} every {}s", profile.name(), profile.monitoringInterval().toSeconds());
        return true;
    }

    /**
     * Stops the loop for {@code name} and waits for its thread to exit. An in-progress probe is
     * allowed to finish first.
     */
    public void stop(String name) {
        Loop loop;
        synchronized (loops) {
            loop = loops.remove(name);
        }
        if (loop == null) {
            return;
        }
        loop.stopSignal.countDown();
        if (Thread.currentThread() == loop.thread) {
            return;
        }
        try {
            loop.thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped monitoring {}", name);
    }

    public void stopAll() {
        List<String> names;
        synchronized (loops) {
            names = new ArrayList<>(loops.keySet());
        }
        for (String name : names) {
            stop(name);
        }
    }

    public boolean isRunning(String name) {
        return loops.containsKey(name);
    }

    public Set<String> running() {
        return new TreeSet<>(loops.keySet());
    }

    public Optional<HealthSample> lastSample(String name) {
        return Optional.ofNullable(latest.get(name));
    }

    @Override
    public void close() {
        stopAll();
    }

    private void runLoop(Loop loop) {
        long intervalMs = loop.profile.monitoringInterval().toMillis();
        try {
            do {
                probe(loop);
            } while (!loop.stopSignal.await(intervalMs, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void probe(Loop loop) {
        String name = loop.profile.name();
        try {
            HealthSample sample = registry.acquire(loop.profile).ping(loop.profile.timeout());
            latest.put(name, sample);
            if (loop.unreachable) {
                loop.unreachable = false;
                publish(loop, Alert.now(Severity.INFO, name, name + " recovered"));
            }
            for (AlertRule rule : rules) {
                try {
                    rule.evaluate(sample).ifPresent(alert -> publish(loop, alert));
                } catch (RuntimeException e) {
                    log.warn("Alert rule failed for {}: {}", name, e.toString());
                }
            }
        } catch (RelayShellException e) {
            loop.unreachable = true;
            publish(loop, Alert.now(Severity.CRITICAL, name, name + " unreachable: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Probe of {} failed unexpectedly", name, e);
        }
    }

    private void publish(Loop loop, Alert alert) {
        if (loop.stopSignal.getCount() == 0L) {
            return;
        }
        log.debug("Alert {} for {}: {}", alert.severity(), alert.serverName(), alert.message());
        alerts.accept(alert);
    }

    private final class Loop {
        private final ServerProfile profile;
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final Thread thread;
        private volatile boolean unreachable;

        private Loop(ServerProfile profile) {
            this.profile = profile;
            this.thread = new Thread(() -> runLoop(this), "relayshell-monitor-" + profile.name());
            this.thread.setDaemon(true);
        }
    }
}
