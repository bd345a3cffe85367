package io.relayshell.monitor;

import io.relayshell.model.Alert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded alert buffer. Producers never block: when full, the oldest alert is discarded and the
 * dropped counter advances.
 */
public final class AlertQueue implements Consumer<Alert> {
    private final int capacity;
    private final ArrayDeque<Alert> alerts;
    private final AtomicLong dropped = new AtomicLong();

    public AlertQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("alert queue capacity must be >= 1");
        }
        this.capacity = capacity;
        this.alerts = new ArrayDeque<>(capacity);
    }

    public void offer(Alert alert) {
        synchronized (alerts) {
            if (alerts.size() >= capacity) {
                alerts.pollFirst();
                dropped.incrementAndGet();
            }
            alerts.addLast(alert);
        }
    }

    @Override
    public void accept(Alert alert) {
        offer(alert);
    }

    /**
     * Removes and returns every buffered alert, oldest first.
     */
    public List<Alert> drain() {
        synchronized (alerts) {
            List<Alert> out = new ArrayList<>(alerts);
            alerts.clear();
            return out;
        }
    }

    public List<Alert> snapshot() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }

    public int size() {
        synchronized (alerts) {
            return alerts.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long dropped() {
        return dropped.get();
    }
}
