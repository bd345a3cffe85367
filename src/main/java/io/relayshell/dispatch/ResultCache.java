package io.relayshell.dispatch;

import io.relayshell.model.CommandResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent command results per server, reused until they are older than the time-to-live. Only
 * results that came back without a protocol error are stored.
 */
public final class ResultCache {
    private final Duration ttl;
    private final Clock clock;
    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    public ResultCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public ResultCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("cache ttl must be positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<CommandResult> get(String server, String command) {
        Key key = new Key(server, command);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (expired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    public void put(String server, CommandResult result) {
        if (result.hasProtocolError()) {
            return;
        }
        Instant now = clock.instant();
        entries.values().removeIf(entry -> expired(entry, now));
        entries.put(new Key(server, result.command()), new Entry(result, now));
    }

    public void invalidate(String server) {
        entries.keySet().removeIf(key -> key.server().equals(server));
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean expired(Entry entry, Instant now) {
        return !entry.storedAt().plus(ttl).isAfter(now);
    }

    private record Key(String server, String command) {
    }

    private record Entry(CommandResult result, Instant storedAt) {
    }
}
