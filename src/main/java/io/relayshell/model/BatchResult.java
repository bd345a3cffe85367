package io.relayshell.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of a batch, iterated in submission order regardless of completion order.
 */
public final class BatchResult {
    private final Map<BatchKey, CommandResult> results;
    private final Duration totalTime;

    public BatchResult(Map<BatchKey, CommandResult> results, Duration totalTime) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.totalTime = totalTime == null ? Duration.ZERO : totalTime;
    }

    /**
     * Builds a batch from results listed in submission order.
     */
    public static BatchResult ofOrdered(List<CommandResult> ordered, Duration totalTime) {
        LinkedHashMap<BatchKey, CommandResult> map = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            CommandResult result = ordered.get(i);
            map.put(new BatchKey(result.command(), i), result);
        }
        return new BatchResult(map, totalTime);
    }

    public Map<BatchKey, CommandResult> results() {
        return results;
    }

    public List<CommandResult> ordered() {
        return List.copyOf(results.values());
    }

    public CommandResult get(String command, int ordinal) {
        return results.get(new BatchKey(command, ordinal));
    }

    public int size() {
        return results.size();
    }

    public long successCount() {
        return results.values().stream().filter(CommandResult::succeeded).count();
    }

    public long failureCount() {
        return size() - successCount();
    }

    public Duration totalTime() {
        return totalTime;
    }
}
