package io.relayshell.agent;

import io.relayshell.model.HealthSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads metrics from the JVM's platform beans, the root file store and {@code /proc/uptime}.
 * Metrics the platform cannot provide are left out.
 */
final class SystemHostStatusProbe implements HostStatusProbe {
    private static final Logger log = LoggerFactory.getLogger(SystemHostStatusProbe.class);
    private static final Path PROC_UPTIME = Path.of("/proc/uptime");

    @Override
    public Map<String, Double> sample() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage();
        if (load >= 0.0) {
            metrics.put(HealthSample.LOAD_1, load);
        }
        metrics.put(HealthSample.CPU_COUNT, (double) os.getAvailableProcessors());
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            long total = extended.getTotalMemorySize();
            if (total > 0L) {
                metrics.put(HealthSample.MEMORY_USED_PERCENT, percent(total - extended.getFreeMemorySize(), total));
            }
        }
        try {
            FileStore root = Files.getFileStore(Path.of("").toAbsolutePath().getRoot());
            long total = root.getTotalSpace();
            if (total > 0L) {
                metrics.put(HealthSample.DISK_USED_PERCENT, percent(total - root.getUsableSpace(), total));
            }
        } catch (IOException e) {
            log.debug("Disk usage unavailable: {}", e.toString());
        }
        if (Files.isReadable(PROC_UPTIME)) {
            try {
                String raw = Files.readString(PROC_UPTIME, StandardCharsets.US_ASCII).trim();
                metrics.put(HealthSample.UPTIME_SECONDS, Double.parseDouble(raw.split("\\s+")[0]));
            } catch (IOException | NumberFormatException e) {
                log.debug("Uptime unavailable: {}", e.toString());
            }
        }
        return metrics;
    }

    private static double percent(long used, long total) {
        return Math.round(used * 1000.0 / total) / 10.0;
    }
}
