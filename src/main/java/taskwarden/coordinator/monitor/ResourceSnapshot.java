package taskwarden.coordinator.monitor;

import java.time.Instant;

/**
 * Host resource usage at one instant. Percentages are in [0, 100].
 */
public record ResourceSnapshot(
        Instant sampledAt,
        double cpuPercent,
        double memoryPercent,
        long memoryAvailableBytes,
        double diskPercent,
        long diskFreeBytes,
        double loadAverage,
        long processCount) {

    private static final double GB = 1024.0 * 1024.0 * 1024.0;

    public double memoryAvailableGb() {
        return memoryAvailableBytes / GB;
    }

    public double diskFreeGb() {
        return diskFreeBytes / GB;
    }
}
