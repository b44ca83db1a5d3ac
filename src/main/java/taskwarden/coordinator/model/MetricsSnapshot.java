package taskwarden.coordinator.model;

import java.time.Instant;

/**
 * One row of the {@code system_metrics} time series.
 */
public record MetricsSnapshot(
        Instant recordedAt,
        double cpuPercent,
        double memoryPercent,
        int activeWorkers,
        int queueSize,
        double tasksPerMinute,
        boolean throttling) {
}
