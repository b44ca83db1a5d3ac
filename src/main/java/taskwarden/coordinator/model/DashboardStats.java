package taskwarden.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Point-in-time view of the scheduler, grouped the way the dashboard prints it.
 */
public record DashboardStats(
        @JsonProperty("system") SystemStats system,
        @JsonProperty("workers") WorkerStats workers,
        @JsonProperty("tasks") TaskStats tasks,
        @JsonProperty("performance") PerformanceStats performance) {

    public record SystemStats(
            @JsonProperty("uptime_minutes") double uptimeMinutes,
            @JsonProperty("cpu_percent") double cpuPercent,
            @JsonProperty("memory_percent") double memoryPercent,
            @JsonProperty("memory_available_gb") double memoryAvailableGb,
            @JsonProperty("load_average") double loadAverage,
            @JsonProperty("disk_free_gb") double diskFreeGb) {
    }

    public record WorkerStats(
            @JsonProperty("active") int active,
            @JsonProperty("dead") int dead,
            @JsonProperty("total") int total) {
    }

    public record TaskStats(
            @JsonProperty("queue_size") int queueSize,
            @JsonProperty("total_queued") long totalQueued,
            @JsonProperty("total_completed") long totalCompleted,
            @JsonProperty("total_failed") long totalFailed,
            @JsonProperty("total_retried") long totalRetried,
            @JsonProperty("tasks_per_minute") double tasksPerMinute,
            @JsonProperty("avg_execution_time") double avgExecutionTime,
            @JsonProperty("recent_by_status") Map<String, Integer> recentByStatus) {
    }

    public record PerformanceStats(
            @JsonProperty("success_rate") double successRate,
            @JsonProperty("is_throttling") boolean throttling,
            @JsonProperty("throttle_events") long throttleEvents,
            @JsonProperty("recommended_workers") int recommendedWorkers,
            @JsonProperty("queue_shared") boolean queueShared) {
    }
}
