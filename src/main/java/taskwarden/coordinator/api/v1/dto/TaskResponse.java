package taskwarden.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import taskwarden.coordinator.model.Task;

import java.time.Instant;

/**
 * Response DTO for a task's durable record.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("function") String function,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("scheduledTime") String scheduledTime,
        @JsonProperty("startedAt") String startedAt,
        @JsonProperty("completedAt") String completedAt,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("executionTime") Double executionTime,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("error") String error,
        @JsonProperty("result") @JsonRawValue String result) {

    public static TaskResponse from(Task task, String result) {
        return new TaskResponse(
                task.id(),
                task.name(),
                task.function(),
                task.priority().name(),
                task.status().name(),
                format(task.createdAt()),
                format(task.scheduledTime()),
                format(task.startedAt()),
                format(task.completedAt()),
                task.workerId(),
                task.executionTimeSeconds(),
                task.retryCount(),
                task.maxRetries(),
                task.error(),
                result);
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
