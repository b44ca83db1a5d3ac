package taskwarden.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Versioned JSON form of a task as it travels through the queue and sits in
 * the {@code payload} column. Timestamps are epoch milliseconds so that any
 * consumer can read the envelope without a date library.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskEnvelope(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("function") String function,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("timeoutSeconds") int timeoutSeconds,
        @JsonProperty("scheduledTime") Long scheduledTime,
        @JsonProperty("createdAt") Long createdAt) {

    public static final int CURRENT_VERSION = 1;

    public static TaskEnvelope from(Task task) {
        return new TaskEnvelope(
                CURRENT_VERSION,
                task.id(),
                task.name(),
                task.function(),
                task.args(),
                task.kwargs(),
                task.priority().name(),
                task.status().name(),
                task.maxRetries(),
                task.retryCount(),
                task.timeoutSeconds(),
                toMillis(task.scheduledTime()),
                toMillis(task.createdAt()));
    }

    public Task toTask() {
        if (schemaVersion > CURRENT_VERSION) {
            throw new IllegalArgumentException(
                    "Unsupported task envelope version " + schemaVersion + " (max " + CURRENT_VERSION + ")");
        }
        if (id == null || name == null || function == null || priority == null) {
            throw new IllegalArgumentException("Incomplete task envelope: id, name, function and priority are required");
        }
        return Task.builder()
                .id(id)
                .name(name)
                .function(function)
                .args(args)
                .kwargs(kwargs)
                .priority(TaskPriority.valueOf(priority))
                .status(status != null ? TaskStatus.valueOf(status) : TaskStatus.QUEUED)
                .maxRetries(maxRetries)
                .retryCount(retryCount)
                .timeoutSeconds(timeoutSeconds)
                .scheduledTime(toInstant(scheduledTime))
                .createdAt(toInstant(createdAt))
                .build();
    }

    private static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant toInstant(Long millis) {
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }
}
