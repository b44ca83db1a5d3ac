package taskwarden.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskwarden.coordinator.model.SubmitOptions;
import taskwarden.coordinator.model.TaskPriority;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 *
 * {@code priority} accepts a level name ("HIGH") or its number ("2"); {@code scheduledTime}
 * is an ISO-8601 instant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitTaskRequest(
        @JsonProperty("name") String name,
        @JsonProperty("function") String function,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("priority") String priority,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("scheduledTime") String scheduledTime) {

    /** Validate the request */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("function is required");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
        taskPriority();
        options();
    }

    public TaskPriority taskPriority() {
        return priority == null || priority.isBlank() ? TaskPriority.MEDIUM : TaskPriority.parse(priority);
    }

    public SubmitOptions options() {
        Instant when = null;
        if (scheduledTime != null && !scheduledTime.isBlank()) {
            try {
                when = Instant.parse(scheduledTime.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("scheduledTime must be an ISO-8601 instant: " + scheduledTime);
            }
        }
        return new SubmitOptions(maxRetries, timeoutSeconds, when);
    }
}
