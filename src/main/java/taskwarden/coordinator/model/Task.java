package taskwarden.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of work submitted to the scheduler.
 * Lifecycle transitions produce new instances through {@link #toBuilder()}.
 */
public final class Task {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private final String id;
    private final String name;
    private final String function;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final TaskPriority priority;
    private final int maxRetries;
    private final int retryCount;
    private final int timeoutSeconds;
    private final Instant scheduledTime; // not eligible before this instant, null = immediately
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final TaskStatus status;
    private final String workerId;
    private final Double executionTimeSeconds;
    private final String result; // JSON
    private final String error;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.function = Objects.requireNonNull(builder.function, "function is required");
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (builder.retryCount < 0 || builder.retryCount > builder.maxRetries) {
            throw new IllegalArgumentException(
                    "retryCount " + builder.retryCount + " outside [0, " + builder.maxRetries + "]");
        }
        if (builder.timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
        this.maxRetries = builder.maxRetries;
        this.retryCount = builder.retryCount;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.scheduledTime = builder.scheduledTime;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.workerId = builder.workerId;
        this.executionTimeSeconds = builder.executionTimeSeconds;
        this.result = builder.result;
        this.error = builder.error;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String function() {
        return function;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    public TaskPriority priority() {
        return priority;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int retryCount() {
        return retryCount;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant scheduledTime() {
        return scheduledTime;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public TaskStatus status() {
        return status;
    }

    public String workerId() {
        return workerId;
    }

    public Double executionTimeSeconds() {
        return executionTimeSeconds;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    /** Check if another attempt is allowed after a failure */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Whether the task may be dequeued at the given instant */
    public boolean isDue(Instant now) {
        return scheduledTime == null || !scheduledTime.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .function(function)
                .args(args)
                .kwargs(kwargs)
                .priority(priority)
                .maxRetries(maxRetries)
                .retryCount(retryCount)
                .timeoutSeconds(timeoutSeconds)
                .scheduledTime(scheduledTime)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .status(status)
                .workerId(workerId)
                .executionTimeSeconds(executionTimeSeconds)
                .result(result)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String function;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private TaskPriority priority = TaskPriority.MEDIUM;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private int retryCount = 0;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private Instant scheduledTime;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private TaskStatus status = TaskStatus.PENDING;
        private String workerId;
        private Double executionTimeSeconds;
        private String result;
        private String error;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder args(List<Object> args) {
            this.args = args != null ? args : List.of();
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs != null ? kwargs : Map.of();
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder scheduledTime(Instant scheduledTime) {
            this.scheduledTime = scheduledTime;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder executionTimeSeconds(Double executionTimeSeconds) {
            this.executionTimeSeconds = executionTimeSeconds;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', name='" + name + "', function='" + function + "', priority=" + priority
                + ", status=" + status + ", retry=" + retryCount + "/" + maxRetries + "}";
    }
}
