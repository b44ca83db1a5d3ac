package taskwarden.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.model.SubmitOptions;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.repository.TaskRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for task records.
 * Builds validated tasks for submission and keeps the durable store in step
 * with worker transitions.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final CoordinatorConfig config;

    public TaskService(TaskRepository taskRepository, CoordinatorConfig config) {
        this.taskRepository = taskRepository;
        this.config = config;
    }

    /**
     * Build a QUEUED task with a fresh id.
     *
     * @throws IllegalArgumentException on invalid input
     */
    public Task newTask(String name, String function, List<Object> args, Map<String, Object> kwargs,
            TaskPriority priority, SubmitOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("function is required");
        }
        SubmitOptions opts = options != null ? options : SubmitOptions.defaults();
        int maxRetries = opts.maxRetries() != null ? opts.maxRetries() : config.defaultMaxRetries();
        int timeout = opts.timeoutSeconds() != null ? opts.timeoutSeconds() : config.defaultTimeoutSeconds();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }

        return Task.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .function(function)
                .args(args)
                .kwargs(kwargs)
                .priority(priority != null ? priority : TaskPriority.MEDIUM)
                .maxRetries(maxRetries)
                .timeoutSeconds(timeout)
                .scheduledTime(opts.scheduledTime())
                .createdAt(Instant.now())
                .status(TaskStatus.QUEUED)
                .build();
    }

    /**
     * Persist the task's current state.
     *
     * @return false if the store rejected the write (the error is logged)
     */
    public boolean record(Task task) {
        try {
            taskRepository.save(task);
            return true;
        } catch (RuntimeException e) {
            log.error("Could not persist task {} in state {}", task.id(), task.status(), e);
            return false;
        }
    }

    public Optional<Task> findTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        return taskRepository.findById(taskId);
    }

    public boolean markFailed(String taskId, String error) {
        return taskRepository.markFailed(taskId, error);
    }

    public boolean markCancelled(String taskId) {
        boolean updated = taskRepository.updateStatus(taskId, TaskStatus.CANCELLED);
        if (updated) {
            log.info("Task {} cancelled", taskId);
        }
        return updated;
    }

    public List<Task> recentTasks(int limit) {
        return taskRepository.findRecent(limit);
    }

    /**
     * Totals over every task in the store, so all processes sharing it see the same figures.
     */
    public TaskTotals lifetimeTotals() {
        Map<TaskStatus, Integer> counts = taskRepository.countByStatusSince(Instant.EPOCH);
        long submitted = counts.values().stream().mapToLong(Integer::longValue).sum();
        return new TaskTotals(submitted,
                counts.getOrDefault(TaskStatus.COMPLETED, 0),
                counts.getOrDefault(TaskStatus.FAILED, 0));
    }

    /**
     * Task counts per status for tasks created inside the window, keyed by status name.
     */
    public Map<String, Integer> recentByStatus(Duration window) {
        Map<TaskStatus, Integer> counts = taskRepository.countByStatusSince(Instant.now().minus(window));
        Map<String, Integer> named = new LinkedHashMap<>();
        counts.forEach((status, count) -> named.put(status.name().toLowerCase(Locale.ROOT), count));
        return named;
    }

    public double averageExecutionTime(Duration window) {
        return taskRepository.averageExecutionTimeSince(Instant.now().minus(window));
    }

    /**
     * Completed tasks per minute over the throughput window. While the process is
     * younger than the window the rate is taken over its uptime, never less than a minute.
     */
    public double tasksPerMinute(Duration uptime) {
        Duration window = config.throughputWindow();
        Duration span = uptime.compareTo(window) < 0 ? uptime : window;
        double minutes = Math.max(1.0, span.toMillis() / 60_000.0);
        int completed = taskRepository.countCompletedSince(Instant.now().minus(window));
        return completed / minutes;
    }

    /** Submitted, completed and failed task counts. */
    public record TaskTotals(long submitted, long completed, long failed) {

        /** completed / max(submitted, 1) as a percentage */
        public double successRate() {
            return completed * 100.0 / Math.max(submitted, 1);
        }
    }
}
