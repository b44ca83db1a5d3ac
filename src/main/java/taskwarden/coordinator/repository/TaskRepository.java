package taskwarden.coordinator.repository;

import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for durable task records.
 * Implementations can use JDBC or in-memory storage.
 */
public interface TaskRepository {

    /**
     * Insert or replace the record for this task id. Last writer wins.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find every RUNNING task, oldest start first.
     * The reaper applies each task's own lease to these.
     */
    List<Task> findRunning();

    /**
     * Count tasks per status among those created at or after {@code since}.
     * Statuses with no tasks are absent from the map.
     */
    Map<TaskStatus, Integer> countByStatusSince(Instant since);

    /**
     * Count COMPLETED tasks whose completion time is at or after {@code since}.
     */
    int countCompletedSince(Instant since);

    /**
     * Average execution time in seconds of tasks completed at or after {@code since},
     * or 0 when there are none.
     */
    double averageExecutionTimeSince(Instant since);

    /**
     * Mark a task as permanently failed.
     *
     * @return true if the task existed
     */
    boolean markFailed(String taskId, String errorMessage);

    /**
     * Update only the status of a task.
     *
     * @return true if the task existed
     */
    boolean updateStatus(String taskId, TaskStatus status);

    /**
     * Most recently touched tasks, newest first.
     */
    List<Task> findRecent(int limit);
}
