package taskwarden.coordinator.repository;

import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory task store that keeps every saved state, for asserting on transitions.
 */
public class RecordingTaskRepository implements TaskRepository {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final List<Task> saves = Collections.synchronizedList(new ArrayList<>());

    public List<Task> saves() {
        synchronized (saves) {
            return List.copyOf(saves);
        }
    }

    public List<TaskStatus> statusesOf(String taskId) {
        return saves().stream().filter(t -> t.id().equals(taskId)).map(Task::status).toList();
    }

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
        saves.add(task);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findRunning() {
        return tasks.values().stream().filter(t -> t.status() == TaskStatus.RUNNING).toList();
    }

    @Override
    public Map<TaskStatus, Integer> countByStatusSince(Instant since) {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        tasks.values().stream()
                .filter(t -> !t.createdAt().isBefore(since))
                .forEach(t -> counts.merge(t.status(), 1, Integer::sum));
        return counts;
    }

    @Override
    public int countCompletedSince(Instant since) {
        return (int) tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .filter(t -> t.completedAt() != null && !t.completedAt().isBefore(since))
                .count();
    }

    @Override
    public double averageExecutionTimeSince(Instant since) {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .filter(t -> t.completedAt() != null && !t.completedAt().isBefore(since))
                .filter(t -> t.executionTimeSeconds() != null)
                .mapToDouble(Task::executionTimeSeconds)
                .average()
                .orElse(0.0);
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        save(task.toBuilder().status(TaskStatus.FAILED).error(errorMessage).completedAt(Instant.now()).build());
        return true;
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        save(task.toBuilder().status(status).build());
        return true;
    }

    @Override
    public List<Task> findRecent(int limit) {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::createdAt).reversed())
                .limit(limit)
                .toList();
    }
}
