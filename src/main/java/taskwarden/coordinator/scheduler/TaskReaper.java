package taskwarden.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.repository.TaskRepository;
import taskwarden.coordinator.worker.TaskCounters;
import taskwarden.coordinator.worker.WorkerPool;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers RUNNING tasks whose worker is gone.
 *
 * Tasks can get stuck if:
 * - A worker thread dies from an Error while executing
 * - The process holding the task was killed
 * - A handler hangs past its timeout and ignores interruption
 *
 * A RUNNING task is reclaimed when its worker belongs to this pool and is no
 * longer running, or when it has been running longer than its timeout plus
 * the stuck threshold (whoever owns it). Reclaimed tasks with retry budget
 * left are re-enqueued as RETRY; the rest are marked FAILED.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    static final String LOST_WORKER_ERROR = "Worker lost while running task";

    private final TaskRepository taskRepository;
    private final PriorityTaskQueue queue;
    private final WorkerPool pool;
    private final TaskCounters counters;
    private final CoordinatorConfig config;

    public TaskReaper(TaskRepository taskRepository,
            PriorityTaskQueue queue,
            WorkerPool pool,
            TaskCounters counters,
            CoordinatorConfig config) {
        this.taskRepository = taskRepository;
        this.queue = queue;
        this.pool = pool;
        this.counters = counters;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find and recover abandoned RUNNING tasks.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        List<Task> running = taskRepository.findRunning();
        if (running.isEmpty()) {
            log.debug("No running tasks to check");
            return 0;
        }

        Instant now = Instant.now();
        int retried = 0;
        int failed = 0;

        for (Task task : running) {
            if (!isAbandoned(task, now)) {
                continue;
            }
            try {
                if (requeue(task, now)) {
                    retried++;
                } else {
                    failed++;
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        if (retried + failed > 0) {
            log.info("Task reaper: {} retried, {} failed, {} running checked", retried, failed, running.size());
        }
        return retried + failed;
    }

    private boolean isAbandoned(Task task, Instant now) {
        String workerId = task.workerId();
        if (pool.owns(workerId) && !pool.isRunning(workerId)) {
            return true;
        }
        if (task.startedAt() == null) {
            return false;
        }
        Duration lease = Duration.ofSeconds(task.timeoutSeconds()).plus(config.taskStuckThreshold());
        return task.startedAt().plus(lease).isBefore(now);
    }

    /**
     * @return true if re-enqueued, false if marked FAILED
     */
    private boolean requeue(Task task, Instant now) {
        if (task.canRetry()) {
            Task retry = task.toBuilder()
                    .status(TaskStatus.RETRY)
                    .retryCount(task.retryCount() + 1)
                    .scheduledTime(now)
                    .error(LOST_WORKER_ERROR + " " + task.workerId())
                    .build();
            taskRepository.save(retry);
            if (queue.put(retry)) {
                counters.taskRetried();
                log.info("Reaped task {} from worker {} for retry (attempt {} of {})",
                        task.id(), task.workerId(), retry.retryCount() + 1, task.maxRetries() + 1);
                return true;
            }
        }

        String reason = task.canRetry()
                ? "retry could not be enqueued"
                : "retries exhausted (" + task.retryCount() + "/" + task.maxRetries() + ")";
        taskRepository.markFailed(task.id(), LOST_WORKER_ERROR + " " + task.workerId() + " - " + reason);
        counters.taskFailed();
        log.warn("Task {} permanently failed after losing worker {}", task.id(), task.workerId());
        return false;
    }
}
