package taskwarden.coordinator.queue;

import taskwarden.coordinator.model.Task;

import java.time.Duration;
import java.util.Optional;

/**
 * Priority-ordered task queue with a transient result cache.
 *
 * Ordering: lower {@link QueueScore} first, FIFO within a priority tier.
 * Each entry is delivered to at most one caller of {@link #get(Duration)}.
 * Entries carrying a scheduled time are not delivered before it.
 */
public interface PriorityTaskQueue extends AutoCloseable {

    /**
     * Enqueue a task.
     *
     * @return false if the entry could not be stored
     */
    boolean put(Task task);

    /**
     * Remove and return the best eligible entry, waiting up to {@code timeout}.
     */
    Optional<Task> get(Duration timeout);

    /**
     * Number of entries not yet dequeued, including ones waiting for their scheduled time.
     */
    int size();

    /**
     * Remove a still-queued entry.
     *
     * @return true if the entry was in the queue and is now gone
     */
    boolean remove(String taskId);

    void setResult(String taskId, String resultJson, Duration ttl);

    Optional<String> getResult(String taskId);

    /**
     * Drop cached results whose TTL has passed.
     *
     * @return number of results removed
     */
    int purgeExpiredResults();

    /**
     * Whether other processes on the host see the same queue.
     */
    boolean isShared();

    @Override
    default void close() {
    }
}
