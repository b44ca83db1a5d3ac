package taskwarden.coordinator.model;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Built but not yet handed to the queue */
    PENDING,
    /** Persisted and waiting in the queue */
    QUEUED,
    /** Dequeued by exactly one worker and executing */
    RUNNING,
    /** Handler returned normally */
    COMPLETED,
    /** Terminal failure, retry budget exhausted or handler unknown */
    FAILED,
    /** Handler failed, task re-enqueued with backoff */
    RETRY,
    /** Removed from the queue before any worker picked it up */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
