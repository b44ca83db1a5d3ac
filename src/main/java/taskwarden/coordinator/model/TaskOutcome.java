package taskwarden.coordinator.model;

/**
 * Result of one execution attempt by a worker.
 */
public enum TaskOutcome {
    /** Handler returned normally */
    COMPLETED,

    /** Handler failed and the task was re-enqueued with backoff */
    RETRY_SCHEDULED,

    /** Handler failed with no retry budget left, or the retry could not be enqueued */
    FAILED,

    /** No handler registered under the task's function name - never retried */
    UNKNOWN_HANDLER
}
