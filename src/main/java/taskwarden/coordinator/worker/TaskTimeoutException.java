package taskwarden.coordinator.worker;

/**
 * A handler ran past the task's timeout and was cancelled.
 */
public class TaskTimeoutException extends Exception {

    public TaskTimeoutException(int timeoutSeconds) {
        super("Task timed out after " + timeoutSeconds + "s");
    }
}
