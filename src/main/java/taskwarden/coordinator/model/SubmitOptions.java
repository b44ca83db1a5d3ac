package taskwarden.coordinator.model;

import java.time.Instant;

/**
 * Optional per-task overrides at submission. Null fields take the configured defaults.
 */
public record SubmitOptions(Integer maxRetries, Integer timeoutSeconds, Instant scheduledTime) {

    public static SubmitOptions defaults() {
        return new SubmitOptions(null, null, null);
    }

    public SubmitOptions withMaxRetries(int retries) {
        return new SubmitOptions(retries, timeoutSeconds, scheduledTime);
    }

    public SubmitOptions withTimeoutSeconds(int seconds) {
        return new SubmitOptions(maxRetries, seconds, scheduledTime);
    }

    public SubmitOptions withScheduledTime(Instant time) {
        return new SubmitOptions(maxRetries, timeoutSeconds, time);
    }
}
