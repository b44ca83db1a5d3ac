package taskwarden.coordinator.queue;

import taskwarden.coordinator.model.TaskPriority;

import java.time.Instant;

/**
 * Ordering key of a queue entry: the priority value plus a fractional submission
 * time. The fraction stays below 1 for any epoch-millisecond timestamp before
 * the year 2286, so a lower tier always sorts ahead of a higher one.
 */
public final class QueueScore {

    private static final double TIME_SCALE = 1e13;

    private QueueScore() {
    }

    public static double of(TaskPriority priority, Instant submittedAt) {
        return priority.value() + submittedAt.toEpochMilli() / TIME_SCALE;
    }
}
