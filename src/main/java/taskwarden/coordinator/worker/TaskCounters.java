package taskwarden.coordinator.worker;

import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide task counters shared by the supervisor and its workers.
 */
public final class TaskCounters {

    private final LongAdder queued = new LongAdder();
    private final LongAdder completed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final LongAdder throttleEvents = new LongAdder();

    public void taskQueued() {
        queued.increment();
    }

    public void taskCompleted() {
        completed.increment();
    }

    public void taskFailed() {
        failed.increment();
    }

    public void taskRetried() {
        retried.increment();
    }

    public void throttled() {
        throttleEvents.increment();
    }

    public long queued() {
        return queued.sum();
    }

    public long completed() {
        return completed.sum();
    }

    public long failed() {
        return failed.sum();
    }

    public long retried() {
        return retried.sum();
    }

    public long throttleEvents() {
        return throttleEvents.sum();
    }
}
