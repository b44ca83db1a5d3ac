package taskwarden.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskCodec;
import taskwarden.coordinator.model.TaskOutcome;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.service.TaskService;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Executes queued tasks one at a time.
 * Loop: throttle check → dequeue → RUNNING → handler → COMPLETED | RETRY | FAILED → persist.
 *
 * {@link #requestStop()} lets the current task finish; interruption stops the loop at once.
 * A handler exception never ends the loop; only a {@link VirtualMachineError} escapes it.
 */
public final class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);

    private final String workerId;
    private final PriorityTaskQueue queue;
    private final ResourceMonitor monitor;
    private final HandlerRegistry handlers;
    private final TaskService taskService;
    private final TaskCounters counters;
    private final CoordinatorConfig config;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean stopRequested = false;
    private volatile Task currentTask;
    private ExecutorService handlerExecutor;

    public Worker(String workerId,
            PriorityTaskQueue queue,
            ResourceMonitor monitor,
            HandlerRegistry handlers,
            TaskService taskService,
            TaskCounters counters,
            CoordinatorConfig config) {
        this.workerId = workerId;
        this.queue = queue;
        this.monitor = monitor;
        this.handlers = handlers;
        this.taskService = taskService;
        this.counters = counters;
        this.config = config;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                try {
                    if (monitor.shouldThrottle()) {
                        counters.throttled();
                        log.debug("Worker {} throttling, host above resource thresholds", workerId);
                        sleep(config.throttleBackoff());
                        continue;
                    }

                    Optional<TaskOutcome> outcome = processNext(config.pollTimeout());
                    if (outcome.isPresent()) {
                        sleep(config.interTaskPause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.warn("Worker {} error: {}", workerId, e.getMessage(), e);
                    try {
                        sleep(ERROR_BACKOFF);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            shutdownExecutor();
            log.info("Worker {} stopped ({} completed, {} failed)", workerId, completed.get(), failed.get());
        }
    }

    /**
     * Dequeue and execute at most one task.
     *
     * @return the outcome, or empty if nothing became available within the timeout
     * @throws InterruptedException if the worker was interrupted while executing
     */
    public Optional<TaskOutcome> processNext(Duration timeout) throws InterruptedException {
        Optional<Task> next = queue.get(timeout);
        if (next.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Worker " + workerId + " interrupted while polling");
            }
            return Optional.empty();
        }
        return Optional.of(execute(next.get()));
    }

    TaskOutcome execute(Task task) throws InterruptedException {
        Instant started = Instant.now();
        Task running = task.toBuilder()
                .status(TaskStatus.RUNNING)
                .workerId(workerId)
                .startedAt(started)
                .completedAt(null)
                .build();
        currentTask = running;
        taskService.record(running);
        log.debug("Worker {} running {}", workerId, running);

        try {
            TaskHandler handler = handlers.resolve(running.function());
            Object result = invoke(handler, running);
            return complete(running, result, started);
        } catch (UnknownHandlerException e) {
            return failUnknown(running, e, started);
        } catch (InterruptedException e) {
            fail(running, "Worker " + workerId + " interrupted during execution", started);
            throw e;
        } catch (Exception e) {
            return fail(running, describe(e), started);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // linkage and assertion errors from handler code fail the task, not the worker
            log.error("Handler {} of task {} threw {}", running.function(), running.id(), e.toString(), e);
            return fail(running, describe(e), started);
        } finally {
            currentTask = null;
        }
    }

    private Object invoke(TaskHandler handler, Task task) throws Exception {
        if (!config.enforceTimeouts()) {
            return callHandler(handler, task);
        }

        Future<Object> future = executor().submit(() -> callHandler(handler, task));
        try {
            return future.get(task.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            // the old thread may ignore the interrupt, so it is abandoned
            replaceExecutor();
            throw new TaskTimeoutException(task.timeoutSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private Object callHandler(TaskHandler handler, Task task) throws Exception {
        Thread thread = Thread.currentThread();
        int previous = thread.getPriority();
        if (task.priority().isBackground()) {
            thread.setPriority(Thread.MIN_PRIORITY);
        }
        try {
            return handler.execute(task.args(), task.kwargs());
        } finally {
            thread.setPriority(previous);
        }
    }

    private TaskOutcome complete(Task running, Object result, Instant started) {
        Instant now = Instant.now();
        String json = TaskCodec.resultToJson(result);
        Task done = running.toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(now)
                .executionTimeSeconds(elapsedSeconds(started, now))
                .result(json)
                .error(null)
                .build();

        try {
            queue.setResult(done.id(), json, config.resultTtl());
        } catch (RuntimeException e) {
            log.warn("Could not cache result of task {}: {}", done.id(), e.getMessage());
        }
        taskService.record(done);

        completed.incrementAndGet();
        counters.taskCompleted();
        log.info("Task {} ({}) completed by {} in {}s", done.id(), done.name(), workerId,
                String.format("%.3f", done.executionTimeSeconds()));
        return TaskOutcome.COMPLETED;
    }

    private TaskOutcome failUnknown(Task running, UnknownHandlerException e, Instant started) {
        Instant now = Instant.now();
        Task dead = running.toBuilder()
                .status(TaskStatus.FAILED)
                .completedAt(now)
                .executionTimeSeconds(elapsedSeconds(started, now))
                .error(e.getMessage())
                .build();
        taskService.record(dead);

        failed.incrementAndGet();
        counters.taskFailed();
        log.error("Task {} ({}) failed: {}", dead.id(), dead.name(), e.getMessage());
        return TaskOutcome.UNKNOWN_HANDLER;
    }

    private TaskOutcome fail(Task running, String error, Instant started) {
        Instant now = Instant.now();
        double elapsed = elapsedSeconds(started, now);

        if (running.canRetry()) {
            int attempt = running.retryCount() + 1;
            Duration backoff = config.retryBackoff().multipliedBy(attempt);
            Task retry = running.toBuilder()
                    .status(TaskStatus.RETRY)
                    .retryCount(attempt)
                    .scheduledTime(now.plus(backoff))
                    .executionTimeSeconds(elapsed)
                    .error(error)
                    .build();

            // persist before re-enqueueing so a fast consumer's RUNNING write lands last
            taskService.record(retry);
            if (queue.put(retry)) {
                counters.taskRetried();
                log.warn("Task {} ({}) failed on attempt {}/{}, retrying in {}s: {}", retry.id(), retry.name(),
                        attempt, retry.maxRetries() + 1, backoff.toSeconds(), error);
                return TaskOutcome.RETRY_SCHEDULED;
            }
            error = error + " (retry could not be enqueued)";
        }

        Task dead = running.toBuilder()
                .status(TaskStatus.FAILED)
                .completedAt(now)
                .executionTimeSeconds(elapsed)
                .error(error)
                .build();
        taskService.record(dead);

        failed.incrementAndGet();
        counters.taskFailed();
        log.error("Task {} ({}) failed permanently after {} retries: {}", dead.id(), dead.name(),
                dead.retryCount(), error);
        return TaskOutcome.FAILED;
    }

    private ExecutorService executor() {
        if (handlerExecutor == null) {
            handlerExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, workerId + "-exec");
                t.setDaemon(true);
                return t;
            });
        }
        return handlerExecutor;
    }

    private void replaceExecutor() {
        if (handlerExecutor != null) {
            handlerExecutor.shutdownNow();
            handlerExecutor = null;
        }
    }

    private void shutdownExecutor() {
        if (handlerExecutor != null) {
            handlerExecutor.shutdownNow();
            handlerExecutor = null;
        }
    }

    private static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private static double elapsedSeconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1_000_000_000.0;
    }

    private static String describe(Throwable e) {
        if (e instanceof TaskTimeoutException) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    /** Ask the worker to exit after the task it is running, if any. */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public String workerId() {
        return workerId;
    }

    /** Task being executed right now, or null when idle. */
    public Task currentTask() {
        return currentTask;
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
