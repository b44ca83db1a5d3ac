package taskwarden.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates the supervisor's background loops:
 * - Autoscaler: resizes the worker pool to the resource recommendation
 * - MetricsCollector: records a system_metrics row
 * - TaskReaper: recovers RUNNING tasks whose worker is gone
 *
 * Uses a single-threaded executor so the loops never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Autoscaler autoscaler;
    private final MetricsCollector metricsCollector;
    private final TaskReaper taskReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(Autoscaler autoscaler, MetricsCollector metricsCollector, TaskReaper taskReaper,
            CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskwarden-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.autoscaler = autoscaler;
        this.metricsCollector = metricsCollector;
        this.taskReaper = taskReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        schedule("autoscaler", autoscaler, config.autoscaleInterval());
        schedule("metrics-collector", metricsCollector, config.metricsInterval());
        schedule("task-reaper", taskReaper, config.taskReaperInterval());

        log.info("Scheduler started");
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable(name, task),
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public Autoscaler autoscaler() {
        return autoscaler;
    }

    public MetricsCollector metricsCollector() {
        return metricsCollector;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
