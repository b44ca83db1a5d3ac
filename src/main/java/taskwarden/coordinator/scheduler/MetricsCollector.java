package taskwarden.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.model.MetricsSnapshot;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.ResourceSnapshot;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.repository.MetricsRepository;
import taskwarden.coordinator.service.TaskService;
import taskwarden.coordinator.worker.WorkerPool;

import java.time.Duration;
import java.time.Instant;

/**
 * Appends one row to the metrics time series per run and purges expired cached results.
 */
public class MetricsCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final ResourceMonitor monitor;
    private final PriorityTaskQueue queue;
    private final WorkerPool pool;
    private final TaskService taskService;
    private final MetricsRepository metricsRepository;
    private final Instant startedAt;

    public MetricsCollector(ResourceMonitor monitor,
            PriorityTaskQueue queue,
            WorkerPool pool,
            TaskService taskService,
            MetricsRepository metricsRepository,
            Instant startedAt) {
        this.monitor = monitor;
        this.queue = queue;
        this.pool = pool;
        this.taskService = taskService;
        this.metricsRepository = metricsRepository;
        this.startedAt = startedAt;
    }

    @Override
    public void run() {
        try {
            collect();
        } catch (Exception e) {
            log.error("Metrics collection error", e);
        }
    }

    public MetricsSnapshot collect() {
        ResourceSnapshot resources = monitor.sample();
        Duration uptime = Duration.between(startedAt, Instant.now());

        MetricsSnapshot snapshot = new MetricsSnapshot(
                Instant.now(),
                resources.cpuPercent(),
                resources.memoryPercent(),
                pool.liveCount(),
                queue.size(),
                taskService.tasksPerMinute(uptime),
                monitor.shouldThrottle());

        metricsRepository.append(snapshot);
        int purged = queue.purgeExpiredResults();

        log.info("Metrics: workers={} queue={} tasks/min={} throttling={} (purged {} expired results)",
                snapshot.activeWorkers(), snapshot.queueSize(), String.format("%.2f", snapshot.tasksPerMinute()),
                snapshot.throttling(), purged);
        return snapshot;
    }
}
