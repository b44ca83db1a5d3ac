package taskwarden.coordinator.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.StubSystemProbe;
import taskwarden.coordinator.queue.InMemoryPriorityTaskQueue;
import taskwarden.coordinator.repository.RecordingMetricsRepository;
import taskwarden.coordinator.repository.RecordingTaskRepository;
import taskwarden.coordinator.service.TaskService;
import taskwarden.coordinator.worker.HandlerRegistry;
import taskwarden.coordinator.worker.TaskCounters;
import taskwarden.coordinator.worker.Worker;
import taskwarden.coordinator.worker.WorkerPool;

import java.time.Duration;
import java.time.Instant;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private WorkerPool pool;
    private RecordingMetricsRepository metrics;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withPollTimeout(Duration.ofMillis(50))
                .withSampleCacheTtl(Duration.ZERO)
                .withAutoscaleInterval(Duration.ofMillis(50))
                .withMetricsInterval(Duration.ofMillis(50))
                .withTaskReaperInterval(Duration.ofMillis(50));
        ResourceMonitor monitor = new ResourceMonitor(StubSystemProbe.idle(4), config);
        InMemoryPriorityTaskQueue queue = new InMemoryPriorityTaskQueue();
        RecordingTaskRepository repository = new RecordingTaskRepository();
        TaskService taskService = new TaskService(repository, config);
        TaskCounters counters = new TaskCounters();
        metrics = new RecordingMetricsRepository();
        pool = new WorkerPool("node-sched",
                id -> new Worker(id, queue, monitor, new HandlerRegistry(), taskService, counters, config));

        scheduler = new Scheduler(
                new Autoscaler(monitor, pool, config),
                new MetricsCollector(monitor, queue, pool, taskService, metrics, Instant.now()),
                new TaskReaper(repository, queue, pool, counters, config),
                config);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        pool.stopAll(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Background loops run on their intervals until stopped")
    void runsLoops() {
        scheduler.start();
        assertTrue(scheduler.isRunning());

        await().atMost(Duration.ofSeconds(5)).until(() -> metrics.size() >= 2 && pool.liveCount() == 3);

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        int rows = metrics.size();
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> metrics.size() == rows);
    }

    @Test
    @DisplayName("Starting twice keeps a single schedule")
    void startTwice() {
        scheduler.start();
        scheduler.start();

        assertTrue(scheduler.isRunning());
    }
}
