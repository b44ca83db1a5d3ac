package taskwarden.coordinator.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.monitor.StubSystemProbe;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Two supervisors sharing one database, as two processes on one host would:
 * 1. Producers on both sides submit tasks of every priority
 * 2. Workers of both supervisors drain the shared queue
 * 3. Every task completes exactly once
 * 4. A task left RUNNING by a dead process is recovered by the reaper
 */
class FullFlowIntegrationTest {

    private Dependencies first;
    private Dependencies second;

    private static CoordinatorConfig config(String url) {
        return CoordinatorConfig.defaults()
                .withDatabaseUrl(url)
                .withQueuePollInterval(Duration.ofMillis(20))
                .withPollTimeout(Duration.ofMillis(100))
                .withRetryBackoff(Duration.ZERO)
                .withInterTaskPause(Duration.ZERO)
                .withMaxWorkers(2)
                .withTaskReaperInterval(Duration.ofMillis(200))
                .withTaskStuckThreshold(Duration.ofSeconds(1))
                .withShutdownGrace(Duration.ofSeconds(2));
    }

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:test-flow-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        first = Dependencies.create(config(url), StubSystemProbe.idle(4), 0);
        second = Dependencies.create(config(url), StubSystemProbe.idle(4), 0);
    }

    @AfterEach
    void tearDown() {
        if (first != null) {
            first.close();
        }
        if (second != null) {
            second.close();
        }
    }

    @Test
    @DisplayName("Tasks submitted on either side complete exactly once")
    void sharedQueue() {
        DistributedTaskManager a = first.manager();
        DistributedTaskManager b = second.manager();

        List<String> ids = new ArrayList<>();
        TaskPriority[] priorities = TaskPriority.values();
        for (int i = 0; i < 20; i++) {
            DistributedTaskManager producer = i % 2 == 0 ? a : b;
            ids.add(producer.submitTask("job-" + i, "noop_success", List.of(i), Map.of(),
                    priorities[i % priorities.length]).orElseThrow());
        }
        assertEquals(20, a.queue().size());
        assertEquals(20, b.queue().size());

        a.start(2);
        b.start(2);

        await().atMost(Duration.ofSeconds(20)).until(() -> ids.stream().allMatch(id ->
                a.getTaskStatus(id).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false)));

        await().atMost(Duration.ofSeconds(5)).until(() -> a.counters().completed() + b.counters().completed() == 20);
        assertEquals(0, a.counters().failed() + b.counters().failed());
        assertEquals(0, a.queue().size());
        ids.forEach(id -> assertEquals("{\"ok\":true}", b.getTaskResult(id).orElseThrow()));
    }

    @Test
    @DisplayName("A task left RUNNING by a dead process is retried and completes")
    void recoversAbandonedTask() {
        Task abandoned = Task.builder()
                .id("abandoned-1")
                .name("orphan")
                .function("noop_success")
                .priority(TaskPriority.HIGH)
                .status(TaskStatus.RUNNING)
                .workerId("node-999999-1-worker-1")
                .startedAt(Instant.now().minus(Duration.ofMinutes(1)))
                .timeoutSeconds(1)
                .maxRetries(2)
                .build();
        first.taskRepository().save(abandoned);

        first.manager().start(1);

        await().atMost(Duration.ofSeconds(10)).until(() -> first.manager().getTaskStatus("abandoned-1")
                .map(t -> t.status() == TaskStatus.COMPLETED).orElse(false));

        Task done = first.manager().getTaskStatus("abandoned-1").orElseThrow();
        assertEquals(1, done.retryCount());
        assertTrue(first.manager().workerPool().owns(done.workerId()));
    }
}
