package taskwarden.coordinator.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskOutcome;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.StubSystemProbe;
import taskwarden.coordinator.queue.InMemoryPriorityTaskQueue;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.repository.RecordingTaskRepository;
import taskwarden.coordinator.service.TaskService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    private CoordinatorConfig config;
    private PriorityTaskQueue queue;
    private StubSystemProbe probe;
    private ResourceMonitor monitor;
    private HandlerRegistry handlers;
    private RecordingTaskRepository repository;
    private TaskService taskService;
    private TaskCounters counters;
    private Worker worker;

    @BeforeEach
    void setUp() {
        config = CoordinatorConfig.defaults()
                .withRetryBackoff(Duration.ZERO)
                .withThrottleBackoff(Duration.ofMillis(20))
                .withInterTaskPause(Duration.ZERO)
                .withPollTimeout(Duration.ofMillis(50))
                .withSampleCacheTtl(Duration.ZERO);
        queue = new InMemoryPriorityTaskQueue();
        probe = StubSystemProbe.idle(4);
        monitor = new ResourceMonitor(probe, config);
        handlers = new HandlerRegistry()
                .register("noop_success", (args, kwargs) -> Map.of("ok", true))
                .register("always_fail", (args, kwargs) -> {
                    throw new IllegalStateException("always_fail handler invoked");
                })
                .register("sleepy", (args, kwargs) -> {
                    Thread.sleep(10_000);
                    return "woke";
                });
        repository = new RecordingTaskRepository();
        taskService = new TaskService(repository, config);
        counters = new TaskCounters();
        worker = new Worker("test-worker-1", queue, monitor, handlers, taskService, counters, config);
    }

    private Task submit(String function, int maxRetries) {
        Task task = Task.builder()
                .id("task-" + function)
                .name(function + " task")
                .function(function)
                .priority(TaskPriority.HIGH)
                .status(TaskStatus.QUEUED)
                .maxRetries(maxRetries)
                .timeoutSeconds(1)
                .build();
        taskService.record(task);
        assertTrue(queue.put(task));
        return task;
    }

    @Test
    @DisplayName("A successful task ends COMPLETED with its result stored and cached")
    void success() throws Exception {
        Task task = submit("noop_success", 3);

        Optional<TaskOutcome> outcome = worker.processNext(Duration.ZERO);

        assertEquals(Optional.of(TaskOutcome.COMPLETED), outcome);
        Task stored = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.status());
        assertEquals("{\"ok\":true}", stored.result());
        assertEquals("test-worker-1", stored.workerId());
        assertNotNull(stored.startedAt());
        assertNotNull(stored.completedAt());
        assertTrue(stored.executionTimeSeconds() >= 0);
        assertEquals(Optional.of("{\"ok\":true}"), queue.getResult(task.id()));
        assertEquals(List.of(TaskStatus.QUEUED, TaskStatus.RUNNING, TaskStatus.COMPLETED),
                repository.statusesOf(task.id()));
        assertEquals(1, counters.completed());
        assertEquals(1, worker.completedCount());
    }

    @Test
    @DisplayName("processNext returns empty when nothing is queued")
    void emptyQueue() throws Exception {
        assertTrue(worker.processNext(Duration.ZERO).isEmpty());
        assertTrue(repository.saves().isEmpty());
    }

    @Test
    @DisplayName("An unknown function fails at once without retries")
    void unknownHandler() throws Exception {
        Task task = submit("does_not_exist", 3);

        assertEquals(Optional.of(TaskOutcome.UNKNOWN_HANDLER), worker.processNext(Duration.ZERO));

        Task stored = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals(0, stored.retryCount());
        assertTrue(stored.error().contains("does_not_exist"));
        assertEquals(0, queue.size());
        assertEquals(0, counters.retried());
        assertEquals(1, counters.failed());
    }

    @Test
    @DisplayName("A failing task is retried maxRetries times, then FAILED")
    void retriesThenFails() throws Exception {
        Task task = submit("always_fail", 2);

        List<TaskOutcome> outcomes = new ArrayList<>();
        Optional<TaskOutcome> next;
        while ((next = worker.processNext(Duration.ofSeconds(1))).isPresent()) {
            outcomes.add(next.get());
        }

        assertEquals(List.of(TaskOutcome.RETRY_SCHEDULED, TaskOutcome.RETRY_SCHEDULED, TaskOutcome.FAILED), outcomes);
        assertEquals(2, repository.statusesOf(task.id()).stream().filter(s -> s == TaskStatus.RETRY).count());

        Task stored = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals(2, stored.retryCount());
        assertTrue(stored.error().contains("always_fail handler invoked"));
        assertNotNull(stored.completedAt());
        assertEquals(2, counters.retried());
        assertEquals(1, counters.failed());
    }

    @Test
    @DisplayName("Retries are scheduled after a backoff that grows with the attempt")
    void retryBackoff() throws Exception {
        config.withRetryBackoff(Duration.ofSeconds(30));
        Task task = submit("always_fail", 3);

        assertEquals(Optional.of(TaskOutcome.RETRY_SCHEDULED), worker.processNext(Duration.ZERO));

        Task retry = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.RETRY, retry.status());
        assertEquals(1, retry.retryCount());
        assertNotNull(retry.scheduledTime());
        assertTrue(retry.scheduledTime().isAfter(retry.startedAt().plusSeconds(29)));
        assertEquals(1, queue.size());
        assertTrue(worker.processNext(Duration.ZERO).isEmpty(), "retry must wait for its backoff");
    }

    @Test
    @DisplayName("A handler that overruns its timeout is abandoned and the task fails")
    void timeout() throws Exception {
        Task task = submit("sleepy", 0);

        assertEquals(Optional.of(TaskOutcome.FAILED), worker.processNext(Duration.ZERO));

        Task stored = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("Task timed out after 1s", stored.error());
    }

    @Test
    @DisplayName("Handlers receive the task's args and kwargs")
    void passesArguments() throws Exception {
        AtomicReference<List<Object>> seenArgs = new AtomicReference<>();
        AtomicReference<Map<String, Object>> seenKwargs = new AtomicReference<>();
        handlers.register("capture", (args, kwargs) -> {
            seenArgs.set(args);
            seenKwargs.set(kwargs);
            return null;
        });
        Task task = Task.builder()
                .id("capture-1")
                .name("capture")
                .function("capture")
                .args(List.of("x", 2))
                .kwargs(Map.of("symbol", "NIFTY"))
                .status(TaskStatus.QUEUED)
                .build();
        queue.put(task);

        assertEquals(Optional.of(TaskOutcome.COMPLETED), worker.processNext(Duration.ZERO));
        assertEquals(List.of("x", 2), seenArgs.get());
        assertEquals(Map.of("symbol", "NIFTY"), seenKwargs.get());
        assertEquals("null", repository.findById("capture-1").orElseThrow().result());
    }

    @Test
    @DisplayName("The run loop idles while throttled and resumes when resources free up")
    void throttling() throws Exception {
        probe.set(99, 30);
        Task task = submit("noop_success", 0);

        Thread thread = new Thread(worker, "test-worker-1");
        thread.setDaemon(true);
        thread.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> counters.throttleEvents() >= 3);
            assertEquals(1, queue.size());

            probe.set(10, 30);
            await().atMost(Duration.ofSeconds(5)).until(() ->
                    repository.findById(task.id()).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false));
        } finally {
            worker.requestStop();
            thread.join(5_000);
        }
        assertFalse(thread.isAlive());
    }

    @Test
    @DisplayName("A failing handler does not end the run loop")
    void loopSurvivesFailures() throws Exception {
        submit("always_fail", 0);
        Task good = Task.builder()
                .id("after-failure")
                .name("after failure")
                .function("noop_success")
                .priority(TaskPriority.LOW)
                .status(TaskStatus.QUEUED)
                .build();
        queue.put(good);

        Thread thread = new Thread(worker, "test-worker-1");
        thread.setDaemon(true);
        thread.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() ->
                    repository.findById(good.id()).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false));
        } finally {
            worker.requestStop();
            thread.join(5_000);
        }
        assertEquals(1, worker.failedCount());
        assertEquals(1, worker.completedCount());
    }

    @Test
    @DisplayName("A handler throwing an Error fails its task and the run loop carries on")
    void handlerErrorFailsTask() throws Exception {
        handlers.register("broken", (args, kwargs) -> {
            throw new AssertionError("invariant broken");
        });
        Task broken = submit("broken", 0);
        Task good = Task.builder()
                .id("after-error")
                .name("after error")
                .function("noop_success")
                .priority(TaskPriority.LOW)
                .status(TaskStatus.QUEUED)
                .build();
        queue.put(good);

        Thread thread = new Thread(worker, "test-worker-1");
        thread.setDaemon(true);
        thread.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() ->
                    repository.findById(good.id()).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false));
            assertTrue(thread.isAlive());
        } finally {
            worker.requestStop();
            thread.join(5_000);
        }

        Task stored = repository.findById(broken.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("AssertionError: invariant broken", stored.error());
        assertEquals(1, counters.failed());
    }

    @Test
    @DisplayName("With timeouts disabled the handler runs on the worker thread itself")
    void handlerOnWorkerThreadWithoutTimeouts() throws Exception {
        config.withEnforceTimeouts(false);
        AtomicReference<Thread> seen = new AtomicReference<>();
        handlers.register("which_thread", (args, kwargs) -> {
            seen.set(Thread.currentThread());
            return "here";
        });
        Task task = submit("which_thread", 0);

        assertEquals(Optional.of(TaskOutcome.COMPLETED), worker.processNext(Duration.ZERO));

        assertSame(Thread.currentThread(), seen.get());
        assertEquals("\"here\"", repository.findById(task.id()).orElseThrow().result());
    }

    @Test
    @DisplayName("With timeouts disabled a failing handler still goes through the retry path")
    void failureWithoutTimeouts() throws Exception {
        config.withEnforceTimeouts(false);
        Task task = submit("always_fail", 1);

        assertEquals(Optional.of(TaskOutcome.RETRY_SCHEDULED), worker.processNext(Duration.ZERO));
        assertEquals(Optional.of(TaskOutcome.FAILED), worker.processNext(Duration.ofSeconds(1)));

        Task stored = repository.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals(1, stored.retryCount());
        assertEquals("IllegalStateException: always_fail handler invoked", stored.error());
    }
}
