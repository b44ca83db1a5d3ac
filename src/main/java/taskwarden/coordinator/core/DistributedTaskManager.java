package taskwarden.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.model.DashboardStats;
import taskwarden.coordinator.model.MetricsSnapshot;
import taskwarden.coordinator.model.SubmitOptions;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.ResourceSnapshot;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.repository.MetricsRepository;
import taskwarden.coordinator.repository.TaskRepository;
import taskwarden.coordinator.scheduler.Autoscaler;
import taskwarden.coordinator.scheduler.MetricsCollector;
import taskwarden.coordinator.scheduler.Scheduler;
import taskwarden.coordinator.scheduler.TaskReaper;
import taskwarden.coordinator.service.TaskService;
import taskwarden.coordinator.worker.HandlerRegistry;
import taskwarden.coordinator.worker.TaskCounters;
import taskwarden.coordinator.worker.Worker;
import taskwarden.coordinator.worker.WorkerPool;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Supervisor: owns the worker pool and the background loops, and is the
 * programmatic entry point for producers.
 *
 * Methods called by producers ({@code submitTask}, {@code getTaskStatus},
 * {@code getDashboardStats}, {@code cancelTask}) never throw; failures are logged
 * and reported as empty results.
 */
public class DistributedTaskManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DistributedTaskManager.class);

    private static final Duration RECENT_WINDOW = Duration.ofHours(1);

    // node ids stay unique when several managers share one JVM
    private static final AtomicInteger NODE_SEQUENCE = new AtomicInteger();

    private final CoordinatorConfig config;
    private final PriorityTaskQueue queue;
    private final ResourceMonitor monitor;
    private final HandlerRegistry handlers;
    private final TaskService taskService;
    private final TaskRepository taskRepository;
    private final MetricsRepository metricsRepository;
    private final TaskCounters counters;
    private final WorkerPool workerPool;
    private final Instant createdAt = Instant.now();

    private Scheduler scheduler;
    private volatile boolean running = false;

    public DistributedTaskManager(CoordinatorConfig config,
            PriorityTaskQueue queue,
            ResourceMonitor monitor,
            HandlerRegistry handlers,
            TaskService taskService,
            TaskRepository taskRepository,
            MetricsRepository metricsRepository) {
        this.config = config;
        this.queue = queue;
        this.monitor = monitor;
        this.handlers = handlers;
        this.taskService = taskService;
        this.taskRepository = taskRepository;
        this.metricsRepository = metricsRepository;
        this.counters = new TaskCounters();
        this.workerPool = new WorkerPool(
                "node-" + ProcessHandle.current().pid() + "-" + NODE_SEQUENCE.incrementAndGet(),
                workerId -> new Worker(workerId, queue, monitor, handlers, taskService, counters, config));
    }

    /**
     * Start with the monitor's recommended number of workers.
     */
    public synchronized void start() {
        start(monitor.recommendedWorkerCount());
    }

    /**
     * Start {@code numWorkers} workers (clamped to {@code [1, maxWorkers]}) and the background loops.
     */
    public synchronized void start(int numWorkers) {
        if (running) {
            log.warn("Task manager already running");
            return;
        }

        int count = Math.max(1, Math.min(numWorkers, config.maxWorkers()));
        log.info("Starting task manager with {} workers (queue: {}, handlers: {})",
                count, queue.isShared() ? "shared" : "in-memory", handlers.functions());

        workerPool.scaleUp(count);

        scheduler = new Scheduler(
                new Autoscaler(monitor, workerPool, config),
                new MetricsCollector(monitor, queue, workerPool, taskService, metricsRepository, Instant.now()),
                new TaskReaper(taskRepository, queue, workerPool, counters, config),
                config);
        scheduler.start();

        running = true;
    }

    public Optional<String> submitTask(String name, String function, List<Object> args,
            Map<String, Object> kwargs, TaskPriority priority) {
        return submitTask(name, function, args, kwargs, priority, SubmitOptions.defaults());
    }

    /**
     * Persist a new task as QUEUED and enqueue it.
     *
     * @return the task id, or empty if the input was invalid or the queue rejected the task
     */
    public Optional<String> submitTask(String name, String function, List<Object> args,
            Map<String, Object> kwargs, TaskPriority priority, SubmitOptions options) {
        Task task;
        try {
            task = taskService.newTask(name, function, args, kwargs, priority, options);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected task '{}': {}", name, e.getMessage());
            return Optional.empty();
        }

        try {
            if (!taskService.record(task)) {
                return Optional.empty();
            }
            if (!queue.put(task)) {
                taskService.markFailed(task.id(), "Could not enqueue task");
                log.error("Failed to enqueue task {} ({})", task.id(), name);
                return Optional.empty();
            }
        } catch (RuntimeException e) {
            log.error("Failed to submit task '{}'", name, e);
            return Optional.empty();
        }

        counters.taskQueued();
        log.info("Submitted task {} ({}, {}, function={})", task.id(), name, task.priority(), function);
        return Optional.of(task.id());
    }

    public Optional<Task> getTaskStatus(String taskId) {
        try {
            return taskService.findTask(taskId);
        } catch (RuntimeException e) {
            log.warn("Could not read status of task {}: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Result JSON of a completed task: the queue's result cache first, then the durable record.
     */
    public Optional<String> getTaskResult(String taskId) {
        try {
            Optional<String> cached = queue.getResult(taskId);
            if (cached.isPresent()) {
                return cached;
            }
            return taskService.findTask(taskId).map(Task::result);
        } catch (RuntimeException e) {
            log.warn("Could not read result of task {}: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Cancel a task that no worker has picked up yet.
     *
     * @return true if the task was still queued and is now CANCELLED
     */
    public boolean cancelTask(String taskId) {
        try {
            if (!queue.remove(taskId)) {
                log.info("Task {} not cancelled: no longer queued", taskId);
                return false;
            }
            taskService.markCancelled(taskId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not cancel task {}: {}", taskId, e.getMessage());
            return false;
        }
    }

    public DashboardStats getDashboardStats() {
        ResourceSnapshot resources = monitor.sample();
        Duration uptime = Duration.between(createdAt, Instant.now());

        int live = workerPool.liveCount();
        int dead = workerPool.deadCount();

        DashboardStats.SystemStats system = new DashboardStats.SystemStats(
                round(uptime.toMillis() / 60_000.0),
                round(resources.cpuPercent()),
                round(resources.memoryPercent()),
                round(resources.memoryAvailableGb()),
                round(resources.loadAverage()),
                round(resources.diskFreeGb()));

        TaskService.TaskTotals totals = safely("task totals", taskService::lifetimeTotals,
                new TaskService.TaskTotals(counters.queued(), counters.completed(), counters.failed()));

        DashboardStats.TaskStats tasks = new DashboardStats.TaskStats(
                safely("queue size", queue::size, 0),
                totals.submitted(),
                totals.completed(),
                totals.failed(),
                counters.retried(),
                round(safely("throughput", () -> taskService.tasksPerMinute(uptime), 0.0)),
                round(safely("average execution time", () -> taskService.averageExecutionTime(RECENT_WINDOW), 0.0)),
                safely("recent status counts", () -> taskService.recentByStatus(RECENT_WINDOW), Map.of()));

        DashboardStats.PerformanceStats performance = new DashboardStats.PerformanceStats(
                round(totals.successRate()),
                monitor.shouldThrottle(),
                counters.throttleEvents(),
                monitor.recommendedWorkerCount(),
                queue.isShared());

        return new DashboardStats(system, new DashboardStats.WorkerStats(live, dead, live + dead), tasks, performance);
    }

    /** Most recently updated task records, newest first; empty if the store is unreadable. */
    public List<Task> recentTasks(int limit) {
        return safely("recent tasks", () -> taskService.recentTasks(limit), List.of());
    }

    public List<MetricsSnapshot> recentMetrics(int limit) {
        return safely("metrics history", () -> metricsRepository.findRecent(limit), List.of());
    }

    /**
     * Stop background loops, drain workers and wait for them to exit.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping task manager...");

        if (scheduler != null) {
            scheduler.stop();
            scheduler = null;
        }
        workerPool.stopAll(config.shutdownGrace());

        running = false;
        log.info("Task manager stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public TaskCounters counters() {
        return counters;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public PriorityTaskQueue queue() {
        return queue;
    }

    public ResourceMonitor monitor() {
        return monitor;
    }

    /** Background loops of the current run, or null when stopped. */
    public synchronized Scheduler scheduler() {
        return scheduler;
    }

    private static <T> T safely(String what, Supplier<T> supplier, T fallback) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            log.warn("Dashboard: could not read {}: {}", what, e.getMessage());
            return fallback;
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
