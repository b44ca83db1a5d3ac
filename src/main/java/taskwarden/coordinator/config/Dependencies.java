package taskwarden.coordinator.config;

import taskwarden.coordinator.api.v1.DashboardController;
import taskwarden.coordinator.api.v1.HealthController;
import taskwarden.coordinator.api.v1.TaskController;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.handlers.DemoHandlers;
import taskwarden.coordinator.monitor.JvmSystemProbe;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.SystemProbe;
import taskwarden.coordinator.queue.PriorityTaskQueue;
import taskwarden.coordinator.queue.TaskQueues;
import taskwarden.coordinator.repository.MetricsRepository;
import taskwarden.coordinator.repository.TaskRepository;
import taskwarden.coordinator.server.CoordinatorNettyServer;
import taskwarden.coordinator.server.RouterHandler;
import taskwarden.coordinator.service.TaskService;
import taskwarden.coordinator.store.Database;
import taskwarden.coordinator.store.JdbcMetricsRepository;
import taskwarden.coordinator.store.JdbcTaskRepository;
import taskwarden.coordinator.worker.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv())) {
 *     deps.manager().start();
 *     deps.manager().submitTask(...);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final MetricsRepository metricsRepository;
    private final PriorityTaskQueue queue;
    private final ResourceMonitor monitor;
    private final HandlerRegistry handlers;
    private final TaskService taskService;
    private final DistributedTaskManager manager;

    // Controllers
    private final HealthController healthController;
    private final DashboardController dashboardController;
    private final TaskController taskController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private CoordinatorNettyServer server;

    private Dependencies(CoordinatorConfig config, SystemProbe probe, double demoDelayScale) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.queue = TaskQueues.open(config, database);
        this.monitor = new ResourceMonitor(probe, config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.metricsRepository = new JdbcMetricsRepository(database);

        // Services
        this.handlers = new DemoHandlers(monitor, demoDelayScale).registerAll(new HandlerRegistry());
        this.taskService = new TaskService(taskRepository, config);
        this.manager = new DistributedTaskManager(config, queue, monitor, handlers, taskService,
                taskRepository, metricsRepository);

        // Controllers (public API)
        this.healthController = new HealthController(database, manager);
        this.dashboardController = new DashboardController(manager);
        this.taskController = new TaskController(manager);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, probing the local host.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new JvmSystemProbe(config.diskPath()), 1.0);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    /**
     * Create dependencies with a custom resource probe; {@code demoDelayScale} scales the
     * simulated work of the demo handlers (0 runs them instantly).
     */
    public static Dependencies create(CoordinatorConfig config, SystemProbe probe, double demoDelayScale) {
        return new Dependencies(config, probe, demoDelayScale);
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public MetricsRepository metricsRepository() {
        return metricsRepository;
    }

    public PriorityTaskQueue queue() {
        return queue;
    }

    public ResourceMonitor monitor() {
        return monitor;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public TaskService taskService() {
        return taskService;
    }

    public DistributedTaskManager manager() {
        return manager;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(dashboardController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the HTTP API on {@code port} (0 picks a free port).
     *
     * @return the bound port
     */
    public synchronized int startServer(int port) {
        if (server == null) {
            server = new CoordinatorNettyServer(routerHandler());
        }
        return server.start(config.serverHost(), port);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            manager.stop();
        } catch (Exception e) {
            log.warn("Error stopping task manager: {}", e.getMessage());
        }

        try {
            queue.close();
        } catch (Exception e) {
            log.warn("Error closing task queue: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
