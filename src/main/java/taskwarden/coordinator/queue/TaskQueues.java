package taskwarden.coordinator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.store.Database;

/**
 * Opens the configured queue backend, falling back to the in-memory queue when
 * the shared store cannot be reached.
 */
public final class TaskQueues {

    private static final Logger log = LoggerFactory.getLogger(TaskQueues.class);

    private static final int QUEUE_POOL_SIZE = 4;

    private TaskQueues() {
    }

    /**
     * @param storeDatabase the task store, reused for the queue unless a separate queue URL is configured
     */
    public static PriorityTaskQueue open(CoordinatorConfig config, Database storeDatabase) {
        if (config.queueBackend() == CoordinatorConfig.QueueBackend.MEMORY) {
            log.info("Using in-memory task queue (configured)");
            return new InMemoryPriorityTaskQueue();
        }

        Database queueDatabase = null;
        try {
            boolean separate = config.hasSeparateQueueDatabase();
            queueDatabase = separate
                    ? new Database(config.queueDatabaseUrl(), QUEUE_POOL_SIZE)
                    : storeDatabase;
            JdbcPriorityTaskQueue queue = new JdbcPriorityTaskQueue(queueDatabase, config.queuePollInterval(), separate);
            int depth = queue.size();
            log.info("Using shared task queue at {} ({} entries waiting)", queueDatabase.jdbcUrl(), depth);
            return queue;
        } catch (RuntimeException e) {
            if (queueDatabase != null && queueDatabase != storeDatabase) {
                queueDatabase.close();
            }
            log.warn("Shared task queue unavailable ({}). Falling back to an in-memory queue: "
                    + "queued tasks are lost on exit and other processes cannot see them", e.getMessage());
            return new InMemoryPriorityTaskQueue();
        }
    }
}
