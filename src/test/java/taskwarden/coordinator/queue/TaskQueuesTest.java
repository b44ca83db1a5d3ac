package taskwarden.coordinator.queue;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.store.Database;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueuesTest {

    private static final String STORE_URL =
            "jdbc:h2:mem:test-queues;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    private static Database db;

    @BeforeAll
    static void setup() {
        db = new Database(CoordinatorConfig.defaults().withDatabaseUrl(STORE_URL));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    @DisplayName("JDBC backend shares the task store by default")
    void jdbcBackend() {
        PriorityTaskQueue queue = TaskQueues.open(CoordinatorConfig.defaults().withDatabaseUrl(STORE_URL), db);

        assertInstanceOf(JdbcPriorityTaskQueue.class, queue);
        assertTrue(queue.isShared());
    }

    @Test
    @DisplayName("MEMORY backend is used when configured")
    void memoryBackend() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(STORE_URL)
                .withQueueBackend(CoordinatorConfig.QueueBackend.MEMORY);

        PriorityTaskQueue queue = TaskQueues.open(config, db);

        assertInstanceOf(InMemoryPriorityTaskQueue.class, queue);
        assertFalse(queue.isShared());
    }

    @Test
    @DisplayName("An unreachable queue database falls back to the in-memory queue")
    void fallsBackWhenUnavailable() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(STORE_URL)
                .withQueueDatabaseUrl("jdbc:invalid:nowhere");

        PriorityTaskQueue queue = TaskQueues.open(config, db);

        assertInstanceOf(InMemoryPriorityTaskQueue.class, queue);
        assertFalse(queue.isShared());
        assertTrue(db.isHealthy(), "task store must stay open");
    }

    @Test
    @DisplayName("A separate queue database is owned and closed by the queue")
    void separateQueueDatabase() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(STORE_URL)
                .withQueueDatabaseUrl("jdbc:h2:mem:test-queues-separate;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");

        PriorityTaskQueue queue = TaskQueues.open(config, db);

        assertInstanceOf(JdbcPriorityTaskQueue.class, queue);
        queue.close();
        assertTrue(db.isHealthy());
    }
}
