package taskwarden.coordinator.queue;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.store.Database;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPriorityTaskQueueTest extends PriorityTaskQueueContract {

    private static Database db;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-queue;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 8);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM queue_entries");
            st.execute("DELETE FROM task_results");
            conn.commit();
        }
    }

    @Override
    protected PriorityTaskQueue newQueue() {
        return new JdbcPriorityTaskQueue(db, Duration.ofMillis(20));
    }

    @Test
    @DisplayName("Two queue instances over one database see the same entries")
    void sharedBetweenInstances() {
        PriorityTaskQueue other = new JdbcPriorityTaskQueue(db, Duration.ofMillis(20));

        queue.put(task("shared", TaskPriority.HIGH));

        assertTrue(queue.isShared());
        assertEquals(1, other.size());
        assertEquals("shared", other.get(Duration.ZERO).orElseThrow().id());
        assertTrue(queue.get(Duration.ZERO).isEmpty());
    }

    @Test
    @DisplayName("An unreadable entry is dropped and the next one is served")
    void dropsUnreadableEntry() throws Exception {
        try (var conn = db.getConnection();
                var ps = conn.prepareStatement(
                        "INSERT INTO queue_entries (task_id, score, available_at, envelope) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, "broken");
            ps.setDouble(2, 0.5);
            ps.setTimestamp(3, Timestamp.from(Instant.now().minusSeconds(1)));
            ps.setString(4, "not json");
            ps.executeUpdate();
            conn.commit();
        }
        queue.put(task("good", TaskPriority.LOW));

        assertEquals("good", queue.get(Duration.ofSeconds(1)).orElseThrow().id());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Closing a queue that does not own the database leaves it open")
    void closeKeepsSharedDatabase() {
        queue.close();
        assertTrue(db.isHealthy());
    }
}
