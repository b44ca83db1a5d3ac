package taskwarden.coordinator.store;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.model.MetricsSnapshot;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcMetricsRepositoryTest {

    private static Database db;
    private static JdbcMetricsRepository repository;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-metrics;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        repository = new JdbcMetricsRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanDb() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM system_metrics");
            conn.commit();
        }
    }

    @Test
    @DisplayName("Snapshots come back newest first")
    void appendAndRead() {
        Instant base = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        MetricsSnapshot first = new MetricsSnapshot(base.minusSeconds(120), 12.5, 40.0, 3, 7, 1.5, false);
        MetricsSnapshot second = new MetricsSnapshot(base.minusSeconds(60), 95.0, 41.0, 2, 9, 0.5, true);
        MetricsSnapshot third = new MetricsSnapshot(base, 20.0, 42.0, 4, 0, 2.0, false);

        repository.append(first);
        repository.append(second);
        repository.append(third);

        assertEquals(List.of(third, second), repository.findRecent(2));
        assertEquals(3, repository.findRecent(10).size());
    }

    @Test
    @DisplayName("An empty series reads as an empty list")
    void empty() {
        assertTrue(repository.findRecent(5).isEmpty());
    }
}
