package taskwarden.coordinator.store;

import taskwarden.coordinator.model.MetricsSnapshot;
import taskwarden.coordinator.repository.MetricsRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of MetricsRepository backed by {@code system_metrics}.
 */
public class JdbcMetricsRepository implements MetricsRepository {

    private final Database db;

    public JdbcMetricsRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(MetricsSnapshot snapshot) {
        String sql = """
                    INSERT INTO system_metrics (recorded_at, cpu_percent, memory_percent, active_workers,
                                                queue_size, tasks_per_minute, throttling)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(snapshot.recordedAt()));
            ps.setDouble(2, snapshot.cpuPercent());
            ps.setDouble(3, snapshot.memoryPercent());
            ps.setInt(4, snapshot.activeWorkers());
            ps.setInt(5, snapshot.queueSize());
            ps.setDouble(6, snapshot.tasksPerMinute());
            ps.setBoolean(7, snapshot.throttling());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append metrics snapshot", e);
        }
    }

    @Override
    public List<MetricsSnapshot> findRecent(int limit) {
        String sql = """
                    SELECT * FROM system_metrics
                    ORDER BY recorded_at DESC, id DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<MetricsSnapshot> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new MetricsSnapshot(
                            rs.getTimestamp("recorded_at").toInstant(),
                            rs.getDouble("cpu_percent"),
                            rs.getDouble("memory_percent"),
                            rs.getInt("active_workers"),
                            rs.getInt("queue_size"),
                            rs.getDouble("tasks_per_minute"),
                            rs.getBoolean("throttling")));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read metrics", e);
        }
    }
}
