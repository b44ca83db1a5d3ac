package taskwarden.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskCodec;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.repository.TaskRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Arguments travel in the {@code payload} envelope; lifecycle fields have their own columns.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final int MAX_ERROR_LENGTH = 4000;

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    MERGE INTO tasks (id, name, function_name, priority, status, payload, max_retries, retry_count,
                                      timeout_seconds, scheduled_time, created_at, started_at, completed_at,
                                      worker_id, execution_time, error_message, result, updated_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.name());
            ps.setString(3, task.function());
            ps.setInt(4, task.priority().value());
            ps.setString(5, task.status().name());
            ps.setString(6, TaskCodec.encode(task));
            ps.setInt(7, task.maxRetries());
            ps.setInt(8, task.retryCount());
            ps.setInt(9, task.timeoutSeconds());
            setTimestamp(ps, 10, task.scheduledTime());
            setTimestamp(ps, 11, task.createdAt());
            setTimestamp(ps, 12, task.startedAt());
            setTimestamp(ps, 13, task.completedAt());
            ps.setString(14, task.workerId());
            setDoubleOrNull(ps, 15, task.executionTimeSeconds());
            ps.setString(16, truncate(task.error()));
            ps.setString(17, task.result());
            ps.setTimestamp(18, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findRunning() {
        String sql = "SELECT * FROM tasks WHERE status = 'RUNNING' ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find running tasks", e);
        }
    }

    @Override
    public Map<TaskStatus, Integer> countByStatusSince(Instant since) {
        String sql = """
                    SELECT status, COUNT(*) AS cnt FROM tasks
                    WHERE created_at >= ?
                    GROUP BY status
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status", e);
        }
    }

    @Override
    public int countCompletedSince(Instant since) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = 'COMPLETED' AND completed_at >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count completed tasks", e);
        }
    }

    @Override
    public double averageExecutionTimeSince(Instant since) {
        String sql = """
                    SELECT AVG(execution_time) FROM tasks
                    WHERE status = 'COMPLETED' AND completed_at >= ? AND execution_time IS NOT NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    double avg = rs.getDouble(1);
                    return rs.wasNull() ? 0.0 : avg;
                }
            }
            return 0.0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute average execution time", e);
        }
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage) {
        String sql = """
                    UPDATE tasks
                    SET status = 'FAILED', completed_at = ?, error_message = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setTimestamp(1, now);
            ps.setString(2, truncate(errorMessage));
            ps.setTimestamp(3, now);
            ps.setString(4, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} marked as FAILED: {}", taskId, errorMessage);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark task as failed: " + taskId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status) {
        String sql = "UPDATE tasks SET status = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task status: " + taskId, e);
        }
    }

    @Override
    public List<Task> findRecent(int limit) {
        String sql = """
                    SELECT * FROM tasks
                    ORDER BY updated_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent tasks", e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        Task fromPayload = TaskCodec.decode(rs.getString("payload"));
        return fromPayload.toBuilder()
                .status(TaskStatus.valueOf(rs.getString("status")))
                .maxRetries(rs.getInt("max_retries"))
                .retryCount(rs.getInt("retry_count"))
                .timeoutSeconds(rs.getInt("timeout_seconds"))
                .scheduledTime(toInstant(rs.getTimestamp("scheduled_time")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .workerId(rs.getString("worker_id"))
                .executionTimeSeconds(getDoubleOrNull(rs, "execution_time"))
                .error(rs.getString("error_message"))
                .result(rs.getString("result"))
                .build();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setDoubleOrNull(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) {
            ps.setDouble(index, value);
        } else {
            ps.setNull(index, Types.DOUBLE);
        }
    }

    private static Double getDoubleOrNull(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
