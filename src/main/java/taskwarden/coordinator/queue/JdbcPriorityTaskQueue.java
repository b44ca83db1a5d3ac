package taskwarden.coordinator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskCodec;
import taskwarden.coordinator.store.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queue kept in the {@code queue_entries} table so that every process using the
 * same H2 database sees one queue.
 *
 * A claim selects the best eligible candidates and deletes one by key; only the
 * consumer whose DELETE reports a row owns the entry.
 */
public final class JdbcPriorityTaskQueue implements PriorityTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcPriorityTaskQueue.class);

    private static final int CLAIM_CANDIDATES = 5;

    private final Database db;
    private final Duration pollInterval;
    private final boolean ownsDatabase;

    public JdbcPriorityTaskQueue(Database db, Duration pollInterval) {
        this(db, pollInterval, false);
    }

    /**
     * @param ownsDatabase close the database together with this queue
     */
    public JdbcPriorityTaskQueue(Database db, Duration pollInterval, boolean ownsDatabase) {
        this.db = db;
        this.pollInterval = pollInterval;
        this.ownsDatabase = ownsDatabase;
    }

    @Override
    public boolean put(Task task) {
        String sql = """
                    INSERT INTO queue_entries (task_id, score, available_at, envelope)
                    VALUES (?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setDouble(2, QueueScore.of(task.priority(), now));
            ps.setTimestamp(3, Timestamp.from(task.scheduledTime() != null ? task.scheduledTime() : now));
            ps.setString(4, TaskCodec.encode(task));

            ps.executeUpdate();
            conn.commit();
            return true;
        } catch (SQLException | IllegalArgumentException e) {
            log.error("Failed to enqueue task {}: {}", task.id(), e.getMessage(), e);
            return false;
        }
    }

    @Override
    public Optional<Task> get(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<Task> claimed = tryClaim();
            if (claimed.isPresent()) {
                return claimed;
            }
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(remainingMs, pollInterval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    private Optional<Task> tryClaim() {
        String selectSql = """
                    SELECT seq, task_id, envelope FROM queue_entries
                    WHERE available_at <= ?
                    ORDER BY score, seq
                    LIMIT ?
                """;
        String deleteSql = "DELETE FROM queue_entries WHERE seq = ?";

        try (Connection conn = db.getConnection()) {
            List<Candidate> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setTimestamp(1, Timestamp.from(Instant.now()));
                ps.setInt(2, CLAIM_CANDIDATES);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new Candidate(rs.getLong("seq"), rs.getString("task_id"),
                                rs.getString("envelope")));
                    }
                }
            }
            conn.commit();

            for (Candidate candidate : candidates) {
                int deleted;
                try (PreparedStatement ps = conn.prepareStatement(deleteSql)) {
                    ps.setLong(1, candidate.seq());
                    deleted = ps.executeUpdate();
                    conn.commit();
                } catch (SQLException e) {
                    // another consumer holds the row lock
                    conn.rollback();
                    log.debug("Lost claim race for task {}: {}", candidate.taskId(), e.getMessage());
                    continue;
                }
                if (deleted == 1) {
                    try {
                        return Optional.of(TaskCodec.decode(candidate.envelope()));
                    } catch (IllegalArgumentException e) {
                        log.error("Dropped unreadable queue entry for task {}: {}", candidate.taskId(), e.getMessage());
                    }
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to poll task queue", e);
        }
    }

    private record Candidate(long seq, String taskId, String envelope) {
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM queue_entries");
                ResultSet rs = ps.executeQuery()) {
            int count = rs.next() ? rs.getInt(1) : 0;
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count queue entries", e);
        }
    }

    @Override
    public boolean remove(String taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM queue_entries WHERE task_id = ?")) {
            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove queued task: " + taskId, e);
        }
    }

    @Override
    public void setResult(String taskId, String resultJson, Duration ttl) {
        String sql = "MERGE INTO task_results (task_id, result, expires_at) KEY (task_id) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setString(2, resultJson);
            ps.setTimestamp(3, Timestamp.from(Instant.now().plus(ttl)));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cache result for task: " + taskId, e);
        }
    }

    @Override
    public Optional<String> getResult(String taskId) {
        String sql = "SELECT result FROM task_results WHERE task_id = ? AND expires_at > ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            try (ResultSet rs = ps.executeQuery()) {
                Optional<String> result = rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
                conn.commit();
                return result;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cached result for task: " + taskId, e);
        }
    }

    @Override
    public int purgeExpiredResults() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM task_results WHERE expires_at <= ?")) {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            int removed = ps.executeUpdate();
            conn.commit();
            if (removed > 0) {
                log.debug("Purged {} expired results", removed);
            }
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired results", e);
        }
    }

    @Override
    public boolean isShared() {
        return true;
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            db.close();
        }
    }
}
