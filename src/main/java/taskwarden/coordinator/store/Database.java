package taskwarden.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off, so every caller commits or rolls back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final String jdbcUrl;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        this.jdbcUrl = jdbcUrl;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskwarden-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        try {
            initSchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            function_name   VARCHAR(128) NOT NULL,
                            priority        INT NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            payload         CLOB NOT NULL,
                            max_retries     INT DEFAULT 3,
                            retry_count     INT DEFAULT 0,
                            timeout_seconds INT DEFAULT 300,
                            scheduled_time  TIMESTAMP,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            worker_id       VARCHAR(128),
                            execution_time  DOUBLE,
                            error_message   VARCHAR(4096),
                            result          CLOB,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- SYSTEM METRICS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS system_metrics (
                            id               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            recorded_at      TIMESTAMP NOT NULL,
                            cpu_percent      DOUBLE,
                            memory_percent   DOUBLE,
                            active_workers   INT,
                            queue_size       INT,
                            tasks_per_minute DOUBLE,
                            throttling       BOOLEAN DEFAULT FALSE
                        );
                    """);

            // ---------- SHARED QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS queue_entries (
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL UNIQUE,
                            score           DOUBLE NOT NULL,
                            available_at    TIMESTAMP NOT NULL,
                            envelope        CLOB NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_results (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            result          CLOB,
                            expires_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_started ON tasks(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_completed ON tasks(status, completed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_created ON tasks(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_metrics_recorded ON system_metrics(recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_order ON queue_entries(available_at, score, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_expiry ON task_results(expires_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
