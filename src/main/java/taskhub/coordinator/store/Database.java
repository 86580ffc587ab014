package taskhub.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskhub.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every repository method commits or rolls back itself.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskhub-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
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

            // ---------- COLLABORATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS collaborations (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name            VARCHAR(256) DEFAULT '' NOT NULL
                        );
                    """);

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name             VARCHAR(256) DEFAULT '' NOT NULL,
                            collaboration_id BIGINT NOT NULL REFERENCES collaborations(id) ON DELETE CASCADE
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            collaboration_id BIGINT NOT NULL REFERENCES collaborations(id),
                            name             VARCHAR(1024) DEFAULT '' NOT NULL,
                            description      CLOB,
                            image            VARCHAR(1024) DEFAULT '' NOT NULL,
                            input            CLOB,
                            status           VARCHAR(64) DEFAULT 'open' NOT NULL,
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TASK RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_results (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         BIGINT NOT NULL REFERENCES tasks(id) ON DELETE CASCADE,
                            node_id         BIGINT NOT NULL REFERENCES nodes(id),
                            result          CLOB,
                            log             CLOB,
                            assigned_at     TIMESTAMP,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            CONSTRAINT uq_task_results_task_node UNIQUE (task_id, node_id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_collaboration ON nodes(collaboration_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_collaboration ON tasks(collaboration_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_results_task ON task_results(task_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
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
