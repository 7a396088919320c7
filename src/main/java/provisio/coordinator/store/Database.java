package provisio.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import provisio.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * Unit of JDBC work run against a connection owned by {@link #withConnection}.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(10000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("provisio-db-pool");
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

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Run work on the thread's transaction connection when one is bound,
     * otherwise on a pooled connection committed when the work returns.
     *
     * @param action describes the work for the failure message ("find node n1")
     */
    public <T> T withConnection(String action, SqlWork<T> work) {
        Connection bound = TxContext.get();
        try {
            if (bound != null) {
                return work.run(bound);
            }
            try (Connection conn = getConnection()) {
                try {
                    T result = work.run(conn);
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + action, e);
        }
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

            // ---------- USERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS users (
                            id              VARCHAR(64) PRIMARY KEY,
                            username        VARCHAR(128) NOT NULL,
                            level           INT DEFAULT 1,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id                      VARCHAR(64) PRIMARY KEY,
                            name                    VARCHAR(128) NOT NULL,
                            kind                    VARCHAR(20) NOT NULL,
                            host                    VARCHAR(255),
                            ssh_port                INT DEFAULT 22,
                            api_port                INT DEFAULT 0,
                            username                VARCHAR(128),
                            credential              VARCHAR(4096),
                            cpu_capacity            INT DEFAULT 0,
                            memory_capacity_mb      BIGINT DEFAULT 0,
                            disk_capacity_mb        BIGINT DEFAULT 0,
                            max_instances           INT DEFAULT 0,
                            max_containers          INT DEFAULT 0,
                            max_vms                 INT DEFAULT 0,
                            used_cpu                INT DEFAULT 0,
                            used_memory_mb          BIGINT DEFAULT 0,
                            used_disk_mb            BIGINT DEFAULT 0,
                            container_count         INT DEFAULT 0,
                            vm_count                INT DEFAULT 0,
                            allow_concurrent_tasks  BOOLEAN DEFAULT FALSE,
                            max_concurrent_tasks    INT DEFAULT 1,
                            allow_claim             BOOLEAN DEFAULT TRUE,
                            frozen                  BOOLEAN DEFAULT FALSE,
                            expires_at              TIMESTAMP,
                            status                  VARCHAR(20) DEFAULT 'ACTIVE',
                            ssh_status              VARCHAR(20) DEFAULT 'UNKNOWN',
                            api_status              VARCHAR(20) DEFAULT 'UNKNOWN',
                            last_checked_at         TIMESTAMP,
                            level_limits            CLOB,
                            created_at              TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RESERVATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS reservations (
                            id              VARCHAR(64) PRIMARY KEY,
                            session_id      VARCHAR(64) NOT NULL UNIQUE,
                            user_id         VARCHAR(64) NOT NULL,
                            node_id         VARCHAR(64) NOT NULL,
                            instance_kind   VARCHAR(20) NOT NULL,
                            cpu             INT DEFAULT 0,
                            memory_mb       BIGINT DEFAULT 0,
                            disk_mb         BIGINT DEFAULT 0,
                            bandwidth_mbps  INT DEFAULT 0,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            expires_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                          VARCHAR(64) PRIMARY KEY,
                            kind                        VARCHAR(32) NOT NULL,
                            status                      VARCHAR(20) DEFAULT 'PENDING',
                            progress                    INT DEFAULT 0,
                            status_message              VARCHAR(1024),
                            error_message               VARCHAR(2048),
                            cancel_reason               VARCHAR(1024),
                            created_at                  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at                  TIMESTAMP,
                            completed_at                TIMESTAMP,
                            user_id                     VARCHAR(64) NOT NULL,
                            node_id                     VARCHAR(64) NOT NULL,
                            instance_id                 VARCHAR(64),
                            instance_kind               VARCHAR(20),
                            payload                     CLOB,
                            timeout_seconds             INT DEFAULT 0,
                            estimated_duration_seconds  INT DEFAULT 0,
                            cancellable                 BOOLEAN DEFAULT TRUE,
                            cpu                         INT DEFAULT 0,
                            memory_mb                   BIGINT DEFAULT 0,
                            disk_mb                     BIGINT DEFAULT 0,
                            bandwidth_mbps              INT DEFAULT 0,
                            session_id                  VARCHAR(64),
                            allocation_committed        BOOLEAN DEFAULT FALSE
                        );
                    """);

            // ---------- INSTANCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instances (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(255),
                            user_id         VARCHAR(64) NOT NULL,
                            node_id         VARCHAR(64) NOT NULL,
                            kind            VARCHAR(20) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'CREATING',
                            cpu             INT DEFAULT 0,
                            memory_mb       BIGINT DEFAULT 0,
                            disk_mb         BIGINT DEFAULT 0,
                            bandwidth_mbps  INT DEFAULT 0,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_node_status ON tasks(node_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_user ON tasks(user_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_reservations_expires ON reservations(expires_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_reservations_node ON reservations(node_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_reservations_user ON reservations(user_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_instances_user_status ON instances(user_id, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
