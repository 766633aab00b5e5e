package mattrack.tracker.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mattrack.tracker.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * Database connection pool, schema management and transaction helper.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    // H2 error codes that mean "someone else holds the lock"
    private static final int H2_LOCK_TIMEOUT = 50200;
    private static final int H2_DEADLOCK = 40001;
    private static final int H2_CONCURRENT_UPDATE = 90131;

    private final HikariDataSource dataSource;
    private final int busyRetries;
    private final Duration busyBackoff;

    /**
     * Unit of work executed inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    public Database(TrackerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), config.lockTimeout(),
                config.busyRetries(), config.busyBackoff());
    }

    public Database(String jdbcUrl, int poolSize, Duration lockTimeout, int busyRetries, Duration busyBackoff) {
        this.busyRetries = busyRetries;
        this.busyBackoff = busyBackoff;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("mattrack-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
            hikariConfig.setConnectionInitSql("SET LOCK_TIMEOUT " + lockTimeout.toMillis());
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
        migrate();
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

    /**
     * Run {@code work} in a single transaction, committing on success and rolling back on any failure.
     * Lock contention is retried with exponential backoff; once retries are exhausted a
     * {@link StoreBusyException} is thrown. Runtime exceptions from {@code work} roll back and propagate.
     *
     * @param operation short description used in logs and error messages
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Connection conn = getConnection()) {
                try {
                    T result = work.apply(conn);
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    rollback(conn, e);
                    throw e;
                }
            } catch (SQLException e) {
                if (!isBusy(e)) {
                    throw new StoreException("Failed to " + operation, e);
                }
                if (attempt > busyRetries) {
                    log.warn("Store busy, giving up on {} after {} attempts", operation, attempt);
                    throw new StoreBusyException(operation, attempt, e);
                }
                long delay = busyBackoff.toMillis() * (1L << (attempt - 1));
                log.debug("Store busy during {}, retry {} in {}ms", operation, attempt, delay);
                sleep(delay, operation, e);
            }
        }
    }

    static boolean isBusy(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                int code = sql.getErrorCode();
                if (code == H2_LOCK_TIMEOUT || code == H2_DEADLOCK || code == H2_CONCURRENT_UPDATE) {
                    return true;
                }
                String state = sql.getSQLState();
                if (state != null && (state.startsWith("40") || state.equals("HYT00"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static void sleep(long millis, String operation, SQLException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreBusyException(operation + " (interrupted)", 0, cause);
        }
    }

    /**
     * Initialize database schema.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- MATERIALS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS materials (
                            material_id     VARCHAR(255) PRIMARY KEY,
                            formula         VARCHAR(255),
                            space_group     INT,
                            dimensionality  VARCHAR(20),
                            source_type     VARCHAR(20),
                            source_file     VARCHAR(1024),
                            status          VARCHAR(20) DEFAULT 'active',
                            metadata_json   CLOB,
                            notes           VARCHAR(4096),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- CALCULATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS calculations (
                            calc_id              VARCHAR(255) PRIMARY KEY,
                            material_id          VARCHAR(255) NOT NULL REFERENCES materials(material_id),
                            calc_type            VARCHAR(32) NOT NULL,
                            status               VARCHAR(20) DEFAULT 'pending',
                            priority             INT DEFAULT 0,
                            slurm_job_id         VARCHAR(64),
                            created_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            submitted_at         TIMESTAMP,
                            started_at           TIMESTAMP,
                            completed_at         TIMESTAMP,
                            input_file           VARCHAR(1024),
                            output_file          VARCHAR(1024),
                            work_dir             VARCHAR(1024),
                            settings_json        CLOB,
                            exit_code            INT,
                            error_type           VARCHAR(64),
                            error_message        VARCHAR(4096),
                            prerequisite_calc_id VARCHAR(255)
                        );
                    """);

            // ---------- PROPERTIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS properties (
                            property_id     BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            material_id     VARCHAR(255) NOT NULL,
                            calc_id         VARCHAR(255),
                            category        VARCHAR(64),
                            name            VARCHAR(255) NOT NULL,
                            num_value       DOUBLE PRECISION,
                            text_value      VARCHAR(4096),
                            unit            VARCHAR(32),
                            extracted_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            extractor       VARCHAR(128)
                        );
                    """);

            // ---------- FILES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS files (
                            file_id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            calc_id         VARCHAR(255) NOT NULL,
                            file_type       VARCHAR(20) NOT NULL,
                            file_name       VARCHAR(512) NOT NULL,
                            file_path       VARCHAR(1024) NOT NULL,
                            file_size       BIGINT,
                            checksum        VARCHAR(128),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORKFLOWS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflow_templates (
                            template_id     VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(255),
                            description     VARCHAR(2048),
                            steps_json      CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflow_instances (
                            instance_id     VARCHAR(128) PRIMARY KEY,
                            material_id     VARCHAR(255) NOT NULL,
                            template_id     VARCHAR(128),
                            status          VARCHAR(20) DEFAULT 'active',
                            current_step    VARCHAR(128),
                            started_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            completed_at    TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_calc_status ON calculations(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_calc_material ON calculations(material_id, calc_type);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_calc_slurm ON calculations(slurm_job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_props_material ON properties(material_id, name);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_files_calc ON files(calc_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_wf_material ON workflow_instances(material_id, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    /**
     * Additive migrations. Each statement must be safe to run against an already-migrated store.
     */
    private void migrate() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("ALTER TABLE calculations ADD COLUMN IF NOT EXISTS recovery_attempts INT DEFAULT 0");
            st.addBatch("ALTER TABLE calculations ADD COLUMN IF NOT EXISTS completion_type VARCHAR(64)");
            st.addBatch("ALTER TABLE calculations ADD COLUMN IF NOT EXISTS job_script VARCHAR(1024)");
            st.addBatch("ALTER TABLE calculations ADD COLUMN IF NOT EXISTS slurm_state VARCHAR(32)");

            st.executeBatch();
            conn.commit();

            log.debug("Database migrations applied");
        } catch (SQLException e) {
            throw new StoreException("Failed to migrate database schema", e);
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
