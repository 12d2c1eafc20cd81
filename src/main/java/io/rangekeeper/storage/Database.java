package io.rangekeeper.storage;

import io.rangekeeper.config.RangeKeeperConfig;
import io.rangekeeper.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

public final class Database {
    private static final Logger LOG = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "rangekeeper.schema.migration.v1";
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int MAX_BUSY_ATTEMPTS = 3;

    private final RangeKeeperConfig config;
    private final String jdbcUrl;
    private final long timeoutMs;

    public Database(RangeKeeperConfig config) {
        this(config, RangeKeeperConfig.DEFAULT_STORE_TIMEOUT_MS);
    }

    public Database(RangeKeeperConfig config, long timeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.timeoutMs = Math.max(100L, timeoutMs);
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, timeoutMs));
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.enforceForeignKeys(true);
        Properties props = sqlite.toProperties();
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public <T> T withRetry(String operation, SqlWork<T> work) {
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_BUSY_ATTEMPTS; attempt++) {
            try {
                return work.run();
            } catch (SQLException e) {
                if (!isBusy(e)) {
                    throw new RuntimeException("Store operation failed: " + operation, e);
                }
                last = e;
                LOG.warn("Store busy during {} (attempt {}/{}): {}", operation, attempt, MAX_BUSY_ATTEMPTS, e.getMessage());
                sleepQuietly(ThreadLocalRandom.current().nextLong(20L, 120L) * attempt);
            }
        }
        throw new StoreUnavailableException("Store unavailable: " + operation, last);
    }

    public static boolean isBusy(SQLException e) {
        return e.getErrorCode() == SQLITE_BUSY || e.getErrorCode() == SQLITE_LOCKED;
    }

    public static boolean isConstraintViolation(SQLException e) {
        if (e.getErrorCode() == SQLITE_CONSTRAINT) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains("constraint failed");
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS instances (
                        instance_id TEXT PRIMARY KEY,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        principal_id TEXT NOT NULL,
                        challenge_id TEXT NOT NULL,
                        status TEXT NOT NULL,
                        workload_handle TEXT,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        extension_count INTEGER NOT NULL DEFAULT 0 CHECK (extension_count >= 0),
                        last_extended_at_ms INTEGER,
                        version INTEGER NOT NULL DEFAULT 0,
                        teardown_claim TEXT,
                        claimed_at_ms INTEGER,
                        failure_reason TEXT,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureInstanceColumns(conn);
            // One active instance per (principal, challenge), enforced at insert time.
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS uq_instances_active_owner
                    ON instances(namespace, principal_id, challenge_id)
                    WHERE status IN ('PROVISIONING','RUNNING')
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS credentials (
                        instance_id TEXT PRIMARY KEY,
                        ciphertext TEXT NOT NULL,
                        key_id INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(instance_id) REFERENCES instances(instance_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runtime_policies (
                        namespace TEXT NOT NULL DEFAULT 'default',
                        challenge_id TEXT NOT NULL,
                        base_runtime_seconds INTEGER NOT NULL,
                        extension_increment_seconds INTEGER NOT NULL,
                        max_extensions INTEGER NOT NULL,
                        max_lifetime_seconds INTEGER NOT NULL,
                        updated_by TEXT,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(namespace, challenge_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS audit_events (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        occurred_at_ms INTEGER NOT NULL,
                        action TEXT NOT NULL,
                        actor TEXT NOT NULL,
                        principal_id TEXT,
                        instance_id TEXT,
                        challenge_id TEXT,
                        detail_json TEXT NOT NULL DEFAULT '{}',
                        prev_hash TEXT NOT NULL DEFAULT '',
                        hash TEXT NOT NULL,
                        signature TEXT
                    )
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS audit_events_no_update
                    BEFORE UPDATE ON audit_events
                    BEGIN
                        SELECT RAISE(ABORT, 'audit_events is append-only');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS audit_events_no_delete
                    BEFORE DELETE ON audit_events
                    BEGIN
                        SELECT RAISE(ABORT, 'audit_events is append-only');
                    END
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_instances_status_expires ON instances(status, expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_instances_owner ON instances(principal_id, challenge_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_credentials_key ON credentials(key_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_principal ON audit_events(principal_id, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_instance ON audit_events(instance_id, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_challenge ON audit_events(challenge_id, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_action ON audit_events(action, id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureInstanceColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(instances)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("teardown_failures")) {
                st.execute("ALTER TABLE instances ADD COLUMN teardown_failures INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("expire_retry_at_ms")) {
                st.execute("ALTER TABLE instances ADD COLUMN expire_retry_at_ms INTEGER");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_claim_sweep_index",
                "Index running instances by teardown claim age for stale-claim recovery",
                List.of("CREATE INDEX IF NOT EXISTS idx_instances_claimed ON instances(status, claimed_at_ms)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_audit_time_index",
                "Index audit events by time window",
                List.of("CREATE INDEX IF NOT EXISTS idx_audit_time ON audit_events(occurred_at_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
        LOG.info("Applied schema migration {}", step.version());
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY applied_at_ms, version";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run() throws SQLException;
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
