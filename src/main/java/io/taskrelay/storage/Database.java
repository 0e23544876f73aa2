package io.taskrelay.storage;

import io.taskrelay.config.TaskRelayConfig;
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
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Embedded SQLite store shared by every component. Connections open IMMEDIATE
 * transactions so a read-then-write sequence inside {@link #inTransaction} holds the
 * write lock from its first statement.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "taskrelay.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final TaskRelayConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(TaskRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    public int update(String operation, String sql, Binder binder) {
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    public <T> List<T> query(String operation, String sql, Binder binder, RowMapper<T> mapper) {
        try (Connection c = openConnection()) {
            return query(c, sql, binder, mapper);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    public <T> Optional<T> queryOne(String operation, String sql, Binder binder, RowMapper<T> mapper) {
        List<T> rows = query(operation, sql, binder, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public static <T> List<T> query(Connection c, String sql, Binder binder, RowMapper<T> mapper) throws SQLException {
        List<T> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
        }
        return out;
    }

    public static int update(Connection c, String sql, Binder binder) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        }
    }

    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        content TEXT NOT NULL,
                        priority INTEGER NOT NULL,
                        work_type TEXT NOT NULL,
                        target_worker TEXT,
                        status TEXT NOT NULL,
                        assigned_worker TEXT,
                        assigned_at_ms INTEGER,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL,
                        timeout_minutes INTEGER NOT NULL,
                        timeout_at_ms INTEGER,
                        content_fingerprint TEXT NOT NULL,
                        working_directory TEXT NOT NULL,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        CHECK ((status IN ('ASSIGNED','IN_PROGRESS')) = (assigned_worker IS NOT NULL)),
                        CHECK (retry_count <= max_retries)
                    )
                    """);
            ensureTaskColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS workers (
                        name TEXT PRIMARY KEY,
                        location TEXT NOT NULL DEFAULT 'local',
                        session TEXT NOT NULL,
                        affinity TEXT NOT NULL,
                        status TEXT NOT NULL,
                        current_task_id INTEGER,
                        last_activity_at_ms INTEGER NOT NULL,
                        last_assigned_at_ms INTEGER NOT NULL DEFAULT 0,
                        last_output_digest TEXT,
                        registered_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS directory_locks (
                        directory_path TEXT PRIMARY KEY,
                        holder_worker TEXT NOT NULL,
                        task_id INTEGER,
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS dedup_entries (
                        content_hash TEXT PRIMARY KEY,
                        task_id INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS cooldowns (
                        worker_name TEXT NOT NULL,
                        prompt_key TEXT NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(worker_name, prompt_key)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS directives (
                        directive_id TEXT PRIMARY KEY,
                        type TEXT NOT NULL,
                        content TEXT NOT NULL,
                        target TEXT NOT NULL,
                        task_id INTEGER,
                        status TEXT NOT NULL,
                        issued_at_ms INTEGER NOT NULL,
                        acknowledged_at_ms INTEGER,
                        acknowledged_by TEXT
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS interventions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        worker_name TEXT NOT NULL,
                        task_id INTEGER,
                        kind TEXT NOT NULL,
                        prompt_key TEXT,
                        outcome TEXT NOT NULL,
                        detail TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_priority ON tasks(status, priority DESC, task_id ASC)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_worker_status ON tasks(assigned_worker, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_timeout ON tasks(status, timeout_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_workers_status_assigned ON workers(status, last_assigned_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_locks_expires ON directory_locks(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dedup_expires ON dedup_entries(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_cooldowns_expires ON cooldowns(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_directives_target_status ON directives(target, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_interventions_time ON interventions(occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureTaskColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(tasks)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("nudged_at_ms")) {
                st.execute("ALTER TABLE tasks ADD COLUMN nudged_at_ms INTEGER");
            }
            if (!columns.contains("retry_of")) {
                st.execute("ALTER TABLE tasks ADD COLUMN retry_of INTEGER");
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
                "20261001_001_task_retry_lineage",
                "Index retry lineage and fingerprints on tasks",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_tasks_retry_of ON tasks(retry_of)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_fingerprint ON tasks(content_fingerprint)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
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

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
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
        return query(
                "list schema migrations",
                "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY applied_at_ms DESC, version DESC",
                ps -> { },
                rs -> new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                )
        );
    }

    public interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    private record MigrationStep(String version, String description, List<String> sql) {
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
