package io.taskrelay.dedup;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.storage.Database;
import io.taskrelay.util.Hashing;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Refuses content that matches a task still in flight. Entries are keyed by the
 * SHA-256 of the whitespace-normalized text, so two different texts with equal
 * digests are treated as duplicates.
 */
public final class DeduplicationGuard {
    private final Database database;
    private final Supplier<RelaySettings> settings;

    public DeduplicationGuard(Database database, Supplier<RelaySettings> settings) {
        this.database = database;
        this.settings = settings;
    }

    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return content.strip().replaceAll("\\s+", " ");
    }

    public static String fingerprint(String content) {
        return Hashing.sha256Hex(normalize(content));
    }

    public DedupOutcome register(long taskId, String content, long nowMs) {
        String hash = fingerprint(content);
        return database.inTransaction("register dedup entry", c -> {
            Optional<DedupOutcome> existing = findDuplicate(c, hash, nowMs);
            if (existing.isPresent() && existing.get().taskId() != taskId) {
                return existing.get();
            }
            writeEntry(c, hash, taskId, nowMs);
            return DedupOutcome.registered(taskId);
        });
    }

    /**
     * Looks for an entry with this fingerprint created inside the lookback window
     * whose task is still pending, assigned or in progress.
     */
    public Optional<DedupOutcome> findDuplicate(Connection c, String hash, long nowMs) throws SQLException {
        long since = nowMs - settings.get().dedupLookbackMs();
        List<DedupOutcome> rows = Database.query(c,
                "SELECT d.task_id AS task_id, t.status AS status FROM dedup_entries d "
                        + "JOIN tasks t ON t.task_id=d.task_id "
                        + "WHERE d.content_hash=? AND d.created_at_ms>=? AND d.expires_at_ms>? AND d.status<>'CANCELLED' "
                        + "AND t.status IN ('PENDING','ASSIGNED','IN_PROGRESS')",
                ps -> {
                    ps.setString(1, hash);
                    ps.setLong(2, since);
                    ps.setLong(3, nowMs);
                },
                rs -> DedupOutcome.duplicateOf(rs.getLong("task_id"), TaskStatus.fromString(rs.getString("status"))));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void writeEntry(Connection c, String hash, long taskId, long nowMs) throws SQLException {
        long expiresAt = nowMs + settings.get().dedupTtlMs();
        Database.update(c,
                "INSERT INTO dedup_entries(content_hash,task_id,status,created_at_ms,expires_at_ms) VALUES(?,?,'PENDING',?,?) "
                        + "ON CONFLICT(content_hash) DO UPDATE SET task_id=excluded.task_id, status=excluded.status, "
                        + "created_at_ms=excluded.created_at_ms, expires_at_ms=excluded.expires_at_ms",
                ps -> {
                    ps.setString(1, hash);
                    ps.setLong(2, taskId);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, expiresAt);
                });
    }

    /**
     * Copies task status onto entries and deletes expired ones. Returns the number deleted.
     */
    public int sweep(long nowMs) {
        return database.inTransaction("sweep dedup entries", c -> {
            Database.update(c,
                    "UPDATE dedup_entries SET status=(SELECT t.status FROM tasks t WHERE t.task_id=dedup_entries.task_id) "
                            + "WHERE EXISTS (SELECT 1 FROM tasks t WHERE t.task_id=dedup_entries.task_id AND t.status<>dedup_entries.status)",
                    ps -> { });
            return Database.update(c,
                    "DELETE FROM dedup_entries WHERE expires_at_ms<=?",
                    ps -> ps.setLong(1, nowMs));
        });
    }

    public int count() {
        return database.queryOne("count dedup entries",
                "SELECT COUNT(*) AS c FROM dedup_entries",
                ps -> { },
                rs -> rs.getInt("c")).orElse(0);
    }
}
