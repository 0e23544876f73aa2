package io.taskrelay.lock;

import io.taskrelay.model.DirectoryLock;
import io.taskrelay.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * Leased mutual exclusion over working directories. A directory has at most one
 * live lock; an expired lease is reclaimed by the next acquirer.
 */
public final class DirectoryLockManager {
    private static final Logger log = LoggerFactory.getLogger(DirectoryLockManager.class);
    private static final String COLUMNS = "directory_path,holder_worker,task_id,acquired_at_ms,expires_at_ms";

    private final Database database;

    public DirectoryLockManager(Database database) {
        this.database = database;
    }

    public static String normalize(String directory) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("working directory must not be blank");
        }
        try {
            Path path = Paths.get(directory.trim()).toAbsolutePath().normalize();
            return path.toString();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("invalid working directory: " + directory, e);
        }
    }

    public boolean acquire(String directory, String holder, Long taskId, long ttlMs, long nowMs) {
        return database.inTransaction("acquire directory lock",
                c -> acquire(c, directory, holder, taskId, ttlMs, nowMs));
    }

    /**
     * Insert-if-absent. A conflicting row that has already expired is deleted and the
     * insert retried once. A live lease is never taken over, not even by its own
     * holder; extending it is {@link #renew}'s job.
     */
    public boolean acquire(Connection c, String directory, String holder, Long taskId, long ttlMs, long nowMs)
            throws SQLException {
        String path = normalize(directory);
        long expiresAt = nowMs + Math.max(1L, ttlMs);
        if (tryInsert(c, path, holder, taskId, nowMs, expiresAt)) {
            return true;
        }
        int purged = Database.update(c,
                "DELETE FROM directory_locks WHERE directory_path=? AND expires_at_ms<=?",
                ps -> {
                    ps.setString(1, path);
                    ps.setLong(2, nowMs);
                });
        if (purged > 0) {
            log.info("Reclaimed expired lock on {}", path);
            return tryInsert(c, path, holder, taskId, nowMs, expiresAt);
        }
        return false;
    }

    public boolean release(String directory, String holder) {
        return database.inTransaction("release directory lock", c -> release(c, directory, holder));
    }

    public boolean release(Connection c, String directory, String holder) throws SQLException {
        String path = normalize(directory);
        int rows = Database.update(c,
                "DELETE FROM directory_locks WHERE directory_path=? AND holder_worker=?",
                ps -> {
                    ps.setString(1, path);
                    ps.setString(2, holder);
                });
        return rows == 1;
    }

    /**
     * Extends a lease the holder still owns. An expired lease is not revived.
     */
    public boolean renew(String directory, String holder, long ttlMs, long nowMs) {
        String path = normalize(directory);
        int rows = database.update("renew directory lock",
                "UPDATE directory_locks SET expires_at_ms=? WHERE directory_path=? AND holder_worker=? AND expires_at_ms>?",
                ps -> {
                    ps.setLong(1, nowMs + Math.max(1L, ttlMs));
                    ps.setString(2, path);
                    ps.setString(3, holder);
                    ps.setLong(4, nowMs);
                });
        return rows == 1;
    }

    public Optional<DirectoryLock> get(String directory) {
        String path = normalize(directory);
        return database.queryOne("load directory lock",
                "SELECT " + COLUMNS + " FROM directory_locks WHERE directory_path=?",
                ps -> ps.setString(1, path),
                DirectoryLockManager::mapLock);
    }

    public List<DirectoryLock> listActive(long nowMs) {
        return database.query("list directory locks",
                "SELECT " + COLUMNS + " FROM directory_locks WHERE expires_at_ms>? ORDER BY directory_path ASC",
                ps -> ps.setLong(1, nowMs),
                DirectoryLockManager::mapLock);
    }

    public int purgeExpired(long nowMs) {
        return database.update("purge expired directory locks",
                "DELETE FROM directory_locks WHERE expires_at_ms<=?",
                ps -> ps.setLong(1, nowMs));
    }

    private boolean tryInsert(Connection c, String path, String holder, Long taskId, long nowMs, long expiresAt)
            throws SQLException {
        int rows = Database.update(c,
                "INSERT OR IGNORE INTO directory_locks(directory_path,holder_worker,task_id,acquired_at_ms,expires_at_ms) "
                        + "VALUES(?,?,?,?,?)",
                ps -> {
                    ps.setString(1, path);
                    ps.setString(2, holder);
                    bindTaskId(ps, 3, taskId);
                    ps.setLong(4, nowMs);
                    ps.setLong(5, expiresAt);
                });
        return rows == 1;
    }

    private static void bindTaskId(PreparedStatement ps, int index, Long taskId) throws SQLException {
        if (taskId == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, taskId);
        }
    }

    private static DirectoryLock mapLock(ResultSet rs) throws SQLException {
        return new DirectoryLock(
                rs.getString("directory_path"),
                rs.getString("holder_worker"),
                Database.nullableLong(rs, "task_id"),
                rs.getLong("acquired_at_ms"),
                rs.getLong("expires_at_ms")
        );
    }
}
