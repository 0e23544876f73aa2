package io.taskrelay.storage;

import io.taskrelay.model.FailureKind;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.TaskView;
import io.taskrelay.model.WorkType;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task rows and the state machine over them. Each transition is a single UPDATE
 * guarded on the expected current status (and worker, when one is held), so
 * concurrent callers racing on the same row see exactly one winner.
 */
public final class TaskStore {
    private static final String COLUMNS =
            "task_id,content,priority,work_type,target_worker,status,assigned_worker,assigned_at_ms,started_at_ms,"
                    + "completed_at_ms,retry_count,max_retries,timeout_minutes,timeout_at_ms,content_fingerprint,"
                    + "working_directory,last_error,nudged_at_ms,retry_of,created_at_ms,updated_at_ms";
    private static final String HELD = "('ASSIGNED','IN_PROGRESS')";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public long insertPending(Connection c, NewTask t) throws SQLException {
        Database.update(c,
                "INSERT INTO tasks(content,priority,work_type,target_worker,status,retry_count,max_retries,timeout_minutes,"
                        + "content_fingerprint,working_directory,retry_of,created_at_ms,updated_at_ms) "
                        + "VALUES(?,?,?,?,?,0,?,?,?,?,?,?,?)",
                ps -> {
                    ps.setString(1, t.content());
                    ps.setInt(2, t.priority());
                    ps.setString(3, t.workType().name());
                    ps.setString(4, t.targetWorker());
                    ps.setString(5, TaskStatus.PENDING.name());
                    ps.setInt(6, t.maxRetries());
                    ps.setInt(7, t.timeoutMinutes());
                    ps.setString(8, t.contentFingerprint());
                    ps.setString(9, t.workingDirectory());
                    if (t.retryOf() == null) {
                        ps.setNull(10, Types.INTEGER);
                    } else {
                        ps.setLong(10, t.retryOf());
                    }
                    ps.setLong(11, t.nowMs());
                    ps.setLong(12, t.nowMs());
                });
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid returned no row");
            }
            return rs.getLong(1);
        }
    }

    public Optional<TaskView> getTask(long taskId) {
        return database.queryOne("load task",
                "SELECT " + COLUMNS + " FROM tasks WHERE task_id=?",
                ps -> ps.setLong(1, taskId),
                TaskStore::mapTask);
    }

    public Optional<TaskView> getTask(Connection c, long taskId) throws SQLException {
        List<TaskView> rows = Database.query(c,
                "SELECT " + COLUMNS + " FROM tasks WHERE task_id=?",
                ps -> ps.setLong(1, taskId),
                TaskStore::mapTask);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Pending tasks in assignment order: highest priority first, then oldest id.
     */
    public List<TaskView> listPending(int limit) {
        return database.query("list pending tasks",
                "SELECT " + COLUMNS + " FROM tasks WHERE status='PENDING' ORDER BY priority DESC, task_id ASC LIMIT ?",
                ps -> ps.setInt(1, Math.max(1, limit)),
                TaskStore::mapTask);
    }

    public List<TaskView> listTasks(TaskStatus status, int limit, int offset) {
        int safeLimit = Math.max(1, Math.min(1000, limit));
        int safeOffset = Math.max(0, offset);
        if (status == null) {
            return database.query("list tasks",
                    "SELECT " + COLUMNS + " FROM tasks ORDER BY task_id DESC LIMIT ? OFFSET ?",
                    ps -> {
                        ps.setInt(1, safeLimit);
                        ps.setInt(2, safeOffset);
                    },
                    TaskStore::mapTask);
        }
        String order = status == TaskStatus.PENDING ? "priority DESC, task_id ASC" : "task_id DESC";
        return database.query("list tasks",
                "SELECT " + COLUMNS + " FROM tasks WHERE status=? ORDER BY " + order + " LIMIT ? OFFSET ?",
                ps -> {
                    ps.setString(1, status.name());
                    ps.setInt(2, safeLimit);
                    ps.setInt(3, safeOffset);
                },
                TaskStore::mapTask);
    }

    public List<TaskView> listHeld() {
        return database.query("list held tasks",
                "SELECT " + COLUMNS + " FROM tasks WHERE status IN " + HELD + " ORDER BY task_id ASC",
                ps -> { },
                TaskStore::mapTask);
    }

    public Optional<TaskView> findHeldByWorker(String worker) {
        return database.queryOne("load worker task",
                "SELECT " + COLUMNS + " FROM tasks WHERE status IN " + HELD + " AND assigned_worker=? ORDER BY task_id ASC LIMIT 1",
                ps -> ps.setString(1, worker),
                TaskStore::mapTask);
    }

    public List<TaskView> listExpired(long nowMs) {
        return database.query("list expired tasks",
                "SELECT " + COLUMNS + " FROM tasks WHERE status IN " + HELD
                        + " AND timeout_at_ms IS NOT NULL AND timeout_at_ms<=? ORDER BY timeout_at_ms ASC, task_id ASC",
                ps -> ps.setLong(1, nowMs),
                TaskStore::mapTask);
    }

    /**
     * pending to assigned. Fails when another caller already claimed the row.
     */
    public boolean claim(Connection c, long taskId, String worker, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE tasks SET status='ASSIGNED', assigned_worker=?, assigned_at_ms=?, started_at_ms=NULL, "
                        + "timeout_at_ms=? + timeout_minutes*60000, nudged_at_ms=NULL, updated_at_ms=? "
                        + "WHERE task_id=? AND status='PENDING'",
                ps -> {
                    ps.setString(1, worker);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, nowMs);
                    ps.setLong(5, taskId);
                });
        return rows == 1;
    }

    public boolean markInProgress(long taskId, String worker, long nowMs) {
        int rows = database.update("mark task in progress",
                "UPDATE tasks SET status='IN_PROGRESS', started_at_ms=?, updated_at_ms=? "
                        + "WHERE task_id=? AND status='ASSIGNED' AND assigned_worker=?",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, taskId);
                    ps.setString(4, worker);
                });
        return rows == 1;
    }

    /**
     * assigned or in_progress to completed. An assigned task passes through
     * in_progress in the same write, so {@code started_at_ms} is always set.
     */
    public boolean complete(Connection c, long taskId, String worker, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE tasks SET status='COMPLETED', assigned_worker=NULL, started_at_ms=COALESCE(started_at_ms, ?), "
                        + "completed_at_ms=?, timeout_at_ms=NULL, updated_at_ms=? "
                        + "WHERE task_id=? AND status IN " + HELD + " AND assigned_worker=?",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, taskId);
                    ps.setString(5, worker);
                });
        return rows == 1;
    }

    /**
     * Applies the retry rule to a held task: back to pending with one more retry
     * while budget remains, otherwise terminally failed with
     * {@code retries_exhausted} recorded.
     */
    public RetryOutcome requeueOrFail(Connection c, long taskId, String worker, FailureKind kind, String detail, long nowMs)
            throws SQLException {
        String error = kind.format(detail);
        String exhausted = FailureKind.RETRIES_EXHAUSTED.format(error);
        int rows = Database.update(c,
                "UPDATE tasks SET "
                        + "status=CASE WHEN retry_count<max_retries THEN 'PENDING' ELSE 'FAILED' END, "
                        + "retry_count=CASE WHEN retry_count<max_retries THEN retry_count+1 ELSE retry_count END, "
                        + "last_error=CASE WHEN retry_count<max_retries THEN ? ELSE ? END, "
                        + "completed_at_ms=CASE WHEN retry_count<max_retries THEN NULL ELSE ? END, "
                        + "assigned_worker=NULL, assigned_at_ms=NULL, started_at_ms=NULL, timeout_at_ms=NULL, "
                        + "nudged_at_ms=NULL, updated_at_ms=? "
                        + "WHERE task_id=? AND status IN " + HELD + " AND assigned_worker=?",
                ps -> {
                    ps.setString(1, error);
                    ps.setString(2, exhausted);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, nowMs);
                    ps.setLong(5, taskId);
                    ps.setString(6, worker);
                });
        if (rows == 0) {
            return RetryOutcome.STALE;
        }
        TaskView after = getTask(c, taskId).orElseThrow();
        return after.status() == TaskStatus.PENDING ? RetryOutcome.REQUEUED : RetryOutcome.FAILED;
    }

    /**
     * Operator cancel: pending or assigned to cancelled.
     */
    public boolean cancel(Connection c, long taskId, String reason, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE tasks SET status='CANCELLED', assigned_worker=NULL, timeout_at_ms=NULL, last_error=?, "
                        + "completed_at_ms=?, updated_at_ms=? WHERE task_id=? AND status IN ('PENDING','ASSIGNED')",
                ps -> {
                    ps.setString(1, reason);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, taskId);
                });
        return rows == 1;
    }

    /**
     * Forced cancel of a held task, bypassing the retry budget.
     */
    public boolean abort(Connection c, long taskId, String reason, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE tasks SET status='CANCELLED', assigned_worker=NULL, timeout_at_ms=NULL, last_error=?, "
                        + "completed_at_ms=?, updated_at_ms=? WHERE task_id=? AND status IN " + HELD,
                ps -> {
                    ps.setString(1, reason);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, taskId);
                });
        return rows == 1;
    }

    public boolean updatePriority(Connection c, long taskId, int priority, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE tasks SET priority=?, updated_at_ms=? WHERE task_id=? AND status IN ('PENDING','ASSIGNED','IN_PROGRESS')",
                ps -> {
                    ps.setInt(1, priority);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, taskId);
                });
        return rows == 1;
    }

    public boolean markNudged(long taskId, String worker, long nowMs) {
        int rows = database.update("mark task nudged",
                "UPDATE tasks SET nudged_at_ms=?, updated_at_ms=? WHERE task_id=? AND status IN " + HELD + " AND assigned_worker=?",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, taskId);
                    ps.setString(4, worker);
                });
        return rows == 1;
    }

    public void clearNudge(long taskId) {
        database.update("clear task nudge",
                "UPDATE tasks SET nudged_at_ms=NULL WHERE task_id=? AND nudged_at_ms IS NOT NULL",
                ps -> ps.setLong(1, taskId));
    }

    public Map<String, Integer> countsByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status.name(), 0);
        }
        List<Map.Entry<String, Integer>> rows = database.query("count tasks",
                "SELECT status, COUNT(*) AS c FROM tasks GROUP BY status",
                ps -> { },
                rs -> Map.entry(rs.getString("status"), rs.getInt("c")));
        for (Map.Entry<String, Integer> row : rows) {
            out.put(row.getKey(), row.getValue());
        }
        return out;
    }

    static TaskView mapTask(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getLong("task_id"),
                rs.getString("content"),
                rs.getInt("priority"),
                WorkType.fromString(rs.getString("work_type")),
                rs.getString("target_worker"),
                TaskStatus.fromString(rs.getString("status")),
                rs.getString("assigned_worker"),
                Database.nullableLong(rs, "assigned_at_ms"),
                Database.nullableLong(rs, "started_at_ms"),
                Database.nullableLong(rs, "completed_at_ms"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getInt("timeout_minutes"),
                Database.nullableLong(rs, "timeout_at_ms"),
                rs.getString("content_fingerprint"),
                rs.getString("working_directory"),
                rs.getString("last_error"),
                Database.nullableLong(rs, "nudged_at_ms"),
                Database.nullableLong(rs, "retry_of"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public enum RetryOutcome { REQUEUED, FAILED, STALE }

    public record NewTask(String content, int priority, WorkType workType, String targetWorker, int maxRetries,
                          int timeoutMinutes, String contentFingerprint, String workingDirectory, Long retryOf, long nowMs) {}
}
