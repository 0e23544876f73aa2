package io.taskrelay.storage;

import io.taskrelay.model.WorkType;
import io.taskrelay.model.WorkerStatus;
import io.taskrelay.model.WorkerView;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registered workers and their idle/busy/unreachable status. Built once per runtime
 * and passed to every component that needs worker state.
 */
public final class WorkerRegistry {
    private static final String COLUMNS =
            "name,location,session,affinity,status,current_task_id,last_activity_at_ms,last_assigned_at_ms,"
                    + "last_output_digest,registered_at_ms";

    private final Database database;

    public WorkerRegistry(Database database) {
        this.database = database;
    }

    /**
     * Inserts a worker or updates its placement and affinity. Status and the held
     * task of an existing worker are left as they are.
     */
    public WorkerView register(String name, String location, String session, Set<WorkType> affinity, long nowMs) {
        String safeName = requireName(name);
        String safeLocation = requireLocation(location);
        String safeSession = session == null || session.isBlank() ? safeName : session.trim();
        String affinityText = WorkType.formatAffinity(affinity);
        database.update("register worker",
                "INSERT INTO workers(name,location,session,affinity,status,current_task_id,last_activity_at_ms,"
                        + "last_assigned_at_ms,last_output_digest,registered_at_ms,updated_at_ms) "
                        + "VALUES(?,?,?,?,'IDLE',NULL,?,0,NULL,?,?) "
                        + "ON CONFLICT(name) DO UPDATE SET location=excluded.location, session=excluded.session, "
                        + "affinity=excluded.affinity, updated_at_ms=excluded.updated_at_ms",
                ps -> {
                    ps.setString(1, safeName);
                    ps.setString(2, safeLocation);
                    ps.setString(3, safeSession);
                    ps.setString(4, affinityText);
                    ps.setLong(5, nowMs);
                    ps.setLong(6, nowMs);
                    ps.setLong(7, nowMs);
                });
        return get(safeName).orElseThrow(() -> new IllegalStateException("worker vanished after register: " + safeName));
    }

    /**
     * Removes an idle or unreachable worker. A worker holding a task cannot be removed.
     */
    public boolean remove(String name) {
        Optional<WorkerView> existing = get(name);
        if (existing.isEmpty()) {
            return false;
        }
        if (existing.get().currentTaskId() != null) {
            throw new IllegalStateException(
                    "worker " + name + " holds task " + existing.get().currentTaskId() + "; complete or cancel it first");
        }
        int rows = database.update("remove worker",
                "DELETE FROM workers WHERE name=? AND current_task_id IS NULL",
                ps -> ps.setString(1, name));
        return rows == 1;
    }

    public Optional<WorkerView> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return database.queryOne("load worker",
                "SELECT " + COLUMNS + " FROM workers WHERE name=?",
                ps -> ps.setString(1, name.trim()),
                WorkerRegistry::mapWorker);
    }

    public List<WorkerView> list() {
        return database.query("list workers",
                "SELECT " + COLUMNS + " FROM workers ORDER BY name ASC",
                ps -> { },
                WorkerRegistry::mapWorker);
    }

    /**
     * Idle workers able to take {@code workType}, least recently assigned first
     * with ties broken by name. When {@code target} is set only that worker is eligible.
     */
    public List<WorkerView> listEligible(WorkType workType, String target) {
        List<WorkerView> idle = database.query("list idle workers",
                "SELECT " + COLUMNS + " FROM workers WHERE status='IDLE' AND current_task_id IS NULL "
                        + "ORDER BY last_assigned_at_ms ASC, name ASC",
                ps -> { },
                WorkerRegistry::mapWorker);
        List<WorkerView> out = new ArrayList<>();
        for (WorkerView w : idle) {
            if (!w.accepts(workType)) {
                continue;
            }
            if (target != null && !target.isBlank() && !w.name().equals(target.trim())) {
                continue;
            }
            out.add(w);
        }
        return out;
    }

    /**
     * idle to busy for {@code taskId}. Fails when the worker was taken or went away.
     */
    public boolean claim(Connection c, String name, long taskId, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE workers SET status='BUSY', current_task_id=?, last_assigned_at_ms=?, last_activity_at_ms=?, "
                        + "updated_at_ms=? WHERE name=? AND status='IDLE' AND current_task_id IS NULL",
                ps -> {
                    ps.setLong(1, taskId);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, nowMs);
                    ps.setString(5, name);
                });
        return rows == 1;
    }

    /**
     * Frees the worker from {@code taskId}. An unreachable worker stays unreachable.
     */
    public boolean release(Connection c, String name, long taskId, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE workers SET status=CASE WHEN status='UNREACHABLE' THEN 'UNREACHABLE' ELSE 'IDLE' END, "
                        + "current_task_id=NULL, updated_at_ms=? WHERE name=? AND current_task_id=?",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setString(2, name);
                    ps.setLong(3, taskId);
                });
        return rows == 1;
    }

    public boolean markUnreachable(Connection c, String name, long nowMs) throws SQLException {
        int rows = Database.update(c,
                "UPDATE workers SET status='UNREACHABLE', updated_at_ms=? WHERE name=? AND status<>'UNREACHABLE'",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setString(2, name);
                });
        return rows == 1;
    }

    public boolean markUnreachable(String name, long nowMs) {
        return database.inTransaction("mark worker unreachable", c -> markUnreachable(c, name, nowMs));
    }

    /**
     * unreachable back to idle, or busy when the worker still holds a task.
     */
    public boolean restore(String name, long nowMs) {
        int rows = database.update("restore worker",
                "UPDATE workers SET status=CASE WHEN current_task_id IS NULL THEN 'IDLE' ELSE 'BUSY' END, "
                        + "last_activity_at_ms=?, updated_at_ms=? WHERE name=? AND status='UNREACHABLE'",
                ps -> {
                    ps.setLong(1, nowMs);
                    ps.setLong(2, nowMs);
                    ps.setString(3, name);
                });
        return rows == 1;
    }

    /**
     * Stores the digest of the latest captured output. Returns true and bumps
     * {@code last_activity_at_ms} only when the digest changed.
     */
    public boolean recordOutput(String name, String digest, long nowMs) {
        int rows = database.update("record worker output",
                "UPDATE workers SET last_output_digest=?, last_activity_at_ms=?, updated_at_ms=? "
                        + "WHERE name=? AND (last_output_digest IS NULL OR last_output_digest<>?)",
                ps -> {
                    ps.setString(1, digest);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setString(4, name);
                    ps.setString(5, digest);
                });
        return rows == 1;
    }

    public Map<String, Integer> countsByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (WorkerStatus status : WorkerStatus.values()) {
            out.put(status.name(), 0);
        }
        List<Map.Entry<String, Integer>> rows = database.query("count workers",
                "SELECT status, COUNT(*) AS c FROM workers GROUP BY status",
                ps -> { },
                rs -> Map.entry(rs.getString("status"), rs.getInt("c")));
        for (Map.Entry<String, Integer> row : rows) {
            out.put(row.getKey(), row.getValue());
        }
        return out;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("worker name must not be blank");
        }
        String trimmed = name.trim();
        if (!trimmed.matches("[A-Za-z0-9._:-]{1,64}")) {
            throw new IllegalArgumentException("invalid worker name: " + name);
        }
        return trimmed;
    }

    /**
     * 'local' when blank; otherwise an ssh destination, which may not start with a
     * dash or contain whitespace.
     */
    private static String requireLocation(String location) {
        if (location == null || location.isBlank()) {
            return WorkerView.LOCAL;
        }
        String trimmed = location.trim();
        if (!trimmed.matches("[^\\s-]\\S*")) {
            throw new IllegalArgumentException("invalid worker location: " + location);
        }
        return trimmed;
    }

    private static WorkerView mapWorker(ResultSet rs) throws SQLException {
        return new WorkerView(
                rs.getString("name"),
                rs.getString("location"),
                rs.getString("session"),
                WorkType.parseAffinity(rs.getString("affinity")),
                WorkerStatus.valueOf(rs.getString("status")),
                Database.nullableLong(rs, "current_task_id"),
                rs.getLong("last_activity_at_ms"),
                rs.getLong("last_assigned_at_ms"),
                rs.getString("last_output_digest"),
                rs.getLong("registered_at_ms")
        );
    }
}
