package io.taskrelay.health;

import io.taskrelay.model.Intervention;
import io.taskrelay.storage.Database;

import java.sql.Types;
import java.util.List;

/**
 * Record of corrective actions taken on workers: confirmations, nudges,
 * re-queues and aborts.
 */
public final class InterventionLog {
    public static final String CONFIRM = "confirm";
    public static final String NUDGE = "nudge";
    public static final String REQUEUE = "requeue";
    public static final String ABORT = "abort";

    private final Database database;

    public InterventionLog(Database database) {
        this.database = database;
    }

    public void record(String worker, Long taskId, String kind, String promptKey, String outcome, String detail, long nowMs) {
        database.update("record intervention",
                "INSERT INTO interventions(worker_name,task_id,kind,prompt_key,outcome,detail,occurred_at_ms) VALUES(?,?,?,?,?,?,?)",
                ps -> {
                    ps.setString(1, worker);
                    if (taskId == null) {
                        ps.setNull(2, Types.INTEGER);
                    } else {
                        ps.setLong(2, taskId);
                    }
                    ps.setString(3, kind);
                    ps.setString(4, promptKey);
                    ps.setString(5, outcome);
                    ps.setString(6, detail);
                    ps.setLong(7, nowMs);
                });
    }

    public List<Intervention> list(String worker, int limit) {
        int safeLimit = Math.max(1, Math.min(1000, limit));
        String where = worker == null || worker.isBlank() ? "" : " WHERE worker_name=?";
        return database.query("list interventions",
                "SELECT id,worker_name,task_id,kind,prompt_key,outcome,detail,occurred_at_ms FROM interventions"
                        + where + " ORDER BY id DESC LIMIT ?",
                ps -> {
                    int i = 1;
                    if (!where.isEmpty()) {
                        ps.setString(i++, worker.trim());
                    }
                    ps.setInt(i, safeLimit);
                },
                rs -> new Intervention(
                        rs.getLong("id"),
                        rs.getString("worker_name"),
                        Database.nullableLong(rs, "task_id"),
                        rs.getString("kind"),
                        rs.getString("prompt_key"),
                        rs.getString("outcome"),
                        rs.getString("detail"),
                        rs.getLong("occurred_at_ms")
                ));
    }
}
