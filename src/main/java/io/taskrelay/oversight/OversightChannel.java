package io.taskrelay.oversight;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.config.TaskRelayConfig;
import io.taskrelay.model.Directive;
import io.taskrelay.model.DirectiveStatus;
import io.taskrelay.model.DirectiveType;
import io.taskrelay.storage.Database;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Directives from the coordinator to workers, kept in the store. Workers poll
 * {@link #pendingFor(String)} and acknowledge what they have applied.
 */
public final class OversightChannel {
    private static final Logger log = LoggerFactory.getLogger(OversightChannel.class);
    private static final String COLUMNS =
            "directive_id,type,content,target,task_id,status,issued_at_ms,acknowledged_at_ms,acknowledged_by";
    private static final Comparator<Directive> DELIVERY_ORDER = Comparator
            .comparingInt((Directive d) -> d.type().rank()).reversed()
            .thenComparingLong(Directive::issuedAtMs)
            .thenComparing(Directive::directiveId);

    private final Database database;
    private final TaskStore taskStore;

    public OversightChannel(Database database, TaskStore taskStore) {
        this.database = database;
        this.taskStore = taskStore;
    }

    public String send(DirectiveType type, String content, String target, Long taskId, long nowMs) {
        if (type == null) {
            throw new IllegalArgumentException("directive type is required");
        }
        String safeTarget = target == null || target.isBlank() ? Directive.TARGET_ALL : target.trim();
        String safeContent = content == null ? "" : content.trim();
        if (safeContent.isEmpty() && type != DirectiveType.ABORT_TASK) {
            throw new IllegalArgumentException("directive content must not be blank");
        }
        if (type == DirectiveType.ABORT_TASK && taskId == null && Directive.TARGET_ALL.equalsIgnoreCase(safeTarget)) {
            throw new IllegalArgumentException("abort_task needs a worker target or a task id");
        }
        if (type == DirectiveType.PRIORITY_CHANGE) {
            parsePriorityChange(safeContent, taskId);
        }
        String id = "dir_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        database.update("send directive",
                "INSERT INTO directives(directive_id,type,content,target,task_id,status,issued_at_ms) VALUES(?,?,?,?,?,?,?)",
                ps -> {
                    ps.setString(1, id);
                    ps.setString(2, type.name());
                    ps.setString(3, safeContent);
                    ps.setString(4, safeTarget);
                    if (taskId == null) {
                        ps.setNull(5, Types.INTEGER);
                    } else {
                        ps.setLong(5, taskId);
                    }
                    ps.setString(6, DirectiveStatus.PENDING.name());
                    ps.setLong(7, nowMs);
                });
        log.info("Directive {} {} issued to {}", id, type, safeTarget);
        return id;
    }

    /**
     * Pending directives addressed to {@code target} or to everyone, most urgent
     * type first, then by issue time.
     */
    public List<Directive> pendingFor(String target) {
        List<Directive> rows = database.query("list pending directives",
                "SELECT " + COLUMNS + " FROM directives WHERE status='PENDING' AND (target=? OR target=?)",
                ps -> {
                    ps.setString(1, target);
                    ps.setString(2, Directive.TARGET_ALL);
                },
                OversightChannel::mapDirective);
        List<Directive> out = new ArrayList<>(rows);
        out.sort(DELIVERY_ORDER);
        return out;
    }

    public List<Directive> pendingOfType(DirectiveType type) {
        List<Directive> rows = database.query("list pending directives by type",
                "SELECT " + COLUMNS + " FROM directives WHERE status='PENDING' AND type=?",
                ps -> ps.setString(1, type.name()),
                OversightChannel::mapDirective);
        List<Directive> out = new ArrayList<>(rows);
        out.sort(DELIVERY_ORDER);
        return out;
    }

    /**
     * Marks a pending directive acknowledged. A priority change is applied to its task
     * in the same transaction. Returns false when the directive was not pending.
     */
    public boolean acknowledge(String directiveId, String by, long nowMs) {
        String ackBy = by == null || by.isBlank() ? "operator" : by.trim();
        return database.inTransaction("acknowledge directive", c -> {
            List<Directive> rows = Database.query(c,
                    "SELECT " + COLUMNS + " FROM directives WHERE directive_id=?",
                    ps -> ps.setString(1, directiveId),
                    OversightChannel::mapDirective);
            if (rows.isEmpty() || rows.get(0).status() != DirectiveStatus.PENDING) {
                return false;
            }
            Directive directive = rows.get(0);
            int updated = Database.update(c,
                    "UPDATE directives SET status='ACKNOWLEDGED', acknowledged_at_ms=?, acknowledged_by=? "
                            + "WHERE directive_id=? AND status='PENDING'",
                    ps -> {
                        ps.setLong(1, nowMs);
                        ps.setString(2, ackBy);
                        ps.setString(3, directiveId);
                    });
            if (updated != 1) {
                return false;
            }
            if (directive.type() == DirectiveType.PRIORITY_CHANGE) {
                PriorityChange change = parsePriorityChange(directive.content(), directive.taskId());
                boolean applied = taskStore.updatePriority(c, change.taskId(), change.priority(), nowMs);
                if (!applied) {
                    log.warn("Priority change {} skipped: task {} is not active", directiveId, change.taskId());
                }
            }
            return true;
        });
    }

    public Optional<Directive> get(String directiveId) {
        return database.queryOne("load directive",
                "SELECT " + COLUMNS + " FROM directives WHERE directive_id=?",
                ps -> ps.setString(1, directiveId),
                OversightChannel::mapDirective);
    }

    public List<Directive> list(DirectiveStatus status, int limit) {
        int safeLimit = Math.max(1, Math.min(1000, limit));
        if (status == null) {
            return database.query("list directives",
                    "SELECT " + COLUMNS + " FROM directives ORDER BY issued_at_ms DESC, directive_id DESC LIMIT ?",
                    ps -> ps.setInt(1, safeLimit),
                    OversightChannel::mapDirective);
        }
        return database.query("list directives",
                "SELECT " + COLUMNS + " FROM directives WHERE status=? ORDER BY issued_at_ms DESC, directive_id DESC LIMIT ?",
                ps -> {
                    ps.setString(1, status.name());
                    ps.setInt(2, safeLimit);
                },
                OversightChannel::mapDirective);
    }

    public int countPending() {
        return database.queryOne("count pending directives",
                "SELECT COUNT(*) AS c FROM directives WHERE status='PENDING'",
                ps -> { },
                rs -> rs.getInt("c")).orElse(0);
    }

    /**
     * Accepts {@code {"task_id": n, "priority": p}} or a bare integer priority paired
     * with the directive's task reference.
     */
    public static PriorityChange parsePriorityChange(String content, Long taskId) {
        String raw = content == null ? "" : content.trim();
        if (raw.startsWith("{")) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(raw);
            } catch (IOException e) {
                throw new IllegalArgumentException("priority_change content is not valid JSON", e);
            }
            JsonNode idNode = node.path("task_id");
            JsonNode priorityNode = node.path("priority");
            long id = idNode.canConvertToLong() ? idNode.asLong() : taskId == null ? -1L : taskId;
            if (id <= 0 || !priorityNode.canConvertToInt()) {
                throw new IllegalArgumentException("priority_change requires task_id and integer priority");
            }
            return new PriorityChange(id, checkPriority(priorityNode.asInt()));
        }
        if (taskId == null) {
            throw new IllegalArgumentException("priority_change requires a task id");
        }
        try {
            return new PriorityChange(taskId, checkPriority(Integer.parseInt(raw)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("priority_change content must be an integer priority", e);
        }
    }

    private static int checkPriority(int priority) {
        if (priority < 0 || priority > TaskRelayConfig.MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be within [0, " + TaskRelayConfig.MAX_PRIORITY + "]");
        }
        return priority;
    }

    private static Directive mapDirective(ResultSet rs) throws SQLException {
        return new Directive(
                rs.getString("directive_id"),
                DirectiveType.fromString(rs.getString("type")),
                rs.getString("content"),
                rs.getString("target"),
                Database.nullableLong(rs, "task_id"),
                DirectiveStatus.valueOf(rs.getString("status")),
                rs.getLong("issued_at_ms"),
                Database.nullableLong(rs, "acknowledged_at_ms"),
                rs.getString("acknowledged_by")
        );
    }

    public record PriorityChange(long taskId, int priority) {}
}
