package io.taskrelay.dispatch;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.Directive;
import io.taskrelay.model.DirectiveType;
import io.taskrelay.model.FailureKind;
import io.taskrelay.model.TaskView;
import io.taskrelay.model.WorkerView;
import io.taskrelay.observability.AuditLogger;
import io.taskrelay.oversight.OversightChannel;
import io.taskrelay.session.DeliveryResult;
import io.taskrelay.session.SessionDriver;
import io.taskrelay.storage.Database;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.storage.WorkerRegistry;
import io.taskrelay.lock.DirectoryLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Moves pending tasks onto idle workers. Claiming the task, the worker and the
 * directory lock is one transaction; delivery to the session happens after commit
 * so no store lock is held while tmux or ssh runs.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final int SCHEDULE_BATCH = 500;
    static final String ACTOR = "scheduler";

    private final Database database;
    private final TaskStore taskStore;
    private final WorkerRegistry workers;
    private final DirectoryLockManager locks;
    private final OversightChannel oversight;
    private final SessionDriver sessions;
    private final AuditLogger audit;
    private final Supplier<RelaySettings> settings;

    public Dispatcher(
            Database database,
            TaskStore taskStore,
            WorkerRegistry workers,
            DirectoryLockManager locks,
            OversightChannel oversight,
            SessionDriver sessions,
            AuditLogger audit,
            Supplier<RelaySettings> settings
    ) {
        this.database = database;
        this.taskStore = taskStore;
        this.workers = workers;
        this.locks = locks;
        this.oversight = oversight;
        this.sessions = sessions;
        this.audit = audit;
        this.settings = settings;
    }

    /**
     * One scheduling pass: apply priority changes, renew held leases, then try every
     * pending task in queue order. Tasks that cannot be placed stay pending.
     */
    public ScheduleReport scheduleOnce(long nowMs) {
        int priorityChanges = applyPriorityChanges(nowMs);
        renewLeases(nowMs);
        List<DispatchResult> results = new ArrayList<>();
        for (TaskView task : taskStore.listPending(SCHEDULE_BATCH)) {
            results.add(dispatch(task, nowMs));
        }
        ScheduleReport report = ScheduleReport.of(priorityChanges, results);
        if (report.considered() > 0) {
            log.debug("Schedule pass: considered={} sent={} lockHeld={} noWorker={} transportErrors={}",
                    report.considered(), report.sent(), report.lockHeld(), report.noWorker(), report.transportErrors());
        }
        return report;
    }

    public DispatchResult dispatch(TaskView task, long nowMs) {
        List<WorkerView> eligible = new ArrayList<>();
        for (WorkerView w : workers.listEligible(task.workType(), task.targetWorker())) {
            if (!hasPendingAbort(w.name())) {
                eligible.add(w);
            }
        }
        if (eligible.isEmpty()) {
            String detail = task.hasTarget()
                    ? "target " + task.targetWorker() + " not idle for " + task.workType().wireName()
                    : "no idle worker for " + task.workType().wireName();
            return DispatchResult.noWorker(task.taskId(), detail);
        }
        WorkerView worker = eligible.get(0);

        DispatchResult claim;
        try {
            claim = database.inTransaction("claim task", c -> {
                if (!locks.acquire(c, task.workingDirectory(), worker.name(), task.taskId(), settings.get().lockTtlMs(), nowMs)) {
                    return DispatchResult.lockHeld(task.taskId(), worker.name(), "directory locked: " + task.workingDirectory());
                }
                if (!taskStore.claim(c, task.taskId(), worker.name(), nowMs)) {
                    throw new ClaimLost("task no longer pending");
                }
                if (!workers.claim(c, worker.name(), task.taskId(), nowMs)) {
                    throw new ClaimLost("worker " + worker.name() + " no longer idle");
                }
                return null;
            });
        } catch (ClaimLost e) {
            log.debug("Claim of task {} lost: {}", task.taskId(), e.getMessage());
            return DispatchResult.noWorker(task.taskId(), "claim_conflict: " + e.getMessage());
        }
        if (claim != null) {
            auditAttempt(task, worker, "lock_held", claim.detail());
            return claim;
        }

        List<Directive> carried = carriedDirectives(worker.name());
        DeliveryResult delivery = sessions.inject(worker, composeText(task, carried));
        if (delivery.delivered()) {
            for (Directive d : carried) {
                if (!d.broadcast()) {
                    oversight.acknowledge(d.directiveId(), worker.name(), nowMs);
                }
            }
            auditAttempt(task, worker, "sent", null);
            log.info("Task {} sent to {}", task.taskId(), worker.name());
            return DispatchResult.sent(task.taskId(), worker.name());
        }

        TaskStore.RetryOutcome outcome = database.inTransaction("revert failed delivery", c -> {
            TaskStore.RetryOutcome r = taskStore.requeueOrFail(c, task.taskId(), worker.name(), FailureKind.DELIVERY, delivery.error(), nowMs);
            workers.release(c, worker.name(), task.taskId(), nowMs);
            workers.markUnreachable(c, worker.name(), nowMs);
            locks.release(c, task.workingDirectory(), worker.name());
            return r;
        });
        log.warn("Delivery of task {} to {} failed ({}): {}", task.taskId(), worker.name(), outcome, delivery.error());
        auditAttempt(task, worker, "transport_error", delivery.error() + " -> " + outcome.name().toLowerCase());
        return DispatchResult.transportError(task.taskId(), worker.name(), delivery.error());
    }

    /**
     * Extends the directory lease of every assigned or in-progress task.
     */
    public int renewLeases(long nowMs) {
        int renewed = 0;
        long ttl = settings.get().lockTtlMs();
        for (TaskView task : taskStore.listHeld()) {
            if (locks.renew(task.workingDirectory(), task.assignedWorker(), ttl, nowMs)) {
                renewed++;
            } else if (locks.acquire(task.workingDirectory(), task.assignedWorker(), task.taskId(), ttl, nowMs)) {
                log.info("Re-acquired lapsed lock on {} for task {}", task.workingDirectory(), task.taskId());
                renewed++;
            } else {
                log.warn("Task {} on {} lost its directory lock on {}", task.taskId(), task.assignedWorker(), task.workingDirectory());
            }
        }
        return renewed;
    }

    static String composeText(TaskView task, List<Directive> carried) {
        if (carried.isEmpty()) {
            return task.content();
        }
        StringBuilder sb = new StringBuilder();
        for (Directive d : carried) {
            sb.append('[').append(d.type().name().toLowerCase()).append("] ").append(d.content()).append('\n');
        }
        sb.append('\n').append(task.content());
        return sb.toString();
    }

    private int applyPriorityChanges(long nowMs) {
        int applied = 0;
        for (Directive d : oversight.pendingOfType(DirectiveType.PRIORITY_CHANGE)) {
            if (oversight.acknowledge(d.directiveId(), ACTOR, nowMs)) {
                applied++;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("directive_id", d.directiveId());
                details.put("content", d.content());
                audit.log(AuditLogger.AuditEvent.of("directive.priority_change", ACTOR, "applied", d.taskId(), null, details));
            }
        }
        return applied;
    }

    private List<Directive> carriedDirectives(String worker) {
        List<Directive> out = new ArrayList<>();
        for (Directive d : oversight.pendingFor(worker)) {
            if (d.type() == DirectiveType.GUIDANCE || d.type() == DirectiveType.CONSTRAINT
                    || d.type() == DirectiveType.ESCALATION_RULE) {
                out.add(d);
            }
        }
        return out;
    }

    private boolean hasPendingAbort(String worker) {
        for (Directive d : oversight.pendingFor(worker)) {
            if (d.type() == DirectiveType.ABORT_TASK && !d.broadcast()) {
                return true;
            }
        }
        return false;
    }

    private void auditAttempt(TaskView task, WorkerView worker, String result, String detail) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("location", worker.location());
        details.put("session", worker.session());
        details.put("working_directory", task.workingDirectory());
        if (detail != null) {
            details.put("detail", detail);
        }
        audit.log(AuditLogger.AuditEvent.of("task.dispatch", ACTOR, result, task.taskId(), worker.name(), details));
    }

    private static final class ClaimLost extends RuntimeException {
        ClaimLost(String message) {
            super(message);
        }
    }
}
