package io.taskrelay.dispatch;

import io.taskrelay.lock.DirectoryLockManager;
import io.taskrelay.model.FailureKind;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.TaskView;
import io.taskrelay.observability.AuditLogger;
import io.taskrelay.storage.Database;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.storage.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transitions that end a worker's hold on a task. Each one updates the task, frees
 * the worker and releases the directory lock in a single transaction.
 */
public final class TaskTransitions {
    private static final Logger log = LoggerFactory.getLogger(TaskTransitions.class);

    private final Database database;
    private final TaskStore taskStore;
    private final WorkerRegistry workers;
    private final DirectoryLockManager locks;
    private final AuditLogger audit;

    public TaskTransitions(Database database, TaskStore taskStore, WorkerRegistry workers, DirectoryLockManager locks,
                           AuditLogger audit) {
        this.database = database;
        this.taskStore = taskStore;
        this.workers = workers;
        this.locks = locks;
        this.audit = audit;
    }

    public boolean complete(TaskView task, String actor, long nowMs) {
        String worker = task.assignedWorker();
        if (worker == null) {
            return false;
        }
        boolean done = database.inTransaction("complete task", c -> {
            if (!taskStore.complete(c, task.taskId(), worker, nowMs)) {
                return false;
            }
            workers.release(c, worker, task.taskId(), nowMs);
            locks.release(c, task.workingDirectory(), worker);
            return true;
        });
        if (done) {
            log.info("Task {} completed on {}", task.taskId(), worker);
            auditTransition("task.complete", actor, "completed", task, worker, null);
        }
        return done;
    }

    /**
     * Retry rule: pending with one more retry, or failed when the budget is spent.
     */
    public TaskStore.RetryOutcome requeue(TaskView task, FailureKind kind, String detail, String actor, long nowMs) {
        String worker = task.assignedWorker();
        if (worker == null) {
            return TaskStore.RetryOutcome.STALE;
        }
        TaskStore.RetryOutcome outcome = database.inTransaction("requeue task", c -> {
            TaskStore.RetryOutcome r = taskStore.requeueOrFail(c, task.taskId(), worker, kind, detail, nowMs);
            if (r != TaskStore.RetryOutcome.STALE) {
                workers.release(c, worker, task.taskId(), nowMs);
                locks.release(c, task.workingDirectory(), worker);
            }
            return r;
        });
        if (outcome != TaskStore.RetryOutcome.STALE) {
            log.info("Task {} on {} {} ({})", task.taskId(), worker, outcome == TaskStore.RetryOutcome.REQUEUED
                    ? "re-queued" : "failed", kind.format(detail));
            auditTransition("task." + kind.label(), actor, outcome.name().toLowerCase(), task, worker, kind.format(detail));
        }
        return outcome;
    }

    /**
     * Forces a held task to cancelled without touching its retry budget. Aborting a
     * task that is no longer held is a no-op.
     */
    public boolean abort(TaskView task, String reason, String actor, long nowMs) {
        String worker = task.assignedWorker();
        if (worker == null) {
            return false;
        }
        boolean aborted = database.inTransaction("abort task", c -> {
            if (!taskStore.abort(c, task.taskId(), reason, nowMs)) {
                return false;
            }
            workers.release(c, worker, task.taskId(), nowMs);
            locks.release(c, task.workingDirectory(), worker);
            return true;
        });
        if (aborted) {
            log.info("Task {} on {} aborted: {}", task.taskId(), worker, reason);
            auditTransition("task.abort", actor, "cancelled", task, worker, reason);
        }
        return aborted;
    }

    /**
     * Operator cancel of a pending or assigned task. Returns the task as it was
     * before the cancel, or empty when the task was in any other state.
     */
    public Optional<TaskView> cancel(long taskId, String reason, String actor, long nowMs) {
        Optional<TaskView> before = database.inTransaction("cancel task", c -> {
            Optional<TaskView> current = taskStore.getTask(c, taskId);
            if (current.isEmpty()) {
                return Optional.<TaskView>empty();
            }
            TaskView task = current.get();
            if (task.status() != TaskStatus.PENDING && task.status() != TaskStatus.ASSIGNED) {
                return Optional.<TaskView>empty();
            }
            if (!taskStore.cancel(c, taskId, reason, nowMs)) {
                return Optional.<TaskView>empty();
            }
            if (task.assignedWorker() != null) {
                workers.release(c, task.assignedWorker(), taskId, nowMs);
                locks.release(c, task.workingDirectory(), task.assignedWorker());
            }
            return current;
        });
        before.ifPresent(t -> auditTransition("task.cancel", actor, "cancelled", t, t.assignedWorker(), reason));
        return before;
    }

    private void auditTransition(String action, String actor, String result, TaskView task, String worker, String detail) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", task.status().name());
        details.put("retry_count", task.retryCount());
        if (detail != null) {
            details.put("detail", detail);
        }
        audit.log(AuditLogger.AuditEvent.of(action, actor, result, task.taskId(), worker, details));
    }
}
