package io.taskrelay.health;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.cooldown.CooldownManager;
import io.taskrelay.cooldown.PromptSignature;
import io.taskrelay.dispatch.TaskTransitions;
import io.taskrelay.model.Directive;
import io.taskrelay.model.DirectiveType;
import io.taskrelay.model.FailureKind;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.TaskView;
import io.taskrelay.model.WorkerStatus;
import io.taskrelay.model.WorkerView;
import io.taskrelay.observability.AuditLogger;
import io.taskrelay.oversight.OversightChannel;
import io.taskrelay.session.CaptureResult;
import io.taskrelay.session.DeliveryResult;
import io.taskrelay.session.SessionDriver;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.storage.WorkerRegistry;
import io.taskrelay.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Watches worker panes and feeds what it sees back into the queue. A cycle runs the
 * timeout sweep, then abort directives, then one observation per registered worker.
 */
public final class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
    static final String ACTOR = "monitor";

    private final TaskStore taskStore;
    private final WorkerRegistry workers;
    private final TaskTransitions transitions;
    private final CooldownManager cooldowns;
    private final OversightChannel oversight;
    private final InterventionLog interventions;
    private final ObservationSource source;
    private final SessionDriver sessions;
    private final AuditLogger audit;
    private final Supplier<RelaySettings> settings;

    public HealthMonitor(
            TaskStore taskStore,
            WorkerRegistry workers,
            TaskTransitions transitions,
            CooldownManager cooldowns,
            OversightChannel oversight,
            InterventionLog interventions,
            ObservationSource source,
            SessionDriver sessions,
            AuditLogger audit,
            Supplier<RelaySettings> settings
    ) {
        this.taskStore = taskStore;
        this.workers = workers;
        this.transitions = transitions;
        this.cooldowns = cooldowns;
        this.oversight = oversight;
        this.interventions = interventions;
        this.source = source;
        this.sessions = sessions;
        this.audit = audit;
        this.settings = settings;
    }

    public CycleReport runCycle(long nowMs) {
        List<MonitorAction> actions = new ArrayList<>();
        processAborts(nowMs, actions);
        sweepTimeouts(nowMs, actions);
        OutputClassifier classifier = new OutputClassifier(settings.get().outputPatterns());
        Map<String, ObservationKind> observed = new LinkedHashMap<>();
        List<WorkerView> all = workers.list();
        for (WorkerView worker : all) {
            try {
                observed.put(worker.name(), observe(worker, classifier, nowMs, actions));
            } catch (RuntimeException e) {
                log.error("Observation of worker {} failed", worker.name(), e);
                actions.add(new MonitorAction(worker.name(), worker.currentTaskId(), "observe", "error", e.getMessage()));
            }
        }
        return new CycleReport(all.size(), observed, List.copyOf(actions));
    }

    /**
     * Re-queues or fails every held task past its {@code timeout_at}.
     */
    public int sweepTimeouts(long nowMs, List<MonitorAction> actions) {
        int swept = 0;
        for (TaskView task : taskStore.listExpired(nowMs)) {
            String detail = "exceeded " + task.timeoutMinutes() + "m timeout";
            TaskStore.RetryOutcome outcome = transitions.requeue(task, FailureKind.TIMEOUT, detail, ACTOR, nowMs);
            if (outcome == TaskStore.RetryOutcome.STALE) {
                continue;
            }
            swept++;
            String result = outcome.name().toLowerCase();
            interventions.record(task.assignedWorker(), task.taskId(), InterventionLog.REQUEUE, null, result, detail, nowMs);
            actions.add(new MonitorAction(task.assignedWorker(), task.taskId(), "timeout", result, detail));
        }
        return swept;
    }

    /**
     * Runs before the timeout sweep, so an aborted task is cancelled rather than
     * re-queued. An abort naming a pending task cancels it outright.
     */
    private void processAborts(long nowMs, List<MonitorAction> actions) {
        for (Directive directive : oversight.pendingOfType(DirectiveType.ABORT_TASK)) {
            Optional<TaskView> target = resolveAbortTarget(directive);
            String reason = directive.content() == null || directive.content().isBlank()
                    ? "aborted by directive " + directive.directiveId()
                    : "aborted: " + directive.content();
            if (target.isPresent() && target.get().status().holdsWorker()) {
                TaskView task = target.get();
                boolean aborted = transitions.abort(task, reason, ACTOR, nowMs);
                if (aborted) {
                    workers.get(task.assignedWorker()).ifPresent(w -> {
                        DeliveryResult interrupt = sessions.sendKeys(w, List.of("Escape"));
                        if (!interrupt.delivered()) {
                            log.warn("Interrupt to {} after abort failed: {}", w.name(), interrupt.error());
                        }
                    });
                }
                String outcome = aborted ? "cancelled" : "noop";
                interventions.record(task.assignedWorker(), task.taskId(), InterventionLog.ABORT, null, outcome, reason, nowMs);
                actions.add(new MonitorAction(task.assignedWorker(), task.taskId(), "abort", outcome, directive.directiveId()));
            } else if (target.isPresent() && target.get().status() == TaskStatus.PENDING) {
                TaskView task = target.get();
                String outcome = transitions.cancel(task.taskId(), reason, ACTOR, nowMs).isPresent() ? "cancelled" : "noop";
                interventions.record(directive.target(), task.taskId(), InterventionLog.ABORT, null, outcome, reason, nowMs);
                actions.add(new MonitorAction(directive.target(), task.taskId(), "abort", outcome, directive.directiveId()));
            } else {
                actions.add(new MonitorAction(directive.target(), directive.taskId(), "abort", "noop", directive.directiveId()));
            }
            oversight.acknowledge(directive.directiveId(), ACTOR, nowMs);
        }
    }

    private Optional<TaskView> resolveAbortTarget(Directive directive) {
        if (directive.taskId() != null) {
            return taskStore.getTask(directive.taskId());
        }
        if (directive.broadcast()) {
            return Optional.empty();
        }
        return taskStore.findHeldByWorker(directive.target());
    }

    private ObservationKind observe(WorkerView worker, OutputClassifier classifier, long nowMs, List<MonitorAction> actions) {
        RelaySettings s = settings.get();
        Optional<TaskView> held = taskStore.findHeldByWorker(worker.name());
        CaptureResult capture = source.observe(worker);
        if (!capture.captured()) {
            handleUnreachable(worker, held, capture.error(), nowMs, actions);
            return ObservationKind.UNREACHABLE;
        }
        if (worker.status() == WorkerStatus.UNREACHABLE && workers.restore(worker.name(), nowMs)) {
            log.info("Worker {} reachable again", worker.name());
            actions.add(new MonitorAction(worker.name(), worker.currentTaskId(), "restore", "reachable", null));
        }
        boolean changed = workers.recordOutput(worker.name(), Hashing.sha256Hex(capture.output()), nowMs);
        long lastActivity = changed ? nowMs : worker.lastActivityAtMs();

        if (held.isEmpty()) {
            Observation observation = classifier.classify(capture.output());
            if (observation.kind() == ObservationKind.BLOCKED) {
                handleBlocked(worker, null, observation.evidence(), nowMs, actions);
            }
            return observation.kind();
        }

        TaskView task = held.get();
        Observation observation = classifier.classifyForTask(capture.output(), task.content());
        switch (observation.kind()) {
            case BLOCKED -> {
                markBegun(task, worker, changed, nowMs);
                handleBlocked(worker, task, observation.evidence(), nowMs, actions);
                return ObservationKind.BLOCKED;
            }
            case REPORTED_ERROR -> {
                TaskStore.RetryOutcome outcome = transitions.requeue(task, FailureKind.WORKER_FAULT, observation.evidence(), ACTOR, nowMs);
                actions.add(new MonitorAction(worker.name(), task.taskId(), "worker_error", outcome.name().toLowerCase(), observation.evidence()));
                return ObservationKind.REPORTED_ERROR;
            }
            case REPORTED_DONE -> {
                boolean completed = transitions.complete(task, ACTOR, nowMs);
                actions.add(new MonitorAction(worker.name(), task.taskId(), "complete", completed ? "completed" : "noop", observation.evidence()));
                return ObservationKind.REPORTED_DONE;
            }
            default -> {
                // active, idle or unknown output
            }
        }

        if (changed || observation.kind() == ObservationKind.ACTIVE) {
            markBegun(task, worker, true, nowMs);
        }
        if (changed && task.nudgedAtMs() != null) {
            taskStore.clearNudge(task.taskId());
        }

        long since = Math.max(lastActivity, task.assignedAtMs() == null ? 0L : task.assignedAtMs());
        if (!changed && nowMs - since > s.staleThresholdMs()) {
            handleStale(worker, task, nowMs, actions);
            return ObservationKind.STALE;
        }

        if (observation.kind() == ObservationKind.IDLE && s.completeOnIdle()
                && task.status() == TaskStatus.IN_PROGRESS
                && task.assignedAtMs() != null
                && nowMs - task.assignedAtMs() >= s.idleCompletionGraceMs()) {
            boolean completed = transitions.complete(task, ACTOR, nowMs);
            actions.add(new MonitorAction(worker.name(), task.taskId(), "complete_on_idle", completed ? "completed" : "noop", null));
        }
        return observation.kind();
    }

    private void markBegun(TaskView task, WorkerView worker, boolean evidence, long nowMs) {
        if (evidence && task.status() == TaskStatus.ASSIGNED && taskStore.markInProgress(task.taskId(), worker.name(), nowMs)) {
            log.info("Task {} in progress on {}", task.taskId(), worker.name());
            audit.log(AuditLogger.AuditEvent.of("task.begin", ACTOR, "in_progress", task.taskId(), worker.name(), Map.of()));
        }
    }

    private void handleUnreachable(WorkerView worker, Optional<TaskView> held, String error, long nowMs, List<MonitorAction> actions) {
        if (workers.markUnreachable(worker.name(), nowMs)) {
            log.warn("Worker {} unreachable: {}", worker.name(), error);
            audit.log(AuditLogger.AuditEvent.of("worker.unreachable", ACTOR, "unreachable", worker.currentTaskId(), worker.name(),
                    Map.of("error", error == null ? "" : error)));
        }
        String outcome = "unreachable";
        if (held.isPresent() && held.get().status() == TaskStatus.ASSIGNED) {
            TaskStore.RetryOutcome r = transitions.requeue(held.get(), FailureKind.DELIVERY, "worker unreachable: " + error, ACTOR, nowMs);
            outcome = r.name().toLowerCase();
            interventions.record(worker.name(), held.get().taskId(), InterventionLog.REQUEUE, null, outcome, error, nowMs);
        }
        actions.add(new MonitorAction(worker.name(), held.map(TaskView::taskId).orElse(null), "unreachable", outcome, error));
    }

    /**
     * Sends the corrective response unless this (worker, prompt) pair is cooling down.
     * The cooldown starts only once the keystroke actually went through.
     */
    private void handleBlocked(WorkerView worker, TaskView task, String prompt, long nowMs, List<MonitorAction> actions) {
        RelaySettings s = settings.get();
        Long taskId = task == null ? null : task.taskId();
        String key = PromptSignature.key(prompt);
        if (cooldowns.inCooldown(worker.name(), key, nowMs)) {
            actions.add(new MonitorAction(worker.name(), taskId, "confirm", "cooldown", key));
            return;
        }
        DeliveryResult sent = sessions.sendKeys(worker, List.of(s.correctiveResponse()));
        if (sent.delivered()) {
            if (s.blockedCooldownMs() > 0) {
                cooldowns.setCooldown(worker.name(), key, s.blockedCooldownMs(), nowMs);
            }
            log.info("Confirmed prompt on {} (key {})", worker.name(), key);
            interventions.record(worker.name(), taskId, InterventionLog.CONFIRM, key, "sent", abbreviate(prompt), nowMs);
            audit.log(AuditLogger.AuditEvent.of("worker.confirm", ACTOR, "sent", taskId, worker.name(), Map.of("prompt_key", key)));
            actions.add(new MonitorAction(worker.name(), taskId, "confirm", "sent", key));
        } else {
            log.warn("Corrective response to {} failed: {}", worker.name(), sent.error());
            interventions.record(worker.name(), taskId, InterventionLog.CONFIRM, key, "failed", sent.error(), nowMs);
            actions.add(new MonitorAction(worker.name(), taskId, "confirm", "failed", sent.error()));
        }
    }

    /**
     * First a nudge; if the pane is still unchanged one threshold after the nudge,
     * the task goes back through the retry rule.
     */
    private void handleStale(WorkerView worker, TaskView task, long nowMs, List<MonitorAction> actions) {
        RelaySettings s = settings.get();
        if (task.nudgedAtMs() == null) {
            DeliveryResult nudge = sessions.sendKeys(worker, s.nudgeKeys());
            String outcome = nudge.delivered() ? "sent" : "failed";
            if (nudge.delivered()) {
                taskStore.markNudged(task.taskId(), worker.name(), nowMs);
            } else {
                log.warn("Nudge to {} failed: {}", worker.name(), nudge.error());
            }
            interventions.record(worker.name(), task.taskId(), InterventionLog.NUDGE, null, outcome, nudge.error(), nowMs);
            actions.add(new MonitorAction(worker.name(), task.taskId(), "nudge", outcome, nudge.error()));
            return;
        }
        if (nowMs - task.nudgedAtMs() <= s.staleThresholdMs()) {
            actions.add(new MonitorAction(worker.name(), task.taskId(), "stale", "waiting", null));
            return;
        }
        String detail = "no output change for " + (s.staleThresholdMs() / 1000L) + "s after nudge";
        TaskStore.RetryOutcome outcome = transitions.requeue(task, FailureKind.TIMEOUT, detail, ACTOR, nowMs);
        String result = outcome.name().toLowerCase();
        interventions.record(worker.name(), task.taskId(), InterventionLog.REQUEUE, null, result, detail, nowMs);
        actions.add(new MonitorAction(worker.name(), task.taskId(), "stale", result, detail));
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        String flat = text.replace('\n', ' ').strip();
        return flat.length() <= 200 ? flat : flat.substring(0, 200) + "...";
    }
}
