package io.taskrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.classify.Classification;
import io.taskrelay.classify.Classifier;
import io.taskrelay.config.RelaySettings;
import io.taskrelay.config.TaskRelayConfig;
import io.taskrelay.cooldown.CooldownManager;
import io.taskrelay.dedup.DedupOutcome;
import io.taskrelay.dedup.DeduplicationGuard;
import io.taskrelay.dispatch.DispatchResult;
import io.taskrelay.dispatch.Dispatcher;
import io.taskrelay.dispatch.ScheduleReport;
import io.taskrelay.dispatch.TaskTransitions;
import io.taskrelay.health.CycleReport;
import io.taskrelay.health.HealthMonitor;
import io.taskrelay.health.InterventionLog;
import io.taskrelay.health.ObservationSource;
import io.taskrelay.health.PaneObservationSource;
import io.taskrelay.lock.DirectoryLockManager;
import io.taskrelay.model.Directive;
import io.taskrelay.model.DirectiveStatus;
import io.taskrelay.model.DirectiveType;
import io.taskrelay.model.DirectoryLock;
import io.taskrelay.model.Intervention;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.TaskView;
import io.taskrelay.model.WorkType;
import io.taskrelay.model.WorkerView;
import io.taskrelay.observability.AuditLogger;
import io.taskrelay.oversight.OversightChannel;
import io.taskrelay.session.LocalSessionDriver;
import io.taskrelay.session.ProcessCommandRunner;
import io.taskrelay.session.RemoteSessionDriver;
import io.taskrelay.session.RoutingSessionDriver;
import io.taskrelay.session.SessionDriver;
import io.taskrelay.storage.Database;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.storage.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

public final class TaskRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(TaskRelayRuntime.class);
    private static final int MAX_RETRY_BUDGET = 20;
    private static final int MAX_TIMEOUT_MINUTES = 24 * 60;
    private static final long SWEEP_INTERVAL_MS = 60_000L;

    private final TaskRelayConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskStore taskStore;
    private final WorkerRegistry workerRegistry;
    private final DirectoryLockManager lockManager;
    private final DeduplicationGuard dedupGuard;
    private final CooldownManager cooldownManager;
    private final OversightChannel oversight;
    private final InterventionLog interventionLog;
    private final TaskTransitions transitions;
    private final Dispatcher dispatcher;
    private final HealthMonitor healthMonitor;
    private final AuditLogger auditLogger;
    private volatile RelaySettings settings;
    private volatile Classifier classifier;

    public TaskRelayRuntime(TaskRelayConfig config) {
        this(config, Clock.systemUTC(), null, null);
    }

    /**
     * @param sessions     driver for worker sessions; tmux locally and over ssh when null
     * @param observations where pane output comes from; the session driver's capture when null
     */
    public TaskRelayRuntime(TaskRelayConfig config, Clock clock, SessionDriver sessions, ObservationSource observations) {
        this.config = config;
        this.clock = clock;
        this.settings = RelaySettings.defaults();
        this.classifier = new Classifier(settings.classifierRules());
        this.database = new Database(config);
        this.taskStore = new TaskStore(database);
        this.workerRegistry = new WorkerRegistry(database);
        this.lockManager = new DirectoryLockManager(database);
        this.dedupGuard = new DeduplicationGuard(database, this::settings);
        this.cooldownManager = new CooldownManager(database);
        this.oversight = new OversightChannel(database, taskStore);
        this.interventionLog = new InterventionLog(database);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        SessionDriver driver = sessions;
        if (driver == null) {
            ProcessCommandRunner runner = new ProcessCommandRunner();
            driver = new RoutingSessionDriver(
                    new LocalSessionDriver(runner, this::settings),
                    new RemoteSessionDriver(runner, this::settings));
        }
        ObservationSource source = observations == null ? new PaneObservationSource(driver, this::settings) : observations;
        this.transitions = new TaskTransitions(database, taskStore, workerRegistry, lockManager, auditLogger);
        this.dispatcher = new Dispatcher(database, taskStore, workerRegistry, lockManager, oversight, driver, auditLogger, this::settings);
        this.healthMonitor = new HealthMonitor(taskStore, workerRegistry, transitions, cooldownManager, oversight,
                interventionLog, source, driver, auditLogger, this::settings);
    }

    public void init() {
        database.init();
        applySettings(RelaySettings.load(config.settingsFile()));
    }

    public RelaySettings settings() {
        return settings;
    }

    public TaskRelayConfig config() {
        return config;
    }

    public SettingsReloadOutcome reloadSettings() {
        RelaySettings before = settings;
        RelaySettings after = RelaySettings.load(config.settingsFile());
        List<String> changed = diff(before, after);
        applySettings(after);
        boolean exists = Files.isRegularFile(config.settingsFile());
        String message = changed.isEmpty() ? "unchanged" : "reloaded";
        auditLogger.log(AuditLogger.AuditEvent.of("settings.reload", "cli", message, null, null,
                Map.of("changed_fields", changed, "config_exists", exists)));
        return new SettingsReloadOutcome(!changed.isEmpty(), exists, config.settingsFile().toString(), message, changed);
    }

    public SubmitOutcome submit(SubmitRequest request) {
        String content = request.content() == null ? "" : request.content().strip();
        if (content.isEmpty()) {
            throw new IllegalArgumentException("task description must not be blank");
        }
        if (content.length() > TaskRelayConfig.MAX_CONTENT_CHARS) {
            throw new IllegalArgumentException(
                    "task description too long: " + content.length() + " chars, max=" + TaskRelayConfig.MAX_CONTENT_CHARS);
        }
        String directory = DirectoryLockManager.normalize(request.workingDirectory());
        String target = request.targetWorker() == null || request.targetWorker().isBlank() ? null : request.targetWorker().trim();
        if (target != null && workerRegistry.get(target).isEmpty()) {
            throw new IllegalArgumentException("Unknown worker: " + target);
        }
        RelaySettings s = settings;
        Classification classification = classifier.classify(content);
        WorkType workType = request.workType() == null ? classification.workType() : request.workType();
        int priority = checkRange("priority", request.priority() == null ? classification.priority() : request.priority(),
                0, TaskRelayConfig.MAX_PRIORITY);
        int maxRetries = checkRange("max retries", request.maxRetries() == null ? s.defaultMaxRetries() : request.maxRetries(),
                0, MAX_RETRY_BUDGET);
        int timeoutMinutes = checkRange("timeout minutes",
                request.timeoutMinutes() == null ? s.defaultTimeoutMinutes() : request.timeoutMinutes(), 1, MAX_TIMEOUT_MINUTES);

        long now = clock.millis();
        String fingerprint = DeduplicationGuard.fingerprint(content);
        TaskStore.NewTask newTask = new TaskStore.NewTask(content, priority, workType, target, maxRetries, timeoutMinutes,
                fingerprint, directory, request.retryOf(), now);
        DedupOutcome outcome = database.inTransaction("submit task", c -> {
            Optional<DedupOutcome> duplicate = dedupGuard.findDuplicate(c, fingerprint, now);
            if (duplicate.isPresent()) {
                return duplicate.get();
            }
            long id = taskStore.insertPending(c, newTask);
            dedupGuard.writeEntry(c, fingerprint, id, now);
            return DedupOutcome.registered(id);
        });

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("work_type", workType.wireName());
        details.put("priority", priority);
        details.put("working_directory", directory);
        if (target != null) {
            details.put("target_worker", target);
        }
        if (request.retryOf() != null) {
            details.put("retry_of", request.retryOf());
        }
        if (outcome.duplicate()) {
            details.put("existing_status", outcome.existingStatus().name());
            auditLogger.log(AuditLogger.AuditEvent.of("task.submit", request.actor(), "duplicate", outcome.taskId(), target, details));
            return new SubmitOutcome(outcome.taskId(), true, outcome.existingStatus(), workType, priority,
                    "Duplicate of task " + outcome.taskId() + " (" + outcome.existingStatus().name().toLowerCase() + ")");
        }
        auditLogger.log(AuditLogger.AuditEvent.of("task.submit", request.actor(), "queued", outcome.taskId(), target, details));
        log.info("Task {} queued ({} p{})", outcome.taskId(), workType.wireName(), priority);
        return new SubmitOutcome(outcome.taskId(), false, TaskStatus.PENDING, workType, priority, "Task queued");
    }

    /**
     * Queues a fresh copy of a failed task. The failed row itself stays failed.
     */
    public SubmitOutcome retry(long taskId) {
        TaskView failed = taskStore.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (failed.status() != TaskStatus.FAILED) {
            throw new IllegalStateException("Only failed tasks can be retried; task " + taskId + " is "
                    + failed.status().name().toLowerCase());
        }
        String target = failed.hasTarget() && workerRegistry.get(failed.targetWorker()).isPresent() ? failed.targetWorker() : null;
        return submit(new SubmitRequest(failed.content(), failed.workingDirectory(), target, failed.priority(),
                failed.maxRetries(), failed.timeoutMinutes(), failed.workType(), failed.taskId(), "operator"));
    }

    public CancelOutcome cancel(long taskId, String reason) {
        TaskView task = taskStore.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        String why = reason == null || reason.isBlank() ? "cancelled by operator" : reason.trim();
        Optional<TaskView> cancelled = transitions.cancel(taskId, why, "operator", clock.millis());
        if (cancelled.isPresent()) {
            return new CancelOutcome(taskId, true, "Task cancelled");
        }
        TaskStatus current = taskStore.getTask(taskId).map(TaskView::status).orElse(task.status());
        return new CancelOutcome(taskId, false, "Task is " + current.name().toLowerCase() + "; only pending or assigned tasks can be cancelled");
    }

    /**
     * Marks the worker's current task completed and frees the worker.
     */
    public CompleteOutcome complete(String workerName) {
        WorkerView worker = workerRegistry.get(workerName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerName));
        Optional<TaskView> held = taskStore.findHeldByWorker(worker.name());
        if (held.isEmpty()) {
            return new CompleteOutcome(worker.name(), null, false, "Worker has no active task");
        }
        boolean done = transitions.complete(held.get(), "operator", clock.millis());
        return new CompleteOutcome(worker.name(), held.get().taskId(), done, done ? "Task completed" : "Task changed state concurrently");
    }

    public ScheduleReport scheduleOnce() {
        return dispatcher.scheduleOnce(clock.millis());
    }

    public DispatchResult dispatch(long taskId) {
        TaskView task = taskStore.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + taskId + " is not pending");
        }
        return dispatcher.dispatch(task, clock.millis());
    }

    public CycleReport monitorOnce() {
        return healthMonitor.runCycle(clock.millis());
    }

    public SweepOutcome sweep() {
        long now = clock.millis();
        int dedup = dedupGuard.sweep(now);
        int cooldowns = cooldownManager.purgeExpired(now);
        int locks = lockManager.purgeExpired(now);
        return new SweepOutcome(dedup, cooldowns, locks);
    }

    /**
     * One scheduling pass followed by one monitor cycle.
     */
    public TickOutcome tick() {
        ScheduleReport schedule = scheduleOnce();
        CycleReport monitor = monitorOnce();
        return new TickOutcome(schedule, monitor);
    }

    /**
     * Runs scheduling every cycle, monitoring on its own cadence and housekeeping once
     * a minute until {@code stop} returns true, the thread is interrupted, or
     * {@code maxCycles} (when positive) cycles have run.
     */
    public RunOutcome run(int maxCycles, BooleanSupplier stop) {
        RelaySettings s = settings;
        IdleBackoff backoff = new IdleBackoff(s.dispatchIntervalMs(), s.maxIdleBackoffMs());
        long nextMonitorAt = 0L;
        long nextSweepAt = 0L;
        int cycles = 0;
        int sent = 0;
        int actions = 0;
        while (!stop.getAsBoolean() && (maxCycles <= 0 || cycles < maxCycles)) {
            cycles++;
            boolean idle;
            try {
                ScheduleReport schedule = scheduleOnce();
                sent += schedule.sent();
                idle = schedule.idle();
                long now = clock.millis();
                if (now >= nextMonitorAt) {
                    CycleReport monitor = monitorOnce();
                    actions += monitor.actions().size();
                    idle = idle && monitor.idle();
                    nextMonitorAt = now + settings.monitorIntervalMs();
                }
                if (now >= nextSweepAt) {
                    sweep();
                    nextSweepAt = now + SWEEP_INTERVAL_MS;
                }
            } catch (RuntimeException e) {
                log.error("Run cycle {} failed", cycles, e);
                idle = true;
            }
            if (maxCycles > 0 && cycles >= maxCycles) {
                break;
            }
            try {
                Thread.sleep(backoff.next(idle));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return new RunOutcome(cycles, sent, actions);
    }

    public Optional<TaskView> task(long taskId) {
        return taskStore.getTask(taskId);
    }

    public List<TaskView> tasks(String statusRaw, int limit, int offset) {
        TaskStatus status = statusRaw == null || statusRaw.isBlank() ? null : TaskStatus.fromString(statusRaw);
        return taskStore.listTasks(status, limit, offset);
    }

    public List<WorkerView> workers() {
        return workerRegistry.list();
    }

    public WorkerView registerWorker(String name, String location, String session, String affinityRaw) {
        WorkerView worker = workerRegistry.register(name, location, session, WorkType.parseAffinity(affinityRaw), clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of("worker.register", "operator", "registered", null, worker.name(),
                Map.of("location", worker.location(), "session", worker.session(),
                        "affinity", WorkType.formatAffinity(worker.affinity()))));
        return worker;
    }

    public boolean removeWorker(String name) {
        boolean removed = workerRegistry.remove(name);
        if (removed) {
            auditLogger.log(AuditLogger.AuditEvent.of("worker.remove", "operator", "removed", null, name, Map.of()));
        }
        return removed;
    }

    public List<DirectoryLock> locks() {
        return lockManager.listActive(clock.millis());
    }

    public StatsOutcome stats() {
        long now = clock.millis();
        return new StatsOutcome(
                taskStore.countsByStatus(),
                workerRegistry.countsByStatus(),
                lockManager.listActive(now).size(),
                oversight.countPending(),
                dedupGuard.count(),
                cooldownManager.countActive(now)
        );
    }

    public StatusOutcome status() {
        return new StatusOutcome(stats(), workerRegistry.list(), taskStore.listPending(10), taskStore.listHeld());
    }

    public String sendDirective(String typeRaw, String content, String target, Long taskId) {
        DirectiveType type = DirectiveType.fromString(typeRaw);
        if (taskId != null && taskStore.getTask(taskId).isEmpty()) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        String id = oversight.send(type, content, target, taskId, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("directive_id", id);
        details.put("type", type.name().toLowerCase());
        details.put("target", target == null || target.isBlank() ? Directive.TARGET_ALL : target.trim());
        auditLogger.log(AuditLogger.AuditEvent.of("directive.send", "operator", "issued", taskId, null, details));
        return id;
    }

    public List<Directive> directives(String statusRaw, int limit) {
        DirectiveStatus status = statusRaw == null || statusRaw.isBlank()
                ? null
                : DirectiveStatus.valueOf(statusRaw.trim().toUpperCase());
        return oversight.list(status, limit);
    }

    public List<Directive> pendingDirectives(String target) {
        return oversight.pendingFor(target);
    }

    public boolean acknowledgeDirective(String directiveId, String by) {
        if (oversight.get(directiveId).isEmpty()) {
            throw new IllegalArgumentException("Unknown directive: " + directiveId);
        }
        boolean acked = oversight.acknowledge(directiveId, by, clock.millis());
        if (acked) {
            auditLogger.log(AuditLogger.AuditEvent.of("directive.ack", by == null ? "operator" : by, "acknowledged", null, null,
                    Map.of("directive_id", directiveId)));
        }
        return acked;
    }

    public List<Intervention> interventions(String worker, int limit) {
        return interventionLog.list(worker, limit);
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.VerifyResult verifyAudit() {
        return auditLogger.verify();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    private void applySettings(RelaySettings next) {
        this.classifier = new Classifier(next.classifierRules());
        this.settings = next;
    }

    private static int checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be within [" + min + ", " + max + "], got " + value);
        }
        return value;
    }

    private static List<String> diff(RelaySettings a, RelaySettings b) {
        List<String> out = new ArrayList<>();
        if (a.lockTtlMs() != b.lockTtlMs()) out.add("lockTtlMs");
        if (a.dedupLookbackMs() != b.dedupLookbackMs()) out.add("dedupLookbackMs");
        if (a.dedupTtlMs() != b.dedupTtlMs()) out.add("dedupTtlMs");
        if (a.defaultMaxRetries() != b.defaultMaxRetries()) out.add("defaultMaxRetries");
        if (a.defaultTimeoutMinutes() != b.defaultTimeoutMinutes()) out.add("defaultTimeoutMinutes");
        if (a.dispatchIntervalMs() != b.dispatchIntervalMs()) out.add("dispatchIntervalMs");
        if (a.monitorIntervalMs() != b.monitorIntervalMs()) out.add("monitorIntervalMs");
        if (a.maxIdleBackoffMs() != b.maxIdleBackoffMs()) out.add("maxIdleBackoffMs");
        if (a.staleThresholdMs() != b.staleThresholdMs()) out.add("staleThresholdMs");
        if (a.blockedCooldownMs() != b.blockedCooldownMs()) out.add("blockedCooldownMs");
        if (!a.correctiveResponse().equals(b.correctiveResponse())) out.add("correctiveResponse");
        if (!a.nudgeKeys().equals(b.nudgeKeys())) out.add("nudgeKeys");
        if (a.captureLines() != b.captureLines()) out.add("captureLines");
        if (a.remoteTimeoutMs() != b.remoteTimeoutMs()) out.add("remoteTimeoutMs");
        if (!a.sshOptions().equals(b.sshOptions())) out.add("sshOptions");
        if (a.completeOnIdle() != b.completeOnIdle()) out.add("completeOnIdle");
        if (a.idleCompletionGraceMs() != b.idleCompletionGraceMs()) out.add("idleCompletionGraceMs");
        if (!a.classifierRules().equals(b.classifierRules())) out.add("classifierRules");
        if (!a.outputPatterns().equals(b.outputPatterns())) out.add("outputPatterns");
        return out;
    }

    public record SubmitRequest(
            String content,
            String workingDirectory,
            String targetWorker,
            Integer priority,
            Integer maxRetries,
            Integer timeoutMinutes,
            WorkType workType,
            Long retryOf,
            String actor
    ) {
        public static SubmitRequest of(String content, String workingDirectory, String targetWorker) {
            return new SubmitRequest(content, workingDirectory, targetWorker, null, null, null, null, null, "cli");
        }
    }

    public record SubmitOutcome(long taskId, boolean duplicate, TaskStatus status, WorkType workType, int priority, String message) {
    }

    public record CancelOutcome(long taskId, boolean cancelled, String message) {
    }

    public record CompleteOutcome(String worker, Long taskId, boolean completed, String message) {
    }

    public record SweepOutcome(int dedupEntriesPurged, int cooldownsPurged, int locksPurged) {
    }

    public record TickOutcome(ScheduleReport schedule, CycleReport monitor) {
    }

    public record RunOutcome(int cycles, int tasksSent, int monitorActions) {
    }

    public record SettingsReloadOutcome(boolean changed, boolean configExists, String sourcePath, String message,
                                        List<String> changedFields) {
    }

    public record StatsOutcome(
            Map<String, Integer> tasks,
            Map<String, Integer> workers,
            int activeLocks,
            int pendingDirectives,
            int dedupEntries,
            int activeCooldowns
    ) {
    }

    public record StatusOutcome(StatsOutcome stats, List<WorkerView> workers, List<TaskView> nextPending, List<TaskView> held) {
    }
}
