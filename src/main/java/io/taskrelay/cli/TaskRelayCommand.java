package io.taskrelay.cli;

import io.taskrelay.config.TaskRelayConfig;
import io.taskrelay.dispatch.DispatchResult;
import io.taskrelay.model.TaskView;
import io.taskrelay.model.WorkType;
import io.taskrelay.model.WorkerView;
import io.taskrelay.observability.AuditLogger;
import io.taskrelay.runtime.TaskRelayRuntime;
import io.taskrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "taskrelay",
        mixinStandardHelpOptions = true,
        description = "Task assignment and execution engine for tmux-pane workers",
        subcommands = {
                TaskRelayCommand.InitCommand.class,
                TaskRelayCommand.StatusCommand.class,
                TaskRelayCommand.AssignCommand.class,
                TaskRelayCommand.CompleteCommand.class,
                TaskRelayCommand.TasksCommand.class,
                TaskRelayCommand.TaskCommand.class,
                TaskRelayCommand.RetryCommand.class,
                TaskRelayCommand.CancelCommand.class,
                TaskRelayCommand.StatsCommand.class,
                TaskRelayCommand.WorkersCommand.class,
                TaskRelayCommand.WorkerRegisterCommand.class,
                TaskRelayCommand.WorkerRemoveCommand.class,
                TaskRelayCommand.LocksCommand.class,
                TaskRelayCommand.DirectiveSendCommand.class,
                TaskRelayCommand.DirectivesCommand.class,
                TaskRelayCommand.DirectiveAckCommand.class,
                TaskRelayCommand.InterventionsCommand.class,
                TaskRelayCommand.DispatchCommand.class,
                TaskRelayCommand.MonitorCommand.class,
                TaskRelayCommand.TickCommand.class,
                TaskRelayCommand.SweepCommand.class,
                TaskRelayCommand.RunCommand.class,
                TaskRelayCommand.ReloadSettingsCommand.class,
                TaskRelayCommand.AuditTailCommand.class,
                TaskRelayCommand.AuditVerifyCommand.class,
                TaskRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class TaskRelayCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TaskRelayCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = TaskRelayConfig.DEFAULT_ROOT)
    String root;

    /**
     * Command line with the process exit codes: 0 on success, 1 on a usage error or
     * a rejected request.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new TaskRelayCommand());
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return 1;
        });
        cmd.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
                failed.getErr().println("error: " + ex.getMessage());
            } else {
                log.error("Command failed", ex);
                failed.getErr().println("error: " + ex);
            }
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }

    TaskRelayRuntime runtime() {
        TaskRelayRuntime runtime = new TaskRelayRuntime(TaskRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    void print(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            TaskRelayRuntime runtime = parent.runtime();
            parent.print(Map.of("initialized", runtime.config().rootDir().toString()));
            return 0;
        }
    }

    @Command(name = "status", description = "Show queue, worker and lock status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().status());
            return 0;
        }
    }

    @Command(name = "assign", description = "Queue a task and try to dispatch it")
    static final class AssignCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Task description")
        String description;

        @Parameters(index = "1", description = "Working directory the task runs in")
        String workingDirectory;

        @Parameters(index = "2", arity = "0..1", description = "Explicit worker name")
        String worker;

        @Option(names = {"--priority"}, description = "Override the classified priority (0-1000)")
        Integer priority;

        @Option(names = {"--type"}, description = "Override the classified work type")
        String workType;

        @Option(names = {"--max-retries"}, description = "Retry budget")
        Integer maxRetries;

        @Option(names = {"--timeout"}, description = "Timeout in minutes")
        Integer timeoutMinutes;

        @Option(names = {"--queue-only"}, description = "Queue without attempting dispatch")
        boolean queueOnly;

        @Override
        public Integer call() {
            TaskRelayRuntime runtime = parent.runtime();
            TaskRelayRuntime.SubmitOutcome outcome = runtime.submit(new TaskRelayRuntime.SubmitRequest(
                    description,
                    workingDirectory,
                    worker,
                    priority,
                    maxRetries,
                    timeoutMinutes,
                    workType == null ? null : WorkType.fromString(workType),
                    null,
                    "cli"
            ));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("submit", outcome);
            if (!outcome.duplicate() && !queueOnly) {
                DispatchResult dispatch = runtime.dispatch(outcome.taskId());
                out.put("dispatch", dispatch);
            }
            parent.print(out);
            return 0;
        }
    }

    @Command(name = "complete", description = "Mark the worker's current task completed")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Worker name")
        String worker;

        @Override
        public Integer call() {
            TaskRelayRuntime.CompleteOutcome outcome = parent.runtime().complete(worker);
            parent.print(outcome);
            return outcome.completed() ? 0 : 1;
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: pending|assigned|in_progress|completed|failed|cancelled")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            parent.print(parent.runtime().tasks(status, limit, offset));
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            Optional<TaskView> task = parent.runtime().task(taskId);
            if (task.isEmpty()) {
                parent.print(Map.of("error", "task not found"));
                return 1;
            }
            parent.print(task.get());
            return 0;
        }
    }

    @Command(name = "retry", description = "Queue a new copy of a failed task")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Failed task id")
        long taskId;

        @Override
        public Integer call() {
            parent.print(parent.runtime().retry(taskId));
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a pending or assigned task")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Option(names = {"--reason"}, description = "Cancellation reason")
        String reason;

        @Override
        public Integer call() {
            TaskRelayRuntime.CancelOutcome out = parent.runtime().cancel(taskId, reason);
            parent.print(out);
            return out.cancelled() ? 0 : 1;
        }
    }

    @Command(name = "stats", description = "Counts by task status, worker status, locks and directives")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().stats());
            return 0;
        }
    }

    @Command(name = "workers", description = "List registered workers")
    static final class WorkersCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().workers());
            return 0;
        }
    }

    @Command(name = "worker-register", description = "Register or update a worker")
    static final class WorkerRegisterCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Worker name")
        String name;

        @Option(names = {"--host"}, defaultValue = WorkerView.LOCAL, description = "'local' or an ssh destination")
        String host;

        @Option(names = {"--session"}, description = "tmux target (defaults to the worker name)")
        String session;

        @Option(names = {"--affinity"}, defaultValue = "*", description = "Comma separated work types, or * for all")
        String affinity;

        @Override
        public Integer call() {
            parent.print(parent.runtime().registerWorker(name, host, session, affinity));
            return 0;
        }
    }

    @Command(name = "worker-remove", description = "Remove a worker that holds no task")
    static final class WorkerRemoveCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Worker name")
        String name;

        @Override
        public Integer call() {
            boolean removed = parent.runtime().removeWorker(name);
            parent.print(Map.of("worker", name, "removed", removed));
            return removed ? 0 : 1;
        }
    }

    @Command(name = "locks", description = "List live directory locks")
    static final class LocksCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().locks());
            return 0;
        }
    }

    @Command(name = "directive-send", description = "Issue a directive to a worker or to all workers")
    static final class DirectiveSendCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "guidance|constraint|priority_change|escalation_rule|abort_task")
        String type;

        @Parameters(index = "1", arity = "0..1", description = "Directive content")
        String content;

        @Option(names = {"--target"}, defaultValue = "all", description = "Worker name or 'all'")
        String target;

        @Option(names = {"--task"}, description = "Referenced task id")
        Long taskId;

        @Override
        public Integer call() {
            String id = parent.runtime().sendDirective(type, content, target, taskId);
            parent.print(Map.of("directive_id", id));
            return 0;
        }
    }

    @Command(name = "directives", description = "List directives")
    static final class DirectivesCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Option(names = {"--status"}, description = "pending|acknowledged")
        String status;

        @Option(names = {"--for"}, description = "Pending directives for this worker, most urgent first")
        String target;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            TaskRelayRuntime runtime = parent.runtime();
            if (target != null && !target.isBlank()) {
                parent.print(runtime.pendingDirectives(target.trim()));
            } else {
                parent.print(runtime.directives(status, limit));
            }
            return 0;
        }
    }

    @Command(name = "directive-ack", description = "Acknowledge a directive")
    static final class DirectiveAckCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Parameters(index = "0", description = "Directive id")
        String directiveId;

        @Option(names = {"--by"}, defaultValue = "operator", description = "Who acknowledges")
        String by;

        @Override
        public Integer call() {
            boolean acked = parent.runtime().acknowledgeDirective(directiveId, by);
            parent.print(Map.of("directive_id", directiveId, "acknowledged", acked));
            return acked ? 0 : 1;
        }
    }

    @Command(name = "interventions", description = "List corrective actions taken on workers")
    static final class InterventionsCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Option(names = {"--worker"}, description = "Filter by worker")
        String worker;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            parent.print(parent.runtime().interventions(worker, limit));
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Run one scheduling pass")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().scheduleOnce());
            return 0;
        }
    }

    @Command(name = "monitor", description = "Run one health monitor cycle")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().monitorOnce());
            return 0;
        }
    }

    @Command(name = "tick", description = "Run one scheduling pass and one monitor cycle")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().tick());
            return 0;
        }
    }

    @Command(name = "sweep", description = "Purge expired dedup entries, cooldowns and locks")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().sweep());
            return 0;
        }
    }

    @Command(name = "run", description = "Schedule and monitor until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Option(names = {"--cycles"}, defaultValue = "0", description = "Stop after this many cycles (0 = run until interrupted)")
        int cycles;

        @Override
        public Integer call() {
            TaskRelayRuntime runtime = parent.runtime();
            AtomicBoolean stop = new AtomicBoolean(false);
            Thread hook = new Thread(() -> stop.set(true), "taskrelay-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            log.info("Run loop started at {}", runtime.config().rootDir());
            TaskRelayRuntime.RunOutcome outcome = runtime.run(cycles, stop::get);
            if (!stop.get()) {
                Runtime.getRuntime().removeShutdownHook(hook);
            }
            parent.print(outcome);
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Re-read taskrelay-settings.json")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().reloadSettings());
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the last audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of rows")
        int lines;

        @Override
        public Integer call() {
            parent.print(parent.runtime().auditTail(lines));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Check the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyResult result = parent.runtime().verifyAudit();
            parent.print(result);
            return result.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskRelayCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.runtime().schemaMigrations());
            return 0;
        }
    }
}
