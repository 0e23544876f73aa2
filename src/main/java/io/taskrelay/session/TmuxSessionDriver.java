package io.taskrelay.session;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.WorkerView;

import java.util.List;
import java.util.function.Supplier;

/**
 * tmux-backed driver. Subclasses decide how a tmux argument vector reaches the
 * worker's host.
 */
public abstract class TmuxSessionDriver implements SessionDriver {
    static final int LONG_TEXT_CHARS = 200;
    private static final int MAX_ERROR_CHARS = 512;

    private final CommandRunner runner;
    protected final Supplier<RelaySettings> settings;

    protected TmuxSessionDriver(CommandRunner runner, Supplier<RelaySettings> settings) {
        this.runner = runner;
        this.settings = settings;
    }

    protected abstract List<String> wrap(WorkerView worker, List<String> tmuxCommand);

    protected abstract long timeoutMs();

    @Override
    public DeliveryResult inject(WorkerView worker, String text) {
        if (text == null || text.isEmpty()) {
            return DeliveryResult.fail("nothing to deliver");
        }
        DeliveryResult typed = execute(worker, TmuxCommands.sendLiteral(worker.session(), text));
        if (!typed.delivered()) {
            return typed;
        }
        DeliveryResult submitted = execute(worker, TmuxCommands.sendKeys(worker.session(), List.of("Enter")));
        if (!submitted.delivered()) {
            return submitted;
        }
        if (needsExtraEnter(text)) {
            return execute(worker, TmuxCommands.sendKeys(worker.session(), List.of("Enter")));
        }
        return submitted;
    }

    @Override
    public DeliveryResult sendKeys(WorkerView worker, List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return DeliveryResult.ok();
        }
        for (String key : keys) {
            List<String> command = TmuxCommands.isNamedKey(key)
                    ? TmuxCommands.sendKeys(worker.session(), List.of(key))
                    : TmuxCommands.sendLiteral(worker.session(), key);
            DeliveryResult result = execute(worker, command);
            if (!result.delivered()) {
                return result;
            }
        }
        return DeliveryResult.ok();
    }

    @Override
    public CaptureResult capture(WorkerView worker, int lines) {
        CommandResult result = runner.run(wrap(worker, TmuxCommands.capture(worker.session(), lines)), timeoutMs());
        if (!result.ok()) {
            return CaptureResult.fail(describe(result));
        }
        return CaptureResult.ok(result.output());
    }

    /**
     * Pasted multi-line or long text needs a second Enter before the session submits it.
     */
    static boolean needsExtraEnter(String text) {
        return text.length() > LONG_TEXT_CHARS || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    private DeliveryResult execute(WorkerView worker, List<String> tmuxCommand) {
        CommandResult result = runner.run(wrap(worker, tmuxCommand), timeoutMs());
        if (result.ok()) {
            return DeliveryResult.ok();
        }
        return DeliveryResult.fail(describe(result));
    }

    private static String describe(CommandResult result) {
        String output = result.output() == null ? "" : result.output().replace("\r", " ").replace("\n", " ").trim();
        if (output.length() > MAX_ERROR_CHARS) {
            output = output.substring(0, MAX_ERROR_CHARS) + "...";
        }
        if (result.timedOut()) {
            return "timed out: " + output;
        }
        return "exit=" + result.exitCode() + (output.isEmpty() ? "" : " " + output);
    }
}
