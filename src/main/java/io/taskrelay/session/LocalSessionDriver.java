package io.taskrelay.session;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.WorkerView;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs tmux directly on this host.
 */
public final class LocalSessionDriver extends TmuxSessionDriver {
    private static final long LOCAL_TIMEOUT_MS = 5_000L;

    public LocalSessionDriver(CommandRunner runner, Supplier<RelaySettings> settings) {
        super(runner, settings);
    }

    @Override
    protected List<String> wrap(WorkerView worker, List<String> tmuxCommand) {
        return tmuxCommand;
    }

    @Override
    protected long timeoutMs() {
        return LOCAL_TIMEOUT_MS;
    }
}
