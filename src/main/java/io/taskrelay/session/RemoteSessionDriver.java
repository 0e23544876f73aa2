package io.taskrelay.session;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.WorkerView;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Relays tmux commands to the worker's host over ssh. The remote command is a
 * single shell-quoted string, since ssh joins its trailing arguments with spaces.
 * Options end at {@code --} so a destination is never read as an option.
 */
public final class RemoteSessionDriver extends TmuxSessionDriver {

    public RemoteSessionDriver(CommandRunner runner, Supplier<RelaySettings> settings) {
        super(runner, settings);
    }

    @Override
    protected List<String> wrap(WorkerView worker, List<String> tmuxCommand) {
        RelaySettings s = settings.get();
        List<String> out = new ArrayList<>();
        out.add("ssh");
        out.addAll(s.sshOptions());
        out.add("-o");
        out.add("ConnectTimeout=" + Math.max(1L, s.remoteTimeoutMs() / 1000L));
        out.add("--");
        out.add(worker.location());
        out.add(shellJoin(tmuxCommand));
        return out;
    }

    @Override
    protected long timeoutMs() {
        return settings.get().remoteTimeoutMs();
    }

    static String shellJoin(List<String> args) {
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(shellQuote(arg));
        }
        return sb.toString();
    }

    static String shellQuote(String arg) {
        if (!arg.isEmpty() && arg.matches("[A-Za-z0-9_@%+=:,./-]+")) {
            return arg;
        }
        return "'" + arg.replace("'", "'\\''") + "'";
    }
}
