package io.taskrelay.session;

import java.util.List;

/**
 * Runs an external command to completion. Failures are reported in the result,
 * never thrown.
 */
public interface CommandRunner {
    CommandResult run(List<String> command, long timeoutMs);
}
