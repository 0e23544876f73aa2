package io.taskrelay.session;

public record CommandResult(
        int exitCode,
        String output,
        boolean timedOut
) {
    public static CommandResult spawnFailed(String message) {
        return new CommandResult(-1, message, false);
    }

    public boolean ok() {
        return !timedOut && exitCode == 0;
    }
}
