package io.taskrelay;

import io.taskrelay.cli.TaskRelayCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TaskRelayCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
