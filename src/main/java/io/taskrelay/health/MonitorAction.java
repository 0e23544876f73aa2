package io.taskrelay.health;

public record MonitorAction(
        String worker,
        Long taskId,
        String action,
        String outcome,
        String detail
) {
}
