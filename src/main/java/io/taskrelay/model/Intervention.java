package io.taskrelay.model;

public record Intervention(
        long id,
        String workerName,
        Long taskId,
        String kind,
        String promptKey,
        String outcome,
        String detail,
        long occurredAtMs
) {
}
