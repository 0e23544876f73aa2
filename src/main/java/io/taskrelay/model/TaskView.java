package io.taskrelay.model;

public record TaskView(
        long taskId,
        String content,
        int priority,
        WorkType workType,
        String targetWorker,
        TaskStatus status,
        String assignedWorker,
        Long assignedAtMs,
        Long startedAtMs,
        Long completedAtMs,
        int retryCount,
        int maxRetries,
        int timeoutMinutes,
        Long timeoutAtMs,
        String contentFingerprint,
        String workingDirectory,
        String lastError,
        Long nudgedAtMs,
        Long retryOf,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean hasTarget() {
        return targetWorker != null && !targetWorker.isBlank();
    }
}
