package io.taskrelay.model;

public record DirectoryLock(
        String directoryPath,
        String holderWorker,
        Long taskId,
        long acquiredAtMs,
        long expiresAtMs
) {
    public boolean expired(long nowMs) {
        return expiresAtMs <= nowMs;
    }
}
