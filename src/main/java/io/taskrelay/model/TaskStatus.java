package io.taskrelay.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean active() {
        return this == PENDING || this == ASSIGNED || this == IN_PROGRESS;
    }

    public boolean holdsWorker() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task status must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (TaskStatus value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
