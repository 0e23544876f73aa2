package io.taskrelay.model;

import java.util.Locale;

public enum DirectiveType {
    GUIDANCE(5),
    CONSTRAINT(8),
    PRIORITY_CHANGE(7),
    ESCALATION_RULE(6),
    ABORT_TASK(10);

    private final int rank;

    DirectiveType(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean mandatory() {
        return this == ABORT_TASK;
    }

    public static DirectiveType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("directive type must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("PRIORITY".equals(normalized)) {
            return PRIORITY_CHANGE;
        }
        for (DirectiveType value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown directive type: " + raw);
    }
}
