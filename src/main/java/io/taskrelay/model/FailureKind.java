package io.taskrelay.model;

import java.util.Locale;

/**
 * Error categories recorded on a task's {@code last_error}.
 *
 * <p>Only {@link #VALIDATION} and {@link #RETRIES_EXHAUSTED} need operator attention;
 * the other categories are retried by the state machine.
 */
public enum FailureKind {
    VALIDATION(false),
    RESOURCE_UNAVAILABLE(false),
    DELIVERY(true),
    WORKER_FAULT(true),
    TIMEOUT(true),
    RETRIES_EXHAUSTED(false);

    private final boolean countsAgainstRetries;

    FailureKind(boolean countsAgainstRetries) {
        this.countsAgainstRetries = countsAgainstRetries;
    }

    public boolean countsAgainstRetries() {
        return countsAgainstRetries;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String format(String detail) {
        if (detail == null || detail.isBlank()) {
            return label();
        }
        return label() + ": " + detail.trim();
    }
}
