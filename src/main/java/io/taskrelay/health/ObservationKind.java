package io.taskrelay.health;

public enum ObservationKind {
    IDLE,
    ACTIVE,
    BLOCKED,
    STALE,
    REPORTED_DONE,
    REPORTED_ERROR,
    UNREACHABLE,
    UNKNOWN
}
