package io.taskrelay.model;

public enum WorkerStatus {
    IDLE,
    BUSY,
    UNREACHABLE
}
