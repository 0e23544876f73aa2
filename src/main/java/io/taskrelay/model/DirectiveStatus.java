package io.taskrelay.model;

public enum DirectiveStatus {
    PENDING,
    ACKNOWLEDGED
}
