package io.taskrelay.classify;

import io.taskrelay.model.WorkType;

public record Classification(WorkType workType, int priority) {
}
