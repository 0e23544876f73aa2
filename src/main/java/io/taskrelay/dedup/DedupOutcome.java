package io.taskrelay.dedup;

import io.taskrelay.model.TaskStatus;

/**
 * Result of a duplicate check. When {@code duplicate} is true, {@code taskId} and
 * {@code existingStatus} describe the task already in flight.
 */
public record DedupOutcome(boolean duplicate, long taskId, TaskStatus existingStatus) {
    public static DedupOutcome registered(long taskId) {
        return new DedupOutcome(false, taskId, TaskStatus.PENDING);
    }

    public static DedupOutcome duplicateOf(long existingTaskId, TaskStatus existingStatus) {
        return new DedupOutcome(true, existingTaskId, existingStatus);
    }
}
