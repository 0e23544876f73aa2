package io.taskrelay.model;

import java.util.Set;

public record WorkerView(
        String name,
        String location,
        String session,
        Set<WorkType> affinity,
        WorkerStatus status,
        Long currentTaskId,
        long lastActivityAtMs,
        long lastAssignedAtMs,
        String lastOutputDigest,
        long registeredAtMs
) {
    public static final String LOCAL = "local";

    public boolean remote() {
        return location != null && !location.isBlank() && !LOCAL.equalsIgnoreCase(location);
    }

    public boolean accepts(WorkType workType) {
        return affinity != null && affinity.contains(workType);
    }
}
