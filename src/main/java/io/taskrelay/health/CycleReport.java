package io.taskrelay.health;

import java.util.List;
import java.util.Map;

public record CycleReport(
        int workersObserved,
        Map<String, ObservationKind> observations,
        List<MonitorAction> actions
) {
    public boolean idle() {
        return actions.isEmpty();
    }
}
