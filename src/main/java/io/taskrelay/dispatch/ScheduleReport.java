package io.taskrelay.dispatch;

import java.util.List;

public record ScheduleReport(
        int considered,
        int sent,
        int lockHeld,
        int noWorker,
        int transportErrors,
        int priorityChanges,
        List<DispatchResult> results
) {
    public static ScheduleReport of(int priorityChanges, List<DispatchResult> results) {
        int sent = 0;
        int lockHeld = 0;
        int noWorker = 0;
        int transport = 0;
        for (DispatchResult r : results) {
            switch (r.outcome()) {
                case SENT -> sent++;
                case LOCK_HELD -> lockHeld++;
                case NO_WORKER_AVAILABLE -> noWorker++;
                case TRANSPORT_ERROR -> transport++;
            }
        }
        return new ScheduleReport(results.size(), sent, lockHeld, noWorker, transport, priorityChanges, List.copyOf(results));
    }

    public boolean idle() {
        return sent == 0 && transportErrors == 0 && priorityChanges == 0;
    }
}
