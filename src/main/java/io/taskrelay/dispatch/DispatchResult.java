package io.taskrelay.dispatch;

public record DispatchResult(
        Outcome outcome,
        long taskId,
        String worker,
        String detail
) {
    public enum Outcome {
        SENT,
        NO_WORKER_AVAILABLE,
        LOCK_HELD,
        TRANSPORT_ERROR
    }

    public static DispatchResult sent(long taskId, String worker) {
        return new DispatchResult(Outcome.SENT, taskId, worker, null);
    }

    public static DispatchResult noWorker(long taskId, String detail) {
        return new DispatchResult(Outcome.NO_WORKER_AVAILABLE, taskId, null, detail);
    }

    public static DispatchResult lockHeld(long taskId, String worker, String detail) {
        return new DispatchResult(Outcome.LOCK_HELD, taskId, worker, detail);
    }

    public static DispatchResult transportError(long taskId, String worker, String detail) {
        return new DispatchResult(Outcome.TRANSPORT_ERROR, taskId, worker, detail);
    }

    public boolean sent() {
        return outcome == Outcome.SENT;
    }
}
