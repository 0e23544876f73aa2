package io.taskrelay.session;

import io.taskrelay.model.WorkerView;

import java.util.List;

/**
 * Sends each call to the local or remote driver according to the worker's location.
 */
public final class RoutingSessionDriver implements SessionDriver {
    private final SessionDriver local;
    private final SessionDriver remote;

    public RoutingSessionDriver(SessionDriver local, SessionDriver remote) {
        this.local = local;
        this.remote = remote;
    }

    @Override
    public DeliveryResult inject(WorkerView worker, String text) {
        return pick(worker).inject(worker, text);
    }

    @Override
    public DeliveryResult sendKeys(WorkerView worker, List<String> keys) {
        return pick(worker).sendKeys(worker, keys);
    }

    @Override
    public CaptureResult capture(WorkerView worker, int lines) {
        return pick(worker).capture(worker, lines);
    }

    private SessionDriver pick(WorkerView worker) {
        return worker.remote() ? remote : local;
    }
}
