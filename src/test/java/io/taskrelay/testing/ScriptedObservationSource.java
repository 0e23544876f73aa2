package io.taskrelay.testing;

import io.taskrelay.health.ObservationSource;
import io.taskrelay.model.WorkerView;
import io.taskrelay.session.CaptureResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pane output per worker, set by the test. Workers without a script show an empty pane.
 */
public final class ScriptedObservationSource implements ObservationSource {
    private final Map<String, CaptureResult> screens = new ConcurrentHashMap<>();

    public void show(String worker, String output) {
        screens.put(worker, CaptureResult.ok(output));
    }

    public void unreachable(String worker, String error) {
        screens.put(worker, CaptureResult.fail(error));
    }

    @Override
    public CaptureResult observe(WorkerView worker) {
        return screens.getOrDefault(worker.name(), CaptureResult.ok(""));
    }
}
