package io.taskrelay.health;

import io.taskrelay.model.WorkerView;
import io.taskrelay.session.CaptureResult;

/**
 * Where the monitor reads worker output from.
 */
public interface ObservationSource {
    CaptureResult observe(WorkerView worker);
}
