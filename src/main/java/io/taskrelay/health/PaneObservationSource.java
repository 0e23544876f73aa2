package io.taskrelay.health;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.WorkerView;
import io.taskrelay.session.CaptureResult;
import io.taskrelay.session.SessionDriver;

import java.util.function.Supplier;

/**
 * Captures the tail of the worker's tmux pane through the session driver.
 */
public final class PaneObservationSource implements ObservationSource {
    private final SessionDriver sessions;
    private final Supplier<RelaySettings> settings;

    public PaneObservationSource(SessionDriver sessions, Supplier<RelaySettings> settings) {
        this.sessions = sessions;
        this.settings = settings;
    }

    @Override
    public CaptureResult observe(WorkerView worker) {
        return sessions.capture(worker, settings.get().captureLines());
    }
}
