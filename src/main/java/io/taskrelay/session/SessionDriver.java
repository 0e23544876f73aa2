package io.taskrelay.session;

import io.taskrelay.model.WorkerView;

import java.util.List;

/**
 * Talks to a worker's interactive session.
 */
public interface SessionDriver {
    /**
     * Types {@code text} into the session and submits it.
     */
    DeliveryResult inject(WorkerView worker, String text);

    /**
     * Sends named keys (for example {@code Enter}) or literal characters.
     */
    DeliveryResult sendKeys(WorkerView worker, List<String> keys);

    /**
     * Returns the last {@code lines} lines of visible output.
     */
    CaptureResult capture(WorkerView worker, int lines);
}
