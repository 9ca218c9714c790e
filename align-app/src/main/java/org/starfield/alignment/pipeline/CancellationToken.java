package org.starfield.alignment.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by the pipeline before each frame is started.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

}
