package org.starfield.alignment.pipeline;

import org.starfield.alignment.FailureReason;

/**
 * Thrown when an alignment run cannot proceed at all because the reference frame could not be loaded
 * or contains no usable sources.
 */
public class AlignmentFailedException
        extends RuntimeException {

    private final int frameIndex;
    private final FailureReason reason;

    public AlignmentFailedException(final int frameIndex,
                                    final FailureReason reason,
                                    final String message,
                                    final Throwable cause) {
        super("reference frame " + frameIndex + " failed (" + reason + "): " + message, cause);
        this.frameIndex = frameIndex;
        this.reason = reason;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public FailureReason getReason() {
        return reason;
    }

}
