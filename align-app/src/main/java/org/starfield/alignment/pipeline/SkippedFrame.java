package org.starfield.alignment.pipeline;

import java.time.Instant;

import org.starfield.alignment.FailureReason;

/**
 * A frame excluded from the aligned output along with the reason it was excluded.
 */
public class SkippedFrame {

    private final int frameIndex;
    private final Instant timestamp;
    private final FailureReason reason;
    private final String message;

    public SkippedFrame(final int frameIndex,
                        final Instant timestamp,
                        final FailureReason reason,
                        final String message) {
        this.frameIndex = frameIndex;
        this.timestamp = timestamp;
        this.reason = reason;
        this.message = message;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "{\"frameIndex\": " + frameIndex + ", \"timestamp\": \"" + timestamp + "\", \"reason\": \"" +
               reason + "\", \"message\": \"" + message + "\"}";
    }

}
