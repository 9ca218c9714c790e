package org.starfield.alignment.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of an alignment run: the aligned frames in temporal order and every frame that was skipped.
 * A run that completes with skipped frames is a partial success, not a failure.
 */
public class AlignmentResult {

    private final int referenceFrameIndex;
    private final List<AlignedFrame> alignedFrames;
    private final List<SkippedFrame> skippedFrames;
    private final boolean cancelled;

    public AlignmentResult(final int referenceFrameIndex,
                           final List<AlignedFrame> alignedFrames,
                           final List<SkippedFrame> skippedFrames,
                           final boolean cancelled) {
        this.referenceFrameIndex = referenceFrameIndex;
        this.alignedFrames = Collections.unmodifiableList(new ArrayList<>(alignedFrames));
        this.skippedFrames = Collections.unmodifiableList(new ArrayList<>(skippedFrames));
        this.cancelled = cancelled;
    }

    public int getReferenceFrameIndex() {
        return referenceFrameIndex;
    }

    public List<AlignedFrame> getAlignedFrames() {
        return alignedFrames;
    }

    public List<SkippedFrame> getSkippedFrames() {
        return skippedFrames;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean hasSkippedFrames() {
        return ! skippedFrames.isEmpty();
    }

    @Override
    public String toString() {
        return "{\"referenceFrameIndex\": " + referenceFrameIndex +
               ", \"alignedCount\": " + alignedFrames.size() +
               ", \"skippedCount\": " + skippedFrames.size() +
               ", \"cancelled\": " + cancelled + "}";
    }

}
