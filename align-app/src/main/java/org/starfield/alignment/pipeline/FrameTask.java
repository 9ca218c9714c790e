package org.starfield.alignment.pipeline;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;

import org.starfield.alignment.FailureReason;
import org.starfield.alignment.detect.SourceSet;

/**
 * Per-frame record of one alignment run.
 *
 * The first outcome recorded (aligned frame or failure) is final, so a worker that finishes after
 * its frame has been timed out by the merge stage cannot overwrite the timeout.
 */
class FrameTask {

    private final int frameIndex;
    private final FrameLoader loader;
    private final CountDownLatch startLatch;

    private volatile long startNanos;
    private volatile SourceSet sourceSet;

    private AlignedFrame alignedFrame;
    private FailureReason failureReason;
    private String failureMessage;

    FrameTask(final int frameIndex,
              final FrameLoader loader) {
        this.frameIndex = frameIndex;
        this.loader = loader;
        this.startLatch = new CountDownLatch(1);
    }

    int getFrameIndex() {
        return frameIndex;
    }

    FrameLoader getLoader() {
        return loader;
    }

    Instant getTimestamp() {
        return loader.getTimestamp();
    }

    SourceSet getSourceSet() {
        return sourceSet;
    }

    void setSourceSet(final SourceSet sourceSet) {
        this.sourceSet = sourceSet;
    }

    /**
     * Records that a worker has started processing this frame.
     */
    void markStarted() {
        startNanos = System.nanoTime();
        startLatch.countDown();
    }

    /**
     * Waits until a worker has started processing this frame.
     *
     * @return {@link System#nanoTime()} at the start of processing.
     */
    long awaitStart()
            throws InterruptedException {
        startLatch.await();
        return startNanos;
    }

    synchronized AlignedFrame getAlignedFrame() {
        return alignedFrame;
    }

    synchronized void complete(final AlignedFrame alignedFrame) {
        if (! hasOutcome()) {
            this.alignedFrame = alignedFrame;
        }
    }

    synchronized boolean isFailed() {
        return failureReason != null;
    }

    synchronized void fail(final FailureReason reason,
                           final String message) {
        if (! hasOutcome()) {
            this.failureReason = reason;
            this.failureMessage = message;
        }
    }

    synchronized SkippedFrame toSkippedFrame() {
        return new SkippedFrame(frameIndex, getTimestamp(), failureReason, failureMessage);
    }

    private boolean hasOutcome() {
        return (alignedFrame != null) || (failureReason != null);
    }

    @Override
    public String toString() {
        return "frame " + frameIndex + " (" + getTimestamp() + ")";
    }

}
