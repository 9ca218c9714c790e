package org.starfield.alignment.pipeline;

import java.time.Instant;

import org.starfield.alignment.image.Frame;
import org.starfield.alignment.transform.FrameTransform;

/**
 * A frame warped into reference frame coordinates.
 */
public class AlignedFrame {

    private final int frameIndex;
    private final Frame image;
    private final FrameTransform transform;

    public AlignedFrame(final int frameIndex,
                        final Frame image,
                        final FrameTransform transform) {
        this.frameIndex = frameIndex;
        this.image = image;
        this.transform = transform;
    }

    /**
     * @return index of the frame in the sequence passed to the pipeline.
     */
    public int getFrameIndex() {
        return frameIndex;
    }

    public Instant getTimestamp() {
        return image.getTimestamp();
    }

    public Frame getImage() {
        return image;
    }

    /**
     * @return transform applied to the (cropped) source frame.
     */
    public FrameTransform getTransform() {
        return transform;
    }

    @Override
    public String toString() {
        return "{\"frameIndex\": " + frameIndex + ", \"timestamp\": \"" + getTimestamp() +
               "\", \"transform\": " + transform + "}";
    }

}
