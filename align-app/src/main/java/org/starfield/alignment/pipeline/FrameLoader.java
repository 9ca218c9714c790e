package org.starfield.alignment.pipeline;

import java.time.Instant;

import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.image.Frame;

/**
 * Deferred access to one frame of a sequence.
 * Frame acquisition sources provide one loader per frame so that loading happens in the worker that
 * processes the frame and a failed acquisition only affects that frame.
 */
public interface FrameLoader {

    /**
     * @return acquisition time of the frame (known before loading).
     */
    Instant getTimestamp();

    /**
     * @return the loaded frame.
     *
     * @throws FetchFailureException
     *   if the frame cannot be acquired.
     */
    Frame load() throws FetchFailureException;

    /**
     * @return loader for an already loaded frame.
     */
    static FrameLoader of(final Frame frame) {
        return new FrameLoader() {
            @Override
            public Instant getTimestamp() {
                return frame.getTimestamp();
            }

            @Override
            public Frame load() {
                return frame;
            }

            @Override
            public String toString() {
                return String.valueOf(frame);
            }
        };
    }

}
