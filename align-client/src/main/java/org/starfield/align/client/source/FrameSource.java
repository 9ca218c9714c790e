package org.starfield.align.client.source;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

import org.starfield.alignment.pipeline.FrameLoader;

/**
 * Provides loaders for the frames acquired within a time window.
 */
public interface FrameSource
        extends Closeable {

    /**
     * @param  range  acquisition time window.
     *
     * @return loaders for the frames within the window, in temporal order.
     *
     * @throws IOException
     *   if the frames in the window cannot be listed.
     */
    List<FrameLoader> fetch(TimeRange range) throws IOException;

    /**
     * Releases any connections held by this source.
     */
    @Override
    default void close() throws IOException {
    }

}
