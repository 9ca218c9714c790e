package org.starfield.align.client.source;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.image.FrameFiles;
import org.starfield.alignment.pipeline.FrameLoader;

/**
 * Loads a frame from a local image file.
 */
public class ImageFileLoader
        implements FrameLoader {

    private final File file;
    private final Instant timestamp;

    public ImageFileLoader(final File file,
                           final Instant timestamp) {
        this.file = file;
        this.timestamp = timestamp;
    }

    public File getFile() {
        return file;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public Frame load()
            throws FetchFailureException {
        try {
            return FrameFiles.open(file, timestamp);
        } catch (final IOException e) {
            throw new FetchFailureException("failed to load " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return file.getName();
    }

}
