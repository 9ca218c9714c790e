package org.starfield.align.client.source;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.starfield.alignment.pipeline.FrameLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frames stored in a local directory with names that encode their acquisition time
 * (see {@link FrameFileNames}).  Files with other names are ignored.
 */
public class LocalFrameSource
        implements FrameSource {

    private final File imageDirectory;

    public LocalFrameSource(final File imageDirectory) {
        this.imageDirectory = imageDirectory;
    }

    @Override
    public List<FrameLoader> fetch(final TimeRange range)
            throws IOException {

        final File[] files = imageDirectory.listFiles(File::isFile);
        if (files == null) {
            throw new IOException("failed to list files in " + imageDirectory.getAbsolutePath());
        }

        final List<ImageFileLoader> loaders = new ArrayList<>();
        int ignoredCount = 0;
        for (final File file : files) {
            final Instant timestamp = FrameFileNames.parseTimestamp(file.getName());
            if (timestamp == null) {
                ignoredCount++;
            } else if (range.contains(timestamp)) {
                loaders.add(new ImageFileLoader(file, timestamp));
            }
        }

        loaders.sort(Comparator.comparing(ImageFileLoader::getTimestamp));

        LOG.info("fetch: found {} frames within {} in {}, ignored {} files with unrecognized names",
                 loaders.size(), range, imageDirectory.getAbsolutePath(), ignoredCount);

        return new ArrayList<>(loaders);
    }

    private static final Logger LOG = LoggerFactory.getLogger(LocalFrameSource.class);
}
