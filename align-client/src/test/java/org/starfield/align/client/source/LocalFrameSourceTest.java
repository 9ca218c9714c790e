package org.starfield.align.client.source;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.starfield.align.client.StarFrames;
import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.pipeline.FrameLoader;

/**
 * Tests the {@link LocalFrameSource} class.
 */
public class LocalFrameSourceTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testFetch() throws Exception {

        final File directory = temporaryFolder.getRoot();
        for (final int hour : new int[] { 3, 0, 2, 1 }) {
            StarFrames.write(directory, 0, StarFrames.timestamp(hour));
        }
        temporaryFolder.newFile("readme.txt");

        final LocalFrameSource source = new LocalFrameSource(directory);

        final List<FrameLoader> all = source.fetch(TimeRange.all());
        Assert.assertEquals("invalid number of loaders", 4, all.size());
        for (int i = 0; i < all.size(); i++) {
            Assert.assertEquals("loaders should be sorted by time", StarFrames.timestamp(i), all.get(i).getTimestamp());
        }

        final List<FrameLoader> window = source.fetch(new TimeRange(StarFrames.timestamp(1), StarFrames.timestamp(2)));
        Assert.assertEquals("invalid number of loaders in window", 2, window.size());

        final Frame frame = window.get(0).load();
        Assert.assertEquals("invalid width", StarFrames.SIZE, frame.getWidth());
        Assert.assertEquals("invalid timestamp", StarFrames.timestamp(1), frame.getTimestamp());
    }

    @Test(expected = IOException.class)
    public void testMissingDirectory() throws Exception {
        new LocalFrameSource(new File(temporaryFolder.getRoot(), "missing")).fetch(TimeRange.all());
    }

    @Test(expected = FetchFailureException.class)
    public void testDeletedFrame() throws Exception {
        final Instant timestamp = StarFrames.timestamp(0);
        final File file = StarFrames.write(temporaryFolder.getRoot(), 0, timestamp);
        final List<FrameLoader> loaders = new LocalFrameSource(temporaryFolder.getRoot()).fetch(TimeRange.all());
        Assert.assertTrue("failed to delete " + file, file.delete());
        loaders.get(0).load();
    }

}
