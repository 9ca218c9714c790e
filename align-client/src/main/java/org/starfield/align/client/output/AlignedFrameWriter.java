package org.starfield.align.client.output;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.starfield.align.client.source.FrameFileNames;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.image.FrameFiles;
import org.starfield.alignment.pipeline.AlignedFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes aligned frames to an output directory, named by acquisition time.
 *
 * When a stack interval is configured, consecutive frames are grouped until the next frame was acquired
 * more than the interval after the last frame of the group.
 * Each group is written as the per-pixel mean of its frames and named after the group's last frame.
 * Frames that share an acquisition time (to the second) have their frame index appended to the name.
 */
public class AlignedFrameWriter {

    private final File outputDirectory;
    private final String format;
    private final float jpegQuality;
    private final Duration stackInterval;

    /**
     * @param  outputDirectory       directory for written frames (created if necessary).
     * @param  format                file extension for written frames (png, jpg or tif).
     * @param  jpegQuality           compression quality for jpg output.
     * @param  stackIntervalSeconds  stacking interval (null to write every frame individually).
     */
    public AlignedFrameWriter(final File outputDirectory,
                              final String format,
                              final float jpegQuality,
                              final Long stackIntervalSeconds) {
        this.outputDirectory = outputDirectory;
        this.format = format;
        this.jpegQuality = jpegQuality;
        this.stackInterval = stackIntervalSeconds == null ? null : Duration.ofSeconds(stackIntervalSeconds);
    }

    /**
     * @param  alignedFrames  frames in temporal order.
     *
     * @return written file for each frame index (stacked frames share a file).
     *
     * @throws IOException
     *   if any file cannot be written.
     */
    public Map<Integer, File> write(final List<AlignedFrame> alignedFrames)
            throws IOException {

        final Map<Integer, File> frameIndexToFile = new LinkedHashMap<>();
        final Set<String> writtenNames = new HashSet<>();

        if (stackInterval == null) {
            for (final AlignedFrame alignedFrame : alignedFrames) {
                frameIndexToFile.put(alignedFrame.getFrameIndex(),
                                     save(alignedFrame.getImage(), alignedFrame.getFrameIndex(), writtenNames));
            }
        } else {
            final List<AlignedFrame> group = new ArrayList<>();
            for (final AlignedFrame alignedFrame : alignedFrames) {
                if ((! group.isEmpty()) && isBeyondInterval(group.get(group.size() - 1), alignedFrame)) {
                    writeGroup(group, frameIndexToFile, writtenNames);
                    group.clear();
                }
                group.add(alignedFrame);
            }
            if (! group.isEmpty()) {
                writeGroup(group, frameIndexToFile, writtenNames);
            }
        }

        LOG.info("write: wrote {} frames to {}", frameIndexToFile.size(), outputDirectory.getAbsolutePath());

        return frameIndexToFile;
    }

    private boolean isBeyondInterval(final AlignedFrame last,
                                     final AlignedFrame next) {
        final Instant lastTime = last.getTimestamp();
        final Instant nextTime = next.getTimestamp();
        return (lastTime == null) || (nextTime == null) || nextTime.isAfter(lastTime.plus(stackInterval));
    }

    private void writeGroup(final List<AlignedFrame> group,
                            final Map<Integer, File> frameIndexToFile,
                            final Set<String> writtenNames)
            throws IOException {

        final AlignedFrame last = group.get(group.size() - 1);
        final File file = save(stack(group), last.getFrameIndex(), writtenNames);

        LOG.debug("writeGroup: stacked {} frames into {}", group.size(), file.getName());

        for (final AlignedFrame alignedFrame : group) {
            frameIndexToFile.put(alignedFrame.getFrameIndex(), file);
        }
    }

    /**
     * @return per-pixel mean of the group's images with the last frame's timestamp.
     */
    static Frame stack(final List<AlignedFrame> group) {

        final Frame first = group.get(0).getImage();
        final int channelCount = first.getChannelCount();
        final int pixelCount = first.getWidth() * first.getHeight();
        final double[][] sums = new double[channelCount][pixelCount];

        for (final AlignedFrame alignedFrame : group) {
            final Frame image = alignedFrame.getImage();
            if ((image.getWidth() != first.getWidth()) || (image.getHeight() != first.getHeight()) ||
                (image.getChannelCount() != channelCount)) {
                throw new IllegalArgumentException("cannot stack " + image + " with " + first);
            }
            for (int c = 0; c < channelCount; c++) {
                final float[] pixels = image.getChannelPixels(c);
                for (int i = 0; i < pixelCount; i++) {
                    sums[c][i] += pixels[i];
                }
            }
        }

        final float[][] means = new float[channelCount][pixelCount];
        for (int c = 0; c < channelCount; c++) {
            for (int i = 0; i < pixelCount; i++) {
                means[c][i] = (float) (sums[c][i] / group.size());
            }
        }

        return new Frame(first.getWidth(), first.getHeight(), means,
                         group.get(group.size() - 1).getTimestamp());
    }

    File getFile(final Instant timestamp,
                 final int frameIndex) {
        final String name = timestamp == null ?
                            String.format("frame_%05d.%s", frameIndex, format) :
                            FrameFileNames.getName(timestamp, format);
        return new File(outputDirectory, name);
    }

    /**
     * @return file for the frame, with the frame index appended when the timestamp based name
     *         has already been written during this run.
     */
    File getFile(final Instant timestamp,
                 final int frameIndex,
                 final Set<String> writtenNames) {
        File file = getFile(timestamp, frameIndex);
        if (writtenNames.contains(file.getName())) {
            final String name = file.getName();
            final String baseName = name.substring(0, name.length() - format.length() - 1);
            file = new File(outputDirectory, baseName + "_" + frameIndex + "." + format);
            LOG.warn("getFile: {} was already written, saving frame {} as {}", name, frameIndex, file.getName());
        }
        writtenNames.add(file.getName());
        return file;
    }

    private File save(final Frame frame,
                      final int frameIndex,
                      final Set<String> writtenNames)
            throws IOException {
        final File file = getFile(frame.getTimestamp(), frameIndex, writtenNames);
        FrameFiles.save(frame, file, jpegQuality);
        return file;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignedFrameWriter.class);
}
