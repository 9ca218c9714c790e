package org.starfield.alignment.image;

import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;

/**
 * Immutable multi-channel float image with an acquisition timestamp.
 *
 * Pixels are stored row major, one array per channel.
 * Gray images have one channel, color images have three (red, green, blue).
 */
public class Frame
        implements Serializable {

    private final int width;
    private final int height;
    private final float[][] channels;
    private final Instant timestamp;

    /**
     * @param  width      image width in pixels.
     * @param  height     image height in pixels.
     * @param  channels   pixel data for each channel (copied).
     * @param  timestamp  acquisition time (may be null for images without timing information).
     *
     * @throws IllegalArgumentException
     *   if the dimensions are not positive or any channel has the wrong length.
     */
    public Frame(final int width,
                 final int height,
                 final float[][] channels,
                 final Instant timestamp)
            throws IllegalArgumentException {

        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("invalid frame dimensions " + width + "x" + height);
        }
        if ((channels == null) || (channels.length == 0)) {
            throw new IllegalArgumentException("frame must have at least one channel");
        }

        final int pixelCount = width * height;
        this.channels = new float[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            if ((channels[c] == null) || (channels[c].length != pixelCount)) {
                throw new IllegalArgumentException("channel " + c + " does not contain " + pixelCount + " pixels");
            }
            this.channels[c] = channels[c].clone();
        }

        this.width = width;
        this.height = height;
        this.timestamp = timestamp;
    }

    /**
     * Wraps a single channel of pixels.
     */
    public Frame(final int width,
                 final int height,
                 final float[] pixels,
                 final Instant timestamp)
            throws IllegalArgumentException {
        this(width, height, new float[][] { pixels }, timestamp);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannelCount() {
        return channels.length;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public float get(final int channel,
                     final int x,
                     final int y) {
        return channels[channel][(y * width) + x];
    }

    /**
     * @return a copy of the pixels for the specified channel.
     */
    public float[] getChannelPixels(final int channel) {
        return channels[channel].clone();
    }

    /**
     * @return per-pixel mean across all channels (a copy for single channel frames).
     */
    public float[] getLuminance() {
        if (channels.length == 1) {
            return channels[0].clone();
        }
        final float[] luminance = new float[width * height];
        for (final float[] channel : channels) {
            for (int i = 0; i < luminance.length; i++) {
                luminance[i] += channel[i];
            }
        }
        for (int i = 0; i < luminance.length; i++) {
            luminance[i] /= channels.length;
        }
        return luminance;
    }

    /**
     * @return true if the specified region lies completely within this frame.
     */
    public boolean contains(final Rectangle region) {
        return (region.x >= 0) && (region.y >= 0) && (region.width > 0) && (region.height > 0) &&
               (region.x + region.width <= width) && (region.y + region.height <= height);
    }

    /**
     * @param  region  region to extract (null returns this frame).
     *
     * @return frame containing the specified region with the same timestamp.
     *
     * @throws IllegalArgumentException
     *   if the region does not lie within this frame.
     */
    public Frame crop(final Rectangle region)
            throws IllegalArgumentException {

        if (region == null) {
            return this;
        }

        if (! contains(region)) {
            throw new IllegalArgumentException("crop region " + region + " is outside of " + width + "x" + height +
                                               " frame");
        }

        final float[][] cropped = new float[channels.length][region.width * region.height];
        for (int c = 0; c < channels.length; c++) {
            for (int y = 0; y < region.height; y++) {
                System.arraycopy(channels[c], ((region.y + y) * width) + region.x,
                                 cropped[c], y * region.width,
                                 region.width);
            }
        }

        return new Frame(region.width, region.height, cropped, timestamp);
    }

    /**
     * @return this frame converted to an ImageJ processor
     *         (a {@link ColorProcessor} for three channel frames, otherwise a {@link FloatProcessor} of channel 0).
     */
    public ImageProcessor toImageProcessor() {
        final ImageProcessor processor;
        if (channels.length == 3) {
            final ColorProcessor colorProcessor = new ColorProcessor(width, height);
            for (int c = 0; c < 3; c++) {
                colorProcessor.setChannel(c + 1, toFloatProcessor(c).convertToByteProcessor(false));
            }
            processor = colorProcessor;
        } else {
            processor = toFloatProcessor(0);
        }
        return processor;
    }

    public FloatProcessor toFloatProcessor(final int channel) {
        return new FloatProcessor(width, height, channels[channel].clone());
    }

    /**
     * @param  processor  ImageJ processor to convert.
     * @param  timestamp  acquisition time for the frame.
     *
     * @return frame with one channel for gray processors and three channels for color processors.
     */
    public static Frame fromImageProcessor(final ImageProcessor processor,
                                           final Instant timestamp) {

        final int width = processor.getWidth();
        final int height = processor.getHeight();
        final float[][] channels;

        if (processor instanceof ColorProcessor) {
            final ColorProcessor colorProcessor = (ColorProcessor) processor;
            channels = new float[3][];
            for (int c = 0; c < 3; c++) {
                final ImageProcessor channelProcessor = colorProcessor.getChannel(c + 1, null);
                channels[c] = (float[]) channelProcessor.convertToFloatProcessor().getPixels();
            }
        } else {
            channels = new float[][] { (float[]) processor.convertToFloatProcessor().getPixels() };
        }

        return new Frame(width, height, channels, timestamp);
    }

    /**
     * @return a frame of the specified dimensions with every pixel set to value.
     */
    public static Frame filled(final int width,
                               final int height,
                               final int channelCount,
                               final float value,
                               final Instant timestamp) {
        final float[][] channels = new float[channelCount][width * height];
        for (final float[] channel : channels) {
            Arrays.fill(channel, value);
        }
        return new Frame(width, height, channels, timestamp);
    }

    @Override
    public String toString() {
        return "{\"width\": " + width + ", \"height\": " + height + ", \"channels\": " + channels.length +
               ", \"timestamp\": \"" + timestamp + "\"}";
    }

}
