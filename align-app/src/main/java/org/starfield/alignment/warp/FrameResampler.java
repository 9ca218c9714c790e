package org.starfield.alignment.warp;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.Serializable;

import org.starfield.alignment.image.Frame;
import org.starfield.alignment.transform.FrameTransform;

/**
 * Warps frames into reference frame coordinates with bilinear interpolation.
 *
 * Each target pixel is mapped back into the source frame with the transform's analytic inverse.
 * Target pixels whose source position lies outside the source frame are set to the background value.
 */
public class FrameResampler
        implements Serializable {

    private final float backgroundValue;

    public FrameResampler() {
        this(0.0f);
    }

    public FrameResampler(final float backgroundValue) {
        this.backgroundValue = backgroundValue;
    }

    public float getBackgroundValue() {
        return backgroundValue;
    }

    /**
     * Warps into a target with the source frame's dimensions.
     */
    public Frame warp(final Frame source,
                      final FrameTransform transform) {
        return warp(source, transform, source.getWidth(), source.getHeight());
    }

    /**
     * @param  source     frame to warp.
     * @param  transform  mapping from source coordinates to target coordinates.
     * @param  width      target width.
     * @param  height     target height.
     *
     * @return warped frame with the source frame's timestamp and channel count.
     */
    public Frame warp(final Frame source,
                      final FrameTransform transform,
                      final int width,
                      final int height) {

        final int channelCount = source.getChannelCount();

        if (transform.isIdentity() && (width == source.getWidth()) && (height == source.getHeight())) {
            final float[][] copy = new float[channelCount][];
            for (int c = 0; c < channelCount; c++) {
                copy[c] = source.getChannelPixels(c);
            }
            return new Frame(width, height, copy, source.getTimestamp());
        }

        final FloatProcessor[] sourceChannels = new FloatProcessor[channelCount];
        for (int c = 0; c < channelCount; c++) {
            sourceChannels[c] = source.toFloatProcessor(c);
            sourceChannels[c].setInterpolationMethod(ImageProcessor.BILINEAR);
        }

        final float[][] target = new float[channelCount][width * height];
        final double[] sourcePosition = new double[2];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                transform.applyInverseInPlace(x, y, sourcePosition);
                final int targetIndex = (y * width) + x;
                for (int c = 0; c < channelCount; c++) {
                    target[c][targetIndex] = interpolate(sourceChannels[c], sourcePosition[0], sourcePosition[1]);
                }
            }
        }

        return new Frame(width, height, target, source.getTimestamp());
    }

    /**
     * @return bilinear interpolation of the processor at (x, y) or the background value if (x, y) lies outside
     *         [0, width - 1] x [0, height - 1].
     */
    float interpolate(final ImageProcessor ip,
                      final double x,
                      final double y) {
        if ((x < 0) || (y < 0) || (x > ip.getWidth() - 1) || (y > ip.getHeight() - 1) ||
            Double.isNaN(x) || Double.isNaN(y)) {
            return backgroundValue;
        }
        return (float) ip.getInterpolatedPixel(x, y);
    }

}
