package org.starfield.alignment.warp;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.time.Instant;

import org.junit.Assert;
import org.junit.Test;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.transform.FrameTransform;

/**
 * Tests the {@link FrameResampler} class.
 */
public class FrameResamplerTest {

    @Test
    public void testIdentityCopiesPixels() {

        final Frame source = buildSmoothFrame(32, 24);
        final Frame warped = new FrameResampler().warp(source, FrameTransform.identity());

        Assert.assertEquals("invalid width", 32, warped.getWidth());
        Assert.assertEquals("invalid height", 24, warped.getHeight());
        Assert.assertEquals("timestamp should carry over", source.getTimestamp(), warped.getTimestamp());
        Assert.assertArrayEquals("identity warp changed pixels",
                                 source.getChannelPixels(0), warped.getChannelPixels(0), 0.0f);
    }

    @Test
    public void testIntegerShift() {

        final Frame source = buildSmoothFrame(40, 30);
        final FrameResampler resampler = new FrameResampler(-1.0f);
        final Frame warped = resampler.warp(source, FrameTransform.similarity(0.0, 1.0, 2.0, 3.0));

        for (int y = 0; y < warped.getHeight(); y++) {
            for (int x = 0; x < warped.getWidth(); x++) {
                final float expected = ((x < 2) || (y < 3)) ? -1.0f : source.get(0, x - 2, y - 3);
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")", expected, warped.get(0, x, y), 0.0001f);
            }
        }
    }

    @Test
    public void testRotationRoundTrip() {

        final Frame source = buildSmoothFrame(64, 64);
        final FrameTransform rotation = FrameTransform.rotationAbout(Math.toRadians(5), 32.0, 32.0);
        final FrameResampler resampler = new FrameResampler();

        final Frame rotated = resampler.warp(source, rotation);
        final Frame restored = resampler.warp(rotated, rotation.createInverse());

        for (int y = 12; y < 52; y++) {
            for (int x = 12; x < 52; x++) {
                Assert.assertEquals("round trip differs at (" + x + ", " + y + ")",
                                    source.get(0, x, y), restored.get(0, x, y), 1.0f);
            }
        }
    }

    @Test
    public void testOutOfBoundsGetsBackground() {

        final Frame source = Frame.filled(10, 10, 1, 50.0f, Instant.now());
        final FrameResampler resampler = new FrameResampler(7.0f);
        final Frame warped = resampler.warp(source, FrameTransform.similarity(0.0, 1.0, 100.0, 100.0));

        for (final float pixel : warped.getChannelPixels(0)) {
            Assert.assertEquals("pixel should be background", 7.0f, pixel, 0.0f);
        }
    }

    @Test
    public void testLargerTarget() {

        final Frame source = Frame.filled(10, 10, 1, 50.0f, Instant.now());
        final Frame warped = new FrameResampler().warp(source, FrameTransform.identity(), 20, 15);

        Assert.assertEquals("invalid width", 20, warped.getWidth());
        Assert.assertEquals("invalid height", 15, warped.getHeight());
        Assert.assertEquals("invalid inside pixel", 50.0f, warped.get(0, 9, 9), 0.0001f);
        Assert.assertEquals("invalid outside pixel", 0.0f, warped.get(0, 15, 12), 0.0f);
    }

    @Test
    public void testMultipleChannels() {

        final float[][] channels = new float[3][16];
        for (int i = 0; i < 16; i++) {
            channels[0][i] = 10.0f;
            channels[1][i] = 20.0f;
            channels[2][i] = 30.0f;
        }
        final Frame source = new Frame(4, 4, channels, Instant.now());
        final Frame warped = new FrameResampler().warp(source, FrameTransform.similarity(0.0, 1.0, 0.5, 0.0));

        Assert.assertEquals("invalid channel count", 3, warped.getChannelCount());
        for (int c = 0; c < 3; c++) {
            Assert.assertEquals("invalid value for channel " + c, (c + 1) * 10.0f, warped.get(c, 2, 2), 0.0001f);
        }
    }

    @Test
    public void testInterpolate() {
        final FrameResampler resampler = new FrameResampler(-5.0f);
        final FloatProcessor ip = new FloatProcessor(2, 2, new float[] { 0, 10, 20, 30 });
        ip.setInterpolationMethod(ImageProcessor.BILINEAR);
        Assert.assertEquals("invalid center", 15.0f, resampler.interpolate(ip, 0.5, 0.5), 0.0001f);
        Assert.assertEquals("invalid off center", 17.5f, resampler.interpolate(ip, 0.25, 0.75), 0.0001f);
        Assert.assertEquals("invalid origin", 0.0f, resampler.interpolate(ip, 0.0, 0.0), 0.0001f);
        // ImageJ samples the last row and column slightly inside the edge
        Assert.assertEquals("invalid corner", 30.0f, resampler.interpolate(ip, 1.0, 1.0), 0.05f);
        Assert.assertEquals("invalid outside", -5.0f, resampler.interpolate(ip, 1.01, 0.0), 0.0f);
        Assert.assertEquals("invalid negative", -5.0f, resampler.interpolate(ip, -0.01, 0.5), 0.0f);
    }

    private static Frame buildSmoothFrame(final int width,
                                          final int height) {
        final float[] pixels = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[(y * width) + x] = (float) (100 + (50 * Math.sin(x / 6.0) * Math.cos(y / 7.0)));
            }
        }
        return new Frame(width, height, pixels, Instant.parse("2015-07-10T12:00:00Z"));
    }

}
