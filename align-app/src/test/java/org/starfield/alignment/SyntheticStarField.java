package org.starfield.alignment;

import java.time.Instant;

import org.starfield.alignment.detect.Source;
import org.starfield.alignment.detect.SourceSet;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.transform.FrameTransform;

/**
 * Builds noise free star field frames from Gaussian blobs for tests.
 */
public class SyntheticStarField {

    public static final int WIDTH = 200;
    public static final int HEIGHT = 200;
    public static final double CENTER_X = 100.0;
    public static final double CENTER_Y = 100.0;

    /** x, y, amplitude for stars that stay inside the frame when rotated about the center. */
    public static final double[][] STARS = {
            { 62.3, 64.6, 200 },
            { 104.2, 47.7, 180 },
            { 146.6, 62.1, 220 },
            { 57.8, 108.4, 160 },
            { 100.5, 96.2, 240 },
            { 142.1, 112.8, 190 },
            { 70.4, 146.3, 210 },
            { 118.7, 149.9, 170 },
            { 155.2, 143.4, 230 }
    };

    public static final double SIGMA = 1.5;

    public static Frame render(final double[][] stars,
                               final Instant timestamp) {
        return render(WIDTH, HEIGHT, stars, SIGMA, 0.0f, timestamp);
    }

    public static Frame render(final int width,
                               final int height,
                               final double[][] stars,
                               final double sigma,
                               final float background,
                               final Instant timestamp) {

        final float[] pixels = new float[width * height];
        java.util.Arrays.fill(pixels, background);

        final int radius = (int) Math.ceil(5 * sigma);
        for (final double[] star : stars) {
            final int fromX = Math.max(0, (int) star[0] - radius);
            final int toX = Math.min(width - 1, (int) star[0] + radius);
            final int fromY = Math.max(0, (int) star[1] - radius);
            final int toY = Math.min(height - 1, (int) star[1] + radius);
            for (int y = fromY; y <= toY; y++) {
                for (int x = fromX; x <= toX; x++) {
                    final double dx = x - star[0];
                    final double dy = y - star[1];
                    pixels[(y * width) + x] += (float) (star[2] * Math.exp(-((dx * dx) + (dy * dy)) /
                                                                           (2 * sigma * sigma)));
                }
            }
        }

        return new Frame(width, height, pixels, timestamp);
    }

    /**
     * @return star list with positions mapped through the transform (amplitudes unchanged).
     */
    public static double[][] transform(final double[][] stars,
                                       final FrameTransform transform) {
        final double[][] transformed = new double[stars.length][];
        for (int i = 0; i < stars.length; i++) {
            final double[] position = transform.apply(stars[i][0], stars[i][1]);
            transformed[i] = new double[] { position[0], position[1], stars[i][2] };
        }
        return transformed;
    }

    public static double[][] rotate(final double[][] stars,
                                    final double degrees) {
        return transform(stars, FrameTransform.rotationAbout(Math.toRadians(degrees), CENTER_X, CENTER_Y));
    }

    public static Instant timestamp(final int frameNumber) {
        return Instant.parse("2015-07-10T00:00:00Z").plusSeconds(3600L * frameNumber);
    }

    public static SourceSet sourceSet(final int frameIndex,
                                      final double[][] positions) {
        final java.util.List<Source> sources = new java.util.ArrayList<>();
        for (final double[] position : positions) {
            final double brightness = position.length > 2 ? position[2] : 1.0;
            sources.add(new Source(position[0], position[1], brightness, 9));
        }
        return new SourceSet(frameIndex, sources);
    }

    /**
     * @return distance from (x, y) to the closest source in the set.
     */
    public static double distanceToClosest(final SourceSet sources,
                                           final double x,
                                           final double y) {
        double closest = Double.MAX_VALUE;
        for (final Source source : sources) {
            closest = Math.min(closest, Math.sqrt(source.distanceSquared(x, y)));
        }
        return closest;
    }

}
