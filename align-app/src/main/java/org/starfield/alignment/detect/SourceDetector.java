package org.starfield.alignment.detect;

import ij.measure.Measurements;
import ij.plugin.filter.RankFilters;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.starfield.alignment.image.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts point sources (stars) from a frame by thresholding against a background estimate and
 * reducing each connected bright region to an intensity weighted centroid.
 */
public class SourceDetector
        implements Serializable {

    /** Supported threshold derivation methods. */
    public enum ThresholdMethod {
        /** Background plus a multiple of the (sample) standard deviation. */
        SIGMA,

        /** Lowest level exceeded by less than a fixed fraction of pixels, plus a bias. */
        BRIGHT_FRACTION
    }

    /** Supported background level statistics. */
    public enum BackgroundEstimator {
        MEDIAN,
        MEAN
    }

    private final DetectionParameters parameters;

    public SourceDetector(final DetectionParameters parameters) {
        parameters.validateAndSetDefaults("detection");
        this.parameters = parameters;
    }

    public SourceSet detect(final Frame frame) {
        return detect(frame, 0);
    }

    /**
     * @param  frame       frame to search.
     * @param  frameIndex  index used to tag the returned set.
     *
     * @return sources in raster order of their first pixel (possibly empty).
     */
    public SourceSet detect(final Frame frame,
                            final int frameIndex) {

        final int width = frame.getWidth();
        final int height = frame.getHeight();
        final float[] pixels = frame.getLuminance();
        final FloatProcessor ip = new FloatProcessor(width, height, pixels);

        final ImageStatistics statistics = measure(ip);
        final double background = estimateBackground(statistics);
        final double threshold = deriveThreshold(pixels, statistics, background);

        boolean[] mask = new boolean[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            mask[i] = pixels[i] > threshold;
        }

        if (parameters.dilationRadius > 0) {
            mask = dilate(mask, width, height, parameters.dilationRadius);
        }

        final List<Source> components = extractComponents(pixels, mask, width, height, background);
        final List<Source> sources = filter(components);

        LOG.debug("detect: frame {}, background {}, threshold {}, found {} sources in {} components",
                  frameIndex, background, threshold, sources.size(), components.size());

        return new SourceSet(frameIndex, sources);
    }

    static ImageStatistics measure(final FloatProcessor ip) {
        return ImageStatistics.getStatistics(ip, Measurements.MEAN | Measurements.STD_DEV | Measurements.MEDIAN, null);
    }

    double estimateBackground(final ImageStatistics statistics) {
        return parameters.backgroundEstimator == BackgroundEstimator.MEAN ? statistics.mean : statistics.median;
    }

    double deriveThreshold(final float[] pixels,
                           final ImageStatistics statistics,
                           final double background) {

        final double threshold;

        if (parameters.thresholdMethod == ThresholdMethod.BRIGHT_FRACTION) {

            final float[] sortedPixels = pixels.clone();
            Arrays.sort(sortedPixels);

            // walk distinct levels upward until fewer than the allowed number of pixels lie above the level
            final double allowedAbove = sortedPixels.length * parameters.brightFraction;
            double level = sortedPixels[sortedPixels.length - 1];
            int i = 0;
            while (i < sortedPixels.length) {
                final float value = sortedPixels[i];
                int lastIndex = i;
                while ((lastIndex + 1 < sortedPixels.length) && (sortedPixels[lastIndex + 1] == value)) {
                    lastIndex++;
                }
                final int countAbove = sortedPixels.length - (lastIndex + 1);
                if (countAbove < allowedAbove) {
                    level = value;
                    break;
                }
                i = lastIndex + 1;
            }
            threshold = level + parameters.thresholdBias;

        } else {

            threshold = background + (parameters.thresholdSigma * statistics.stdDev);

        }

        return threshold;
    }

    /**
     * Labels 8-connected mask regions in raster order and reduces each one to a source.
     */
    private List<Source> extractComponents(final float[] pixels,
                                           final boolean[] mask,
                                           final int width,
                                           final int height,
                                           final double background) {

        final List<Source> components = new ArrayList<>();
        final boolean[] visited = new boolean[mask.length];
        final int[] stack = new int[mask.length];

        for (int start = 0; start < mask.length; start++) {

            if ((! mask[start]) || visited[start]) {
                continue;
            }

            double weightSum = 0.0;
            double weightedX = 0.0;
            double weightedY = 0.0;
            double sumX = 0.0;
            double sumY = 0.0;
            int footprint = 0;

            int stackSize = 0;
            stack[stackSize++] = start;
            visited[start] = true;

            while (stackSize > 0) {
                final int index = stack[--stackSize];
                final int x = index % width;
                final int y = index / width;
                final double weight = Math.max(0.0, pixels[index] - background);

                weightSum += weight;
                weightedX += weight * x;
                weightedY += weight * y;
                sumX += x;
                sumY += y;
                footprint++;

                for (int ny = Math.max(0, y - 1); ny <= Math.min(height - 1, y + 1); ny++) {
                    for (int nx = Math.max(0, x - 1); nx <= Math.min(width - 1, x + 1); nx++) {
                        final int neighbor = (ny * width) + nx;
                        if (mask[neighbor] && (! visited[neighbor])) {
                            visited[neighbor] = true;
                            stack[stackSize++] = neighbor;
                        }
                    }
                }
            }

            final double centerX;
            final double centerY;
            if (weightSum > 0) {
                centerX = weightedX / weightSum;
                centerY = weightedY / weightSum;
            } else {
                centerX = sumX / footprint;
                centerY = sumY / footprint;
            }

            components.add(new Source(centerX, centerY, weightSum, footprint));
        }

        return components;
    }

    private List<Source> filter(final List<Source> components) {

        final List<Source> sources = new ArrayList<>(components.size());
        for (final Source component : components) {
            if ((component.getFootprint() >= parameters.minFootprint) &&
                (component.getBrightness() >= parameters.minBrightness)) {
                sources.add(component);
            }
        }

        if ((parameters.maxSources != null) && (sources.size() > parameters.maxSources)) {
            final List<Source> brightest = new ArrayList<>(sources);
            brightest.sort(Comparator.comparingDouble(Source::getBrightness).reversed());
            final double cutoff = brightest.get(parameters.maxSources - 1).getBrightness();

            int aboveCutoffCount = 0;
            for (final Source source : sources) {
                if (source.getBrightness() > cutoff) {
                    aboveCutoffCount++;
                }
            }

            // keep raster order, breaking brightness ties at the cutoff by position
            int tiesAllowed = parameters.maxSources - aboveCutoffCount;
            final List<Source> kept = new ArrayList<>(parameters.maxSources);
            for (final Source source : sources) {
                if (source.getBrightness() > cutoff) {
                    kept.add(source);
                } else if ((source.getBrightness() == cutoff) && (tiesAllowed > 0)) {
                    kept.add(source);
                    tiesAllowed--;
                }
            }

            LOG.debug("filter: kept brightest {} of {} sources", kept.size(), sources.size());
            return kept;
        }

        return sources;
    }

    /**
     * Grows the mask with an ImageJ maximum rank filter,
     * so the structuring element is the rank filter's circular kernel (a 3x3 square for radius 1).
     */
    static boolean[] dilate(final boolean[] mask,
                            final int width,
                            final int height,
                            final int radius) {

        final ByteProcessor maskProcessor = new ByteProcessor(width, height);
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                maskProcessor.set(i, 255);
            }
        }

        final RankFilters rankFilters = new RankFilters();
        rankFilters.rank(maskProcessor, radius, RankFilters.MAX);

        final boolean[] dilated = new boolean[mask.length];
        for (int i = 0; i < dilated.length; i++) {
            dilated[i] = maskProcessor.get(i) != 0;
        }
        return dilated;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SourceDetector.class);
}
