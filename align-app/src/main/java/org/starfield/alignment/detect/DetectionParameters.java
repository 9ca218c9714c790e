package org.starfield.alignment.detect;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.starfield.alignment.detect.SourceDetector.BackgroundEstimator;
import org.starfield.alignment.detect.SourceDetector.ThresholdMethod;

/**
 * Parameters for star (source) detection.
 */
public class DetectionParameters
        implements Serializable {

    public DetectionParameters() {
        setDefaults();
    }

    @Parameter(
            names = "--thresholdMethod",
            description = "Method for deriving the detection threshold"
    )
    public ThresholdMethod thresholdMethod;

    @Parameter(
            names = "--backgroundEstimator",
            description = "Statistic used to estimate the background level"
    )
    public BackgroundEstimator backgroundEstimator;

    @Parameter(
            names = "--thresholdSigma",
            description = "For SIGMA thresholds, number of standard deviations above background a pixel must be"
    )
    public Double thresholdSigma;

    @Parameter(
            names = "--brightFraction",
            description = "For BRIGHT_FRACTION thresholds, maximum fraction of pixels allowed above the threshold"
    )
    public Double brightFraction;

    @Parameter(
            names = "--thresholdBias",
            description = "For BRIGHT_FRACTION thresholds, intensity added to the derived threshold"
    )
    public Double thresholdBias;

    @Parameter(
            names = "--dilationRadius",
            description = "Radius of square dilation applied to the threshold mask so fragments of a source merge " +
                          "(0 to skip dilation)"
    )
    public Integer dilationRadius;

    @Parameter(
            names = "--minFootprint",
            description = "Minimum number of pixels in a source (filters hot pixels)"
    )
    public Integer minFootprint;

    @Parameter(
            names = "--minBrightness",
            description = "Minimum background subtracted brightness of a source"
    )
    public Double minBrightness;

    @Parameter(
            names = "--maxSources",
            description = "If specified, only keep this many of the brightest sources"
    )
    public Integer maxSources;

    public void setDefaults() {
        if (thresholdMethod == null) {
            thresholdMethod = ThresholdMethod.SIGMA;
        }
        if (backgroundEstimator == null) {
            backgroundEstimator = BackgroundEstimator.MEDIAN;
        }
        if (thresholdSigma == null) {
            thresholdSigma = 3.0;
        }
        if (brightFraction == null) {
            brightFraction = 0.025;
        }
        if (thresholdBias == null) {
            thresholdBias = 2.0;
        }
        if (dilationRadius == null) {
            dilationRadius = 0;
        }
        if (minFootprint == null) {
            minFootprint = 2;
        }
        if (minBrightness == null) {
            minBrightness = 0.0;
        }
    }

    public void validateAndSetDefaults(final String context)
            throws IllegalArgumentException {

        setDefaults();

        if (thresholdSigma < 0) {
            throw new IllegalArgumentException(context + " thresholdSigma must not be negative");
        }
        if ((brightFraction <= 0) || (brightFraction >= 1)) {
            throw new IllegalArgumentException(context + " brightFraction must be between 0 and 1");
        }
        if (dilationRadius < 0) {
            throw new IllegalArgumentException(context + " dilationRadius must not be negative");
        }
        if (minFootprint < 1) {
            throw new IllegalArgumentException(context + " minFootprint must be at least 1");
        }
        if ((maxSources != null) && (maxSources < 1)) {
            throw new IllegalArgumentException(context + " maxSources must be at least 1 when specified");
        }
    }

}
