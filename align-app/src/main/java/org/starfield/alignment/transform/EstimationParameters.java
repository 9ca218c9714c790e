package org.starfield.alignment.transform;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for robust (RANSAC) transform estimation.
 */
public class EstimationParameters
        implements Serializable {

    public EstimationParameters() {
        setDefaults();
    }

    public EstimationParameters(final ModelType modelType,
                                final int iterations,
                                final double maxEpsilon,
                                final int minNumInliers,
                                final long randomSeed) {
        this.modelType = modelType;
        this.iterations = iterations;
        this.maxEpsilon = maxEpsilon;
        this.minNumInliers = minNumInliers;
        this.randomSeed = randomSeed;
    }

    @Parameter(
            names = "--modelType",
            description = "Type of transform model to estimate"
    )
    public ModelType modelType;

    @Parameter(
            names = "--ransacIterations",
            description = "Number of random sample consensus trials"
    )
    public Integer iterations;

    @Parameter(
            names = "--maxEpsilon",
            description = "Maximum transfer error in pixels for a correspondence to count as an inlier"
    )
    public Double maxEpsilon;

    @Parameter(
            names = "--minNumInliers",
            description = "Minimum number of inliers the best model must have"
    )
    public Integer minNumInliers;

    @Parameter(
            names = "--randomSeed",
            description = "Seed for correspondence sampling (identical seeds give identical results)"
    )
    public Long randomSeed;

    public void setDefaults() {
        if (modelType == null) {
            modelType = ModelType.SIMILARITY;
        }
        if (iterations == null) {
            iterations = 1000;
        }
        if (maxEpsilon == null) {
            maxEpsilon = 3.0;
        }
        if (minNumInliers == null) {
            minNumInliers = 4;
        }
        if (randomSeed == null) {
            randomSeed = 0L;
        }
    }

    public void validateAndSetDefaults(final String context)
            throws IllegalArgumentException {
        setDefaults();
        if (iterations < 1) {
            throw new IllegalArgumentException(context + " iterations must be at least 1");
        }
        if (maxEpsilon <= 0) {
            throw new IllegalArgumentException(context + " maxEpsilon must be positive");
        }
        if (minNumInliers < modelType.getMinNumMatches()) {
            throw new IllegalArgumentException(context + " minNumInliers must be at least " +
                                               modelType.getMinNumMatches() + " for " + modelType + " models");
        }
    }

}
