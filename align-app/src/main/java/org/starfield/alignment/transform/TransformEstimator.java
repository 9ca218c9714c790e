package org.starfield.alignment.transform;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.InsufficientConsensusException;
import org.starfield.alignment.InsufficientCorrespondencesException;
import org.starfield.alignment.match.Correspondence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the transform mapping candidate frame positions onto reference frame positions from
 * correspondences that may contain outliers.
 *
 * Uses random sample consensus with a fixed number of trials: each trial fits the model to a minimal
 * random sample and counts the correspondences within maxEpsilon of the fitted model.
 * The winning trial's inliers are then refit with least squares.
 * Sampling is driven by a {@link Random} seeded per call, so identical input gives identical output.
 */
public class TransformEstimator
        implements Serializable {

    private final ModelType modelType;
    private final int iterations;
    private final double maxEpsilon;
    private final int minNumInliers;
    private final long randomSeed;

    public TransformEstimator(final EstimationParameters parameters) {
        parameters.validateAndSetDefaults("estimation");
        this.modelType = parameters.modelType;
        this.iterations = parameters.iterations;
        this.maxEpsilon = parameters.maxEpsilon;
        this.minNumInliers = parameters.minNumInliers;
        this.randomSeed = parameters.randomSeed;
    }

    public ModelType getModelType() {
        return modelType;
    }

    /**
     * Estimates using a random source seeded with the configured seed.
     *
     * @see #estimate(List, Random)
     */
    public FrameTransform estimate(final List<Correspondence> correspondences)
            throws InsufficientCorrespondencesException, DegenerateGeometryException, InsufficientConsensusException {
        return estimate(correspondences, new Random(randomSeed));
    }

    /**
     * @param  correspondences  candidate to reference pairings (outliers allowed).
     * @param  random           source for sample selection.
     *
     * @return transform fit to the inliers of the best trial, with inlier count and RMS residual.
     *
     * @throws InsufficientCorrespondencesException
     *   if there are fewer correspondences than the model needs.
     * @throws DegenerateGeometryException
     *   if every trial (or the final refit) was degenerate.
     * @throws InsufficientConsensusException
     *   if the best trial has fewer than minNumInliers inliers.
     */
    public FrameTransform estimate(final List<Correspondence> correspondences,
                                   final Random random)
            throws InsufficientCorrespondencesException, DegenerateGeometryException, InsufficientConsensusException {

        final TransformFitter fitter = modelType.getFitter();
        final int sampleSize = fitter.getMinNumMatches();
        final int candidateCount = correspondences.size();

        if (candidateCount < sampleSize) {
            throw new InsufficientCorrespondencesException(candidateCount, sampleSize);
        }

        final double maxEpsilonSquared = maxEpsilon * maxEpsilon;
        final int[] sampleIndexes = new int[sampleSize];
        final List<Correspondence> sample = new ArrayList<>(sampleSize);

        List<Correspondence> bestInliers = null;
        int degenerateTrialCount = 0;

        for (int trial = 0; trial < iterations; trial++) {

            drawSample(random, candidateCount, sampleIndexes);
            sample.clear();
            for (final int index : sampleIndexes) {
                sample.add(correspondences.get(index));
            }

            final FrameTransform trialModel;
            try {
                trialModel = fitter.fit(sample);
            } catch (final DegenerateGeometryException e) {
                degenerateTrialCount++;
                continue;
            }

            final List<Correspondence> trialInliers = findInliers(trialModel, correspondences, maxEpsilonSquared);
            if ((bestInliers == null) || (trialInliers.size() > bestInliers.size())) {
                bestInliers = trialInliers;
                if (bestInliers.size() == candidateCount) {
                    break;
                }
            }
        }

        if (bestInliers == null) {
            throw new DegenerateGeometryException("all " + degenerateTrialCount + " " + modelType +
                                                  " trials for " + candidateCount +
                                                  " correspondences were degenerate");
        }

        if (bestInliers.size() < minNumInliers) {
            throw new InsufficientConsensusException(bestInliers.size(), minNumInliers, candidateCount);
        }

        final FrameTransform refit = fitter.fit(bestInliers);
        final FrameTransform result = refit.withQuality(bestInliers.size(), rmsResidual(refit, bestInliers));

        LOG.debug("estimate: {} inliers of {} candidates, {} degenerate trials, result {}",
                  bestInliers.size(), candidateCount, degenerateTrialCount, result);

        return result;
    }

    /**
     * Fills sampleIndexes with distinct random indexes below count.
     */
    static void drawSample(final Random random,
                           final int count,
                           final int[] sampleIndexes) {
        for (int i = 0; i < sampleIndexes.length; i++) {
            boolean isDuplicate;
            int index;
            do {
                index = random.nextInt(count);
                isDuplicate = false;
                for (int j = 0; j < i; j++) {
                    if (sampleIndexes[j] == index) {
                        isDuplicate = true;
                        break;
                    }
                }
            } while (isDuplicate);
            sampleIndexes[i] = index;
        }
    }

    static List<Correspondence> findInliers(final FrameTransform model,
                                            final List<Correspondence> correspondences,
                                            final double maxEpsilonSquared) {
        final List<Correspondence> inliers = new ArrayList<>(correspondences.size());
        for (final Correspondence c : correspondences) {
            if (model.transferErrorSquared(c.getCandidate().getX(), c.getCandidate().getY(),
                                           c.getReference().getX(), c.getReference().getY()) <= maxEpsilonSquared) {
                inliers.add(c);
            }
        }
        return inliers;
    }

    static double rmsResidual(final FrameTransform model,
                              final List<Correspondence> correspondences) {
        double sum = 0.0;
        for (final Correspondence c : correspondences) {
            sum += model.transferErrorSquared(c.getCandidate().getX(), c.getCandidate().getY(),
                                              c.getReference().getX(), c.getReference().getY());
        }
        return correspondences.isEmpty() ? 0.0 : Math.sqrt(sum / correspondences.size());
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransformEstimator.class);
}
