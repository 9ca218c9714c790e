package org.starfield.alignment.match;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.starfield.alignment.detect.Source;
import org.starfield.alignment.detect.SourceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;

/**
 * Pairs candidate frame sources with reference frame sources by a radius search on a KD-tree
 * built from the reference source positions.
 *
 * Suitable when the attitude change between frames is small relative to the spacing between stars.
 * Pairings are one-to-one: each reference source is claimed by at most one candidate.
 * No attempt is made to remove wrong pairings, that is left to the transform estimator.
 */
public class CorrespondenceMatcher
        implements Serializable {

    private final double searchRadius;

    public CorrespondenceMatcher(final MatchingParameters parameters) {
        parameters.validateAndSetDefaults("matching");
        this.searchRadius = parameters.searchRadius;
    }

    public double getSearchRadius() {
        return searchRadius;
    }

    /**
     * @param  candidateSet  sources from the frame being registered.
     * @param  referenceSet  sources from the reference frame.
     *
     * @return correspondences ordered by candidate index (possibly empty).
     *
     * @throws IllegalArgumentException
     *   if both arguments are the same source set.
     */
    public List<Correspondence> match(final SourceSet candidateSet,
                                      final SourceSet referenceSet)
            throws IllegalArgumentException {

        if (candidateSet == referenceSet) {
            throw new IllegalArgumentException("cannot match sources of frame " + candidateSet.getFrameIndex() +
                                               " with themselves");
        }

        if (referenceSet.isEmpty() || candidateSet.isEmpty()) {
            LOG.debug("match: nothing to pair, {} candidate and {} reference sources",
                      candidateSet.size(), referenceSet.size());
            return new ArrayList<>();
        }

        final double maxDistanceSquared = searchRadius * searchRadius;

        final List<Integer> referenceIndexes = new ArrayList<>(referenceSet.size());
        final List<RealPoint> referencePositions = new ArrayList<>(referenceSet.size());
        for (int r = 0; r < referenceSet.size(); r++) {
            final Source reference = referenceSet.get(r);
            referenceIndexes.add(r);
            referencePositions.add(new RealPoint(reference.getX(), reference.getY()));
        }

        final int[] nearest = new int[candidateSet.size()];
        final double[] nearestDistanceSquared = new double[candidateSet.size()];
        Arrays.fill(nearest, -1);

        final KDTree<Integer> tree = new KDTree<>(referenceIndexes, referencePositions);
        final RadiusNeighborSearchOnKDTree<Integer> nn = new RadiusNeighborSearchOnKDTree<>(tree);

        // nearest reference index (and its distance) for each candidate,
        // equidistant references go to the brighter one and then to the lower index
        for (int c = 0; c < candidateSet.size(); c++) {
            final Source candidate = candidateSet.get(c);
            nn.search(new RealPoint(candidate.getX(), candidate.getY()), searchRadius, true);

            int best = -1;
            double bestDistanceSquared = Double.MAX_VALUE;
            for (int j = 0; j < nn.numNeighbors(); j++) {
                final int r = nn.getSampler(j).get();
                final Source reference = referenceSet.get(r);
                final double distanceSquared = reference.distanceSquared(candidate.getX(), candidate.getY());
                if (distanceSquared > maxDistanceSquared) {
                    continue;
                }
                if ((best == -1) || isCloserOrPreferred(reference, r, distanceSquared,
                                                        referenceSet.get(best), best, bestDistanceSquared)) {
                    best = r;
                    bestDistanceSquared = distanceSquared;
                }
            }
            nearest[c] = best;
            nearestDistanceSquared[c] = bestDistanceSquared;
        }

        // resolve candidates that claim the same reference source in favor of the closest (then lowest index) one
        final int[] owner = new int[referenceSet.size()];
        Arrays.fill(owner, -1);
        for (int c = 0; c < nearest.length; c++) {
            final int r = nearest[c];
            if (r >= 0) {
                final int currentOwner = owner[r];
                if ((currentOwner == -1) || (nearestDistanceSquared[c] < nearestDistanceSquared[currentOwner])) {
                    owner[r] = c;
                }
            }
        }

        final List<Correspondence> correspondences = new ArrayList<>();
        for (int c = 0; c < nearest.length; c++) {
            final int r = nearest[c];
            if ((r >= 0) && (owner[r] == c)) {
                correspondences.add(new Correspondence(candidateSet.get(c), referenceSet.get(r), c, r));
            }
        }

        LOG.debug("match: paired {} of {} candidate sources with {} reference sources within radius {}",
                  correspondences.size(), candidateSet.size(), referenceSet.size(), searchRadius);

        return correspondences;
    }

    private static boolean isCloserOrPreferred(final Source reference,
                                               final int referenceIndex,
                                               final double distanceSquared,
                                               final Source best,
                                               final int bestIndex,
                                               final double bestDistanceSquared) {
        if (distanceSquared != bestDistanceSquared) {
            return distanceSquared < bestDistanceSquared;
        } else if (reference.getBrightness() != best.getBrightness()) {
            return reference.getBrightness() > best.getBrightness();
        }
        return referenceIndex < bestIndex;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CorrespondenceMatcher.class);
}
