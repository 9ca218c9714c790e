package org.starfield.alignment.transform;

import java.util.List;

import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.match.Correspondence;

/**
 * Rotation, uniform scale and translation least squares fit.
 */
public class SimilarityFitter
        implements TransformFitter {

    @Override
    public int getMinNumMatches() {
        return 2;
    }

    @Override
    public FrameTransform fit(final List<Correspondence> correspondences)
            throws DegenerateGeometryException {

        final CenteredSums sums = new CenteredSums(correspondences);

        final double spread = sums.getCandidateSpread();
        if (spread < CenteredSums.MIN_SPREAD) {
            throw new DegenerateGeometryException("similarity fit of " + correspondences.size() +
                                                  " correspondences with coincident candidate positions");
        }

        // linear part is [a, -b; b, a]
        final double a = (sums.pxqx + sums.pyqy) / spread;
        final double b = (sums.pxqy - sums.pyqx) / spread;

        final double determinant = (a * a) + (b * b);
        if (determinant < FrameTransform.MIN_DETERMINANT) {
            throw new DegenerateGeometryException("similarity fit of " + correspondences.size() +
                                                  " correspondences collapses to a point");
        }

        final double[] t = sums.translationFor(a, -b, b, a);

        return new FrameTransform(ModelType.SIMILARITY, a, -b, t[0], b, a, t[1]);
    }

}
