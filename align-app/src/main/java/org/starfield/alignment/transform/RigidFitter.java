package org.starfield.alignment.transform;

import java.util.List;

import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.match.Correspondence;

/**
 * Rotation and translation fit (two dimensional orthogonal Procrustes solution).
 */
public class RigidFitter
        implements TransformFitter {

    @Override
    public int getMinNumMatches() {
        return 2;
    }

    @Override
    public FrameTransform fit(final List<Correspondence> correspondences)
            throws DegenerateGeometryException {

        final CenteredSums sums = new CenteredSums(correspondences);

        final double cosSum = sums.pxqx + sums.pyqy;
        final double sinSum = sums.pxqy - sums.pyqx;

        if ((sums.getCandidateSpread() < CenteredSums.MIN_SPREAD) || (sums.qq < CenteredSums.MIN_SPREAD)) {
            throw new DegenerateGeometryException("rigid fit of " + correspondences.size() +
                                                  " correspondences with coincident positions");
        }

        final double theta = Math.atan2(sinSum, cosSum);
        final double cos = Math.cos(theta);
        final double sin = Math.sin(theta);
        final double[] t = sums.translationFor(cos, -sin, sin, cos);

        return new FrameTransform(ModelType.RIGID, cos, -sin, t[0], sin, cos, t[1]);
    }

}
