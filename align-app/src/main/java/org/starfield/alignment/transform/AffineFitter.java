package org.starfield.alignment.transform;

import java.util.List;

import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.match.Correspondence;

/**
 * General six parameter affine least squares fit (normal equations on centered positions).
 */
public class AffineFitter
        implements TransformFitter {

    /** Relative covariance determinant below which candidate positions are considered collinear. */
    private static final double COLLINEARITY_TOLERANCE = 1e-10;

    @Override
    public int getMinNumMatches() {
        return 3;
    }

    @Override
    public FrameTransform fit(final List<Correspondence> correspondences)
            throws DegenerateGeometryException {

        final CenteredSums sums = new CenteredSums(correspondences);

        final double spread = sums.getCandidateSpread();
        final double covarianceDeterminant = (sums.pxx * sums.pyy) - (sums.pxy * sums.pxy);

        if ((spread < CenteredSums.MIN_SPREAD) ||
            (covarianceDeterminant <= COLLINEARITY_TOLERANCE * spread * spread)) {
            throw new DegenerateGeometryException("affine fit of " + correspondences.size() +
                                                  " correspondences with collinear candidate positions");
        }

        final double inverseXX = sums.pyy / covarianceDeterminant;
        final double inverseXY = -sums.pxy / covarianceDeterminant;
        final double inverseYY = sums.pxx / covarianceDeterminant;

        final double m00 = (inverseXX * sums.pxqx) + (inverseXY * sums.pyqx);
        final double m01 = (inverseXY * sums.pxqx) + (inverseYY * sums.pyqx);
        final double m10 = (inverseXX * sums.pxqy) + (inverseXY * sums.pyqy);
        final double m11 = (inverseXY * sums.pxqy) + (inverseYY * sums.pyqy);

        final double determinant = (m00 * m11) - (m01 * m10);
        if ((! Double.isFinite(determinant)) || (Math.abs(determinant) < FrameTransform.MIN_DETERMINANT)) {
            throw new DegenerateGeometryException("affine fit of " + correspondences.size() +
                                                  " correspondences maps onto a line");
        }

        final double[] t = sums.translationFor(m00, m01, m10, m11);

        return new FrameTransform(ModelType.AFFINE, m00, m01, t[0], m10, m11, t[1]);
    }

}
