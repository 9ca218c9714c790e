package org.starfield.alignment.transform;

import java.util.List;

import org.starfield.alignment.match.Correspondence;

/**
 * Centroids and second order sums of centered correspondence positions shared by the closed form fitters.
 * Candidate positions are p, reference positions are q.
 */
class CenteredSums {

    final double pcx;
    final double pcy;
    final double qcx;
    final double qcy;

    /** sum of px * px */
    double pxx;
    /** sum of px * py */
    double pxy;
    /** sum of py * py */
    double pyy;
    /** sum of px * qx */
    double pxqx;
    /** sum of px * qy */
    double pxqy;
    /** sum of py * qx */
    double pyqx;
    /** sum of py * qy */
    double pyqy;
    /** sum of qx * qx + qy * qy */
    double qq;

    CenteredSums(final List<Correspondence> correspondences) {

        double sumPx = 0;
        double sumPy = 0;
        double sumQx = 0;
        double sumQy = 0;
        for (final Correspondence c : correspondences) {
            sumPx += c.getCandidate().getX();
            sumPy += c.getCandidate().getY();
            sumQx += c.getReference().getX();
            sumQy += c.getReference().getY();
        }

        final int n = correspondences.size();
        pcx = sumPx / n;
        pcy = sumPy / n;
        qcx = sumQx / n;
        qcy = sumQy / n;

        for (final Correspondence c : correspondences) {
            final double px = c.getCandidate().getX() - pcx;
            final double py = c.getCandidate().getY() - pcy;
            final double qx = c.getReference().getX() - qcx;
            final double qy = c.getReference().getY() - qcy;
            pxx += px * px;
            pxy += px * py;
            pyy += py * py;
            pxqx += px * qx;
            pxqy += px * qy;
            pyqx += py * qx;
            pyqy += py * qy;
            qq += (qx * qx) + (qy * qy);
        }
    }

    double getCandidateSpread() {
        return pxx + pyy;
    }

    /**
     * @return translation that maps the candidate centroid onto the reference centroid after applying the
     *         linear part [a, b; c, d].
     */
    double[] translationFor(final double a,
                            final double b,
                            final double c,
                            final double d) {
        return new double[] { qcx - ((a * pcx) + (b * pcy)), qcy - ((c * pcx) + (d * pcy)) };
    }

    /** Squared spreads below this (in pixels squared) are treated as coincident points. */
    static final double MIN_SPREAD = 1e-9;

}
