package org.starfield.alignment.transform;

import java.util.List;

import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.match.Correspondence;

/**
 * Closed form least squares fit of a transform model to correspondences.
 */
public interface TransformFitter {

    /**
     * @return minimum number of correspondences needed for a fit.
     */
    int getMinNumMatches();

    /**
     * @param  correspondences  at least {@link #getMinNumMatches()} pairings.
     *
     * @return transform minimizing the summed squared transfer error of candidate onto reference positions.
     *
     * @throws DegenerateGeometryException
     *   if the positions do not determine an invertible transform.
     */
    FrameTransform fit(List<Correspondence> correspondences)
            throws DegenerateGeometryException;

}
