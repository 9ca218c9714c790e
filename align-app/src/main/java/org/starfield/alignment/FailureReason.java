package org.starfield.alignment;

/**
 * Reasons a frame can be excluded from (or abort) an alignment run.
 */
public enum FailureReason {

    /** Fewer correspondences than the transform model needs. */
    INSUFFICIENT_CORRESPONDENCES,

    /** Correspondences are coincident or collinear so no stable transform exists. */
    DEGENERATE_GEOMETRY,

    /** Best transform hypothesis has too few inliers. */
    INSUFFICIENT_CONSENSUS,

    /** No sources were detected in the frame. */
    EMPTY_DETECTION,

    /** Frame could not be acquired from its source. */
    FETCH_FAILURE,

    /** Run was cancelled before the frame was processed. */
    CANCELLED,

    /** Frame processing did not finish within the configured time. */
    TIMEOUT,

    /** Frame processing failed with an unexpected runtime error. */
    UNEXPECTED
}
