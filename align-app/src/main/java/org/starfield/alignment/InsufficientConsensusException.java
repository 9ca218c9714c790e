package org.starfield.alignment;

/**
 * Thrown when the best transform hypothesis is supported by too few inliers.
 */
public class InsufficientConsensusException
        extends RegistrationException {

    private final int inlierCount;
    private final int minNumInliers;

    public InsufficientConsensusException(final int inlierCount,
                                          final int minNumInliers,
                                          final int candidateCount) {
        super(FailureReason.INSUFFICIENT_CONSENSUS,
              "best model has " + inlierCount + " inliers out of " + candidateCount +
              " candidates but at least " + minNumInliers + " are required");
        this.inlierCount = inlierCount;
        this.minNumInliers = minNumInliers;
    }

    public int getInlierCount() {
        return inlierCount;
    }

    public int getMinNumInliers() {
        return minNumInliers;
    }

}
