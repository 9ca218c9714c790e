package org.starfield.alignment.match;

import java.io.Serializable;

import org.starfield.alignment.detect.Source;

/**
 * Asserted pairing of a candidate frame source with a reference frame source.
 * Pairings may be wrong (outliers), so consumers must not trust them individually.
 */
public class Correspondence
        implements Serializable {

    private final Source candidate;
    private final Source reference;
    private final int candidateIndex;
    private final int referenceIndex;

    public Correspondence(final Source candidate,
                          final Source reference,
                          final int candidateIndex,
                          final int referenceIndex) {
        this.candidate = candidate;
        this.reference = reference;
        this.candidateIndex = candidateIndex;
        this.referenceIndex = referenceIndex;
    }

    /**
     * Convenience constructor for pairings built from raw coordinates.
     */
    public Correspondence(final double candidateX,
                          final double candidateY,
                          final double referenceX,
                          final double referenceY) {
        this(new Source(candidateX, candidateY, 1.0, 1),
             new Source(referenceX, referenceY, 1.0, 1),
             -1,
             -1);
    }

    public Source getCandidate() {
        return candidate;
    }

    public Source getReference() {
        return reference;
    }

    /**
     * @return index of the candidate source within its set (or -1 if unknown).
     */
    public int getCandidateIndex() {
        return candidateIndex;
    }

    /**
     * @return index of the reference source within its set (or -1 if unknown).
     */
    public int getReferenceIndex() {
        return referenceIndex;
    }

    public double getDistance() {
        return candidate.distance(reference);
    }

    @Override
    public String toString() {
        return "{\"candidate\": " + candidate + ", \"reference\": " + reference + "}";
    }

}
