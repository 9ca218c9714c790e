package org.starfield.alignment;

/**
 * Thrown when there are fewer correspondences than a transform model needs.
 */
public class InsufficientCorrespondencesException
        extends RegistrationException {

    private final int available;
    private final int required;

    public InsufficientCorrespondencesException(final int available,
                                                final int required) {
        super(FailureReason.INSUFFICIENT_CORRESPONDENCES,
              "found " + available + " correspondences but at least " + required + " are required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

}
