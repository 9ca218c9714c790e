package org.starfield.alignment;

/**
 * Thrown when no sources are detected in a frame.
 */
public class EmptyDetectionException
        extends RegistrationException {

    public EmptyDetectionException(final int frameIndex) {
        super(FailureReason.EMPTY_DETECTION, "no sources detected in frame " + frameIndex);
    }

}
