package org.starfield.alignment;

/**
 * Thrown when correspondence positions are coincident or collinear so that no invertible transform can be fit.
 */
public class DegenerateGeometryException
        extends RegistrationException {

    public DegenerateGeometryException(final String message) {
        super(FailureReason.DEGENERATE_GEOMETRY, message);
    }

}
