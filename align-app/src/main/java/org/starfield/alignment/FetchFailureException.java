package org.starfield.alignment;

/**
 * Thrown when a frame cannot be acquired (download, cache or decode failure).
 */
public class FetchFailureException
        extends RegistrationException {

    public FetchFailureException(final String message) {
        super(FailureReason.FETCH_FAILURE, message);
    }

    public FetchFailureException(final String message,
                                 final Throwable cause) {
        super(FailureReason.FETCH_FAILURE, message, cause);
    }

}
