package org.starfield.alignment;

/**
 * Base class for recoverable failures while registering a single frame.
 */
public abstract class RegistrationException
        extends Exception {

    private final FailureReason reason;

    protected RegistrationException(final FailureReason reason,
                                    final String message) {
        super(message);
        this.reason = reason;
    }

    protected RegistrationException(final FailureReason reason,
                                    final String message,
                                    final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

}
