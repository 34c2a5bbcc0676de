package io.constraintengine.core.error;

/**
 * Thrown when a constraint has bad metadata, an unsupported group or version, an invalid
 * enforcement action, or is rejected by its target.
 */
public class InvalidConstraintException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public InvalidConstraintException(String message, String constraint) {
        super(message, constraint);
    }

    public InvalidConstraintException(String message, Throwable cause, String constraint) {
        super(message, cause, constraint);
    }
}
