package io.constraintengine.core.error;

/** Thrown by reads that refer to a constraint the engine does not know. */
public final class MissingConstraintException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public MissingConstraintException(String message, String constraint) {
        super(message, constraint);
    }
}
