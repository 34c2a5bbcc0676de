package io.constraintengine.core.error;

/** Thrown when referential data is written but no registered driver can store it. */
public final class NoReferentialDriverException extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    public NoReferentialDriverException(String message) {
        super(message, null, Phase.DATA);
    }
}
