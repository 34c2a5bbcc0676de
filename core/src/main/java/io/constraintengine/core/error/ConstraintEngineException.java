package io.constraintengine.core.error;

/**
 * Abstract base for all constraint-engine exceptions. Never thrown directly; use one of the
 * concrete subclasses.
 */
public abstract class ConstraintEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONFIGURATION,
        REGISTRATION,
        QUERY,
        DATA
    }

    private final String resource;
    private final Phase phase;

    protected ConstraintEngineException(String message, String resource, Phase phase) {
        super(message);
        this.resource = resource;
        this.phase = phase;
    }

    protected ConstraintEngineException(String message, Throwable cause, String resource, Phase phase) {
        super(message, cause);
        this.resource = resource;
        this.phase = phase;
    }

    /** The template, constraint or target that triggered the error, or {@code null} if unknown. */
    public String resource() {
        return resource;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
