package io.constraintengine.core.error;

/**
 * Abstract parent for errors raised while adding, removing or reading templates and constraints.
 * A registration error means nothing was committed to the engine's cache for the call that raised
 * it.
 */
public abstract class RegistrationException extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    protected RegistrationException(String message, String resource) {
        super(message, resource, Phase.REGISTRATION);
    }

    protected RegistrationException(String message, Throwable cause, String resource) {
        super(message, cause, resource, Phase.REGISTRATION);
    }
}
