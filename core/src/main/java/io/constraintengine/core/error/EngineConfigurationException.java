package io.constraintengine.core.error;

/** Thrown when a {@code ConstraintEngine} is built with invalid targets, drivers or options. */
public final class EngineConfigurationException extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    public EngineConfigurationException(String message) {
        super(message, null, Phase.CONFIGURATION);
    }
}
