package io.constraintengine.core.error;

/** Thrown by a target handler that cannot shape, key, match or post-process an object. */
public final class TargetHandlerException extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    public TargetHandlerException(String message, String target) {
        super(message, target, Phase.QUERY);
    }

    public TargetHandlerException(String message, Throwable cause, String target) {
        super(message, cause, target, Phase.QUERY);
    }
}
