package io.constraintengine.core.error;

/** Thrown when none of the engines a template declares has a registered driver. */
public final class NoDriverException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public NoDriverException(String message, String template) {
        super(message, template);
    }
}
