package io.constraintengine.core.error;

/**
 * Thrown when a template update would change the template's target set while constraints for the
 * template still exist.
 */
public final class ChangeTargetsException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public ChangeTargetsException(String message, String template) {
        super(message, template);
    }
}
