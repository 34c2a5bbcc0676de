package io.constraintengine.core.error;

/** Thrown when a template's metadata, target declarations, code or generated schema is invalid. */
public final class InvalidConstraintTemplateException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public InvalidConstraintTemplateException(String message, String template) {
        super(message, template);
    }

    public InvalidConstraintTemplateException(String message, Throwable cause, String template) {
        super(message, cause, template);
    }
}
