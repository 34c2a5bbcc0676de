package io.constraintengine.core.error;

/** Thrown when an operation refers to a template name or constraint kind that is not registered. */
public final class MissingConstraintTemplateException extends RegistrationException {

    private static final long serialVersionUID = 1L;

    public MissingConstraintTemplateException(String message, String template) {
        super(message, template);
    }
}
