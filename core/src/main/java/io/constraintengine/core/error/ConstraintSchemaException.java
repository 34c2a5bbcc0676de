package io.constraintengine.core.error;

import java.util.List;

/** Thrown when a constraint fails validation against its template's generated schema. */
public final class ConstraintSchemaException extends InvalidConstraintException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ConstraintSchemaException(String message, String constraint, List<String> violations) {
        super(message, constraint);
        this.violations = List.copyOf(violations);
    }

    /** Individual schema violation messages, in the order the validator reported them. */
    public List<String> violations() {
        return violations;
    }
}
