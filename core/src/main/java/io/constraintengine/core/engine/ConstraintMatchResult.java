package io.constraintengine.core.engine;

import io.constraintengine.core.model.Constraint;
import java.util.List;

/**
 * Outcome of matching one constraint against one review: either the constraint applies, with the
 * enforcement settings for the queried points, or matching failed with {@code error}.
 */
record ConstraintMatchResult(
        Constraint constraint, String enforcementAction, List<String> scopedActions, RuntimeException error) {

    static ConstraintMatchResult matched(Constraint constraint, String action, List<String> scopedActions) {
        return new ConstraintMatchResult(constraint, action, scopedActions, null);
    }

    static ConstraintMatchResult failed(
            Constraint constraint, String action, List<String> scopedActions, RuntimeException error) {
        return new ConstraintMatchResult(constraint, action, scopedActions, error);
    }

    boolean isError() {
        return error != null;
    }
}
