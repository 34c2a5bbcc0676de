package io.constraintengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.EnforcementActions;
import io.constraintengine.core.spi.Matcher;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/** A stored constraint with its per-target matchers and resolved enforcement settings. */
final class ConstraintEntry {

    private final Constraint constraint;
    private final Map<String, Matcher> matchers;
    private final String enforcementAction;
    private final Map<String, List<String>> actionsForEnforcementPoints;

    ConstraintEntry(
            Constraint constraint,
            Map<String, Matcher> matchers,
            String enforcementAction,
            Map<String, List<String>> actionsForEnforcementPoints) {
        this.constraint = constraint;
        this.matchers = Map.copyOf(matchers);
        this.enforcementAction = enforcementAction;
        this.actionsForEnforcementPoints = Map.copyOf(actionsForEnforcementPoints);
    }

    Constraint constraint() {
        return constraint;
    }

    String enforcementAction() {
        return enforcementAction;
    }

    /**
     * Returns {@code true} if the constraint has an action at any of {@code enforcementPoints}.
     */
    boolean appliesAt(Collection<String> enforcementPoints) {
        return !scopedActions(enforcementPoints).isEmpty();
    }

    /** Sorted union of the constraint's actions at {@code enforcementPoints}. */
    List<String> scopedActions(Collection<String> enforcementPoints) {
        TreeSet<String> actions = new TreeSet<>();
        for (String ep : enforcementPoints) {
            List<String> forEp = actionsForEnforcementPoints.get(ep);
            if (forEp != null) {
                actions.addAll(forEp);
            }
        }
        return List.copyOf(actions);
    }

    /**
     * Matches the constraint against a review produced by {@code target}.
     *
     * @return {@code null} if the constraint does not apply; otherwise a match or a failure that the
     *     caller turns into an automatic rejection
     */
    ConstraintMatchResult matches(String target, JsonNode review, Collection<String> enforcementPoints) {
        List<String> scoped = scopedActions(enforcementPoints);
        if (scoped.isEmpty()) {
            return null;
        }
        Matcher matcher = matchers.get(target);
        if (matcher == null) {
            return null;
        }
        List<String> reported = EnforcementActions.isScoped(enforcementAction) ? scoped : List.of();
        try {
            return matcher.match(review) ? ConstraintMatchResult.matched(constraint, enforcementAction, reported) : null;
        } catch (RuntimeException e) {
            return ConstraintMatchResult.failed(constraint, enforcementAction, reported, e);
        }
    }
}
