package io.constraintengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.error.InvalidConstraintException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reads a constraint's enforcement settings: {@code spec.enforcementAction} and, when that action
 * is {@code scoped}, the per-enforcement-point actions in {@code spec.scopedEnforcementActions}.
 */
public final class EnforcementActions {

    /** Reject the reviewed object. Applies when a constraint declares no action. */
    public static final String DENY = "deny";

    /** Actions are chosen per enforcement point. */
    public static final String SCOPED = "scoped";

    private EnforcementActions() {}

    /**
     * Returns the constraint's enforcement action, {@link #DENY} if none is declared.
     *
     * @throws InvalidConstraintException if {@code spec.enforcementAction} is not a string
     */
    public static String enforcementAction(Constraint constraint) {
        JsonNode action = constraint.at("/spec/enforcementAction");
        if (action.isMissingNode() || action.isNull()) {
            return DENY;
        }
        if (!action.isTextual()) {
            throw new InvalidConstraintException(
                    "invalid spec.enforcementAction for constraint " + constraint.key(), constraint.name());
        }
        return action.asText();
    }

    public static boolean isScoped(String action) {
        return SCOPED.equalsIgnoreCase(action);
    }

    /**
     * Resolves the actions that apply at each of {@code enforcementPoints}.
     *
     * <p>For an unscoped constraint every point gets the constraint's single action. For a scoped
     * constraint each point gets the lowercased actions whose enforcement points name it or the
     * {@code *} wildcard; points with no action are omitted. Action lists are sorted.
     *
     * @throws InvalidConstraintException if the scoped actions are missing or malformed
     */
    public static Map<String, List<String>> actionsForEnforcementPoints(
            Constraint constraint, Collection<String> enforcementPoints) {
        if (enforcementPoints.isEmpty()) {
            throw new IllegalArgumentException("enforcement points must be provided to resolve enforcement actions");
        }
        String action = enforcementAction(constraint);
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (!isScoped(action)) {
            enforcementPoints.forEach(ep -> result.put(ep, List.of(action)));
            return result;
        }

        JsonNode scoped = constraint.at("/spec/scopedEnforcementActions");
        if (scoped.isMissingNode() || scoped.isNull()) {
            throw new InvalidConstraintException(
                    "spec.scopedEnforcementActions must be defined for constraint " + constraint.key(),
                    constraint.name());
        }
        if (!scoped.isArray()) {
            throw malformed(constraint);
        }

        Map<String, TreeSet<String>> actions = new LinkedHashMap<>();
        enforcementPoints.forEach(ep -> actions.put(ep, new TreeSet<>()));
        for (JsonNode entry : scoped) {
            if (!entry.isObject() || !entry.path("action").isTextual()) {
                throw malformed(constraint);
            }
            String scopedAction = entry.get("action").asText().toLowerCase(Locale.ROOT);
            JsonNode points = entry.path("enforcementPoints");
            if (!points.isMissingNode() && !points.isArray()) {
                throw malformed(constraint);
            }
            for (JsonNode point : points) {
                String name = point.path("name").asText("").toLowerCase(Locale.ROOT);
                if (EnforcementPoints.ALL.equals(name)) {
                    actions.values().forEach(set -> set.add(scopedAction));
                    break;
                }
                TreeSet<String> set = actions.get(name);
                if (set != null) {
                    set.add(scopedAction);
                }
            }
        }
        actions.forEach((ep, set) -> {
            if (!set.isEmpty()) {
                result.put(ep, List.copyOf(new ArrayList<>(set)));
            }
        });
        return result;
    }

    private static InvalidConstraintException malformed(Constraint constraint) {
        return new InvalidConstraintException(
                "spec.scopedEnforcementActions for constraint " + constraint.key()
                        + " must be a list of {action: string, enforcementPoints: [{name: string}]}",
                constraint.name());
    }
}
