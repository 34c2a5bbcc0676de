package io.constraintengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named, declarative policy type. Constraints of this type are instances whose {@code kind}
 * equals {@link #kind()}.
 *
 * <p>Immutable apart from the parameters schema, which is a Jackson tree; {@link #copy()} returns
 * an instance that shares no mutable state with this one.
 *
 * @param name             template name; must equal the lowercase of {@code kind}
 * @param kind             the constraint kind this template defines
 * @param parametersSchema JSON schema for {@code spec.parameters}, or a missing node
 * @param targets          target declarations (exactly one is supported)
 */
public record ConstraintTemplate(String name, String kind, JsonNode parametersSchema, List<TemplateTarget> targets) {

    public ConstraintTemplate {
        parametersSchema = parametersSchema == null ? MissingNode.getInstance() : parametersSchema;
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    /** Returns the lowercase of {@code kind}, the name a constraint's kind resolves to. */
    public static String nameForKind(String kind) {
        return kind.toLowerCase(Locale.ROOT);
    }

    /** Names of the declared targets. */
    public Set<String> targetNames() {
        return targets.stream().map(TemplateTarget::target).collect(Collectors.toUnmodifiableSet());
    }

    /** Returns {@code true} if the template declares a parameters schema. */
    public boolean hasParametersSchema() {
        return !parametersSchema.isMissingNode() && !parametersSchema.isNull();
    }

    /** Deep copy; the parameters schema tree is cloned. */
    public ConstraintTemplate copy() {
        return new ConstraintTemplate(name, kind, parametersSchema.deepCopy(), targets);
    }

    /**
     * Returns {@code true} if {@code other} would compile to the same policy type: same name,
     * kind, parameters schema and target code.
     */
    public boolean semanticEquals(ConstraintTemplate other) {
        return other != null
                && Objects.equals(name, other.name)
                && Objects.equals(kind, other.kind)
                && parametersSchema.equals(other.parametersSchema)
                && targets.equals(other.targets);
    }
}
