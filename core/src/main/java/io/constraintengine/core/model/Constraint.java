package io.constraintengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A named instance of a {@link ConstraintTemplate}, held as the unstructured object the caller
 * submitted ({@code apiVersion}, {@code kind}, {@code metadata}, {@code spec}).
 *
 * <p>Immutable: the object is copied on construction and every accessor that exposes a subtree
 * returns a copy, so engine-internal state cannot be changed through a returned reference.
 */
public final class Constraint {

    private final ObjectNode object;

    private Constraint(ObjectNode object) {
        this.object = object;
    }

    /**
     * Wraps a deep copy of {@code node}.
     *
     * @throws IllegalArgumentException if {@code node} is not a JSON object
     */
    public static Constraint of(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!node.isObject()) {
            throw new IllegalArgumentException("constraint must be a JSON object, got " + node.getNodeType());
        }
        return new Constraint(((ObjectNode) node).deepCopy());
    }

    public String apiVersion() {
        return object.path("apiVersion").asText("");
    }

    /** API group part of {@code apiVersion}; empty for core-group versions. */
    public String group() {
        String apiVersion = apiVersion();
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    /** Version part of {@code apiVersion}. */
    public String version() {
        String apiVersion = apiVersion();
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
    }

    public String kind() {
        return object.path("kind").asText("");
    }

    public String name() {
        return object.path("metadata").path("name").asText("");
    }

    public ConstraintKey key() {
        return new ConstraintKey(kind(), name());
    }

    /** Copy of {@code spec}, or a missing node. */
    public JsonNode spec() {
        return copyOf(object.path("spec"));
    }

    /** Copy of {@code spec.parameters}, or a missing node. */
    public JsonNode parameters() {
        return copyOf(object.path("spec").path("parameters"));
    }

    /** Copy of {@code spec.match}, or a missing node. */
    public JsonNode match() {
        return copyOf(object.path("spec").path("match"));
    }

    /** Copy of the value at {@code pointer} (JSON Pointer syntax), or a missing node. */
    public JsonNode at(String pointer) {
        return copyOf(object.at(pointer));
    }

    /** Deep copy of the whole object. */
    public ObjectNode toJson() {
        return object.deepCopy();
    }

    /** Returns a copy with {@code status} removed; the engine never caches status. */
    public Constraint withoutStatus() {
        ObjectNode copy = object.deepCopy();
        copy.remove("status");
        return new Constraint(copy);
    }

    /**
     * Returns {@code true} if both constraints have the same spec, labels and annotations. Status
     * and server-populated metadata are ignored.
     */
    public boolean semanticEquals(Constraint other) {
        if (other == null) {
            return false;
        }
        return object.path("spec").equals(other.object.path("spec"))
                && object.path("metadata").path("labels").equals(other.object.path("metadata").path("labels"))
                && object.path("metadata")
                        .path("annotations")
                        .equals(other.object.path("metadata").path("annotations"));
    }

    private static JsonNode copyOf(JsonNode node) {
        return node.isMissingNode() ? MissingNode.getInstance() : node.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Constraint c && object.equals(c.object));
    }

    @Override
    public int hashCode() {
        return object.hashCode();
    }

    @Override
    public String toString() {
        return "Constraint[" + key() + "]";
    }
}
