package io.constraintengine.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Uniquely identifies a constraint: its kind and its name within that kind.
 *
 * @param kind constraint kind
 * @param name constraint name
 */
public record ConstraintKey(String kind, String name) implements Comparable<ConstraintKey> {

    private static final Comparator<ConstraintKey> ORDER =
            Comparator.comparing(ConstraintKey::kind).thenComparing(ConstraintKey::name);

    public ConstraintKey {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public int compareTo(ConstraintKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return kind + "/" + name;
    }
}
