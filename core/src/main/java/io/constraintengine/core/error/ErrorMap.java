package io.constraintengine.core.error;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate of independent failures collected during a single review, audit or data call, keyed
 * by target (or target and driver). One entry failing never discards results obtained for the
 * other keys.
 */
public final class ErrorMap extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    private final Map<String, Throwable> errors;

    public ErrorMap(Map<String, ? extends Throwable> errors) {
        super(render(errors), null, Phase.QUERY);
        this.errors = Collections.unmodifiableMap(new TreeMap<>(errors));
        this.errors.values().forEach(this::addSuppressed);
    }

    /** Errors keyed by target, sorted by key. */
    public Map<String, Throwable> errors() {
        return errors;
    }

    /** Returns the error recorded for {@code key}, or {@code null}. */
    public Throwable get(String key) {
        return errors.get(key);
    }

    public boolean containsKey(String key) {
        return errors.containsKey(key);
    }

    public int size() {
        return errors.size();
    }

    private static String render(Map<String, ? extends Throwable> errors) {
        StringBuilder b = new StringBuilder();
        new TreeMap<String, Throwable>(errors)
                .forEach((k, v) -> b.append(k).append(": ").append(v.getMessage()).append('\n'));
        return b.toString();
    }
}
