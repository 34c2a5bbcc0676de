package io.constraintengine.core.engine;

import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.schema.GeneratedSchema;
import io.constraintengine.core.spi.TargetHandler;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry state for one template. Mutated in place on update so its constraints survive. Not
 * thread-safe; guarded by the engine lock.
 */
final class TemplateEntry {

    private ConstraintTemplate template;
    private GeneratedSchema schema;
    private TargetHandler target;
    private String driver;
    private final Map<String, ConstraintEntry> constraints = new TreeMap<>();

    /** Set when a driver change left constraints that still have to be replayed. */
    private boolean needsConstraintReplay;

    /**
     * Drivers that may hold this template. Normally one; more only while a driver migration is in
     * flight or after one was interrupted.
     */
    private final Set<String> activeDrivers = new LinkedHashSet<>();

    ConstraintTemplate template() {
        return template;
    }

    GeneratedSchema schema() {
        return schema;
    }

    TargetHandler target() {
        return target;
    }

    /** Name of the driver the current definition resolves to. */
    String driver() {
        return driver;
    }

    /** Commits a definition that every driver call has already accepted. */
    void update(ConstraintTemplate template, GeneratedSchema schema, TargetHandler target, String driver) {
        this.template = template.copy();
        this.schema = schema;
        this.target = target;
        this.driver = driver;
    }

    boolean needsConstraintReplay() {
        return needsConstraintReplay;
    }

    void needsConstraintReplay(boolean value) {
        this.needsConstraintReplay = value;
    }

    Set<String> activeDrivers() {
        return activeDrivers;
    }

    ConstraintEntry constraint(String name) {
        return constraints.get(name);
    }

    /** Constraints in name order. */
    Collection<ConstraintEntry> constraints() {
        return constraints.values();
    }

    boolean hasConstraints() {
        return !constraints.isEmpty();
    }

    void putConstraint(String name, ConstraintEntry entry) {
        constraints.put(name, entry);
    }

    void removeConstraint(String name) {
        constraints.remove(name);
    }
}
