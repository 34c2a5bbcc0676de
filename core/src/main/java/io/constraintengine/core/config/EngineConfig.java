package io.constraintengine.core.config;

import io.constraintengine.core.model.EnforcementPoints;
import java.util.List;
import java.util.Objects;

/**
 * Engine settings that can be supplied from a configuration file. Immutable; create with {@link
 * #builder()} or {@link EngineConfigLoader}.
 *
 * <table>
 *   <caption>Keys</caption>
 *   <tr><th>YAML</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>{@code drivers.priority}</td><td>{@code CONSTRAINT_ENGINE_DRIVER_PRIORITY}</td>
 *       <td>registration order</td></tr>
 *   <tr><td>{@code enforcement-points}</td><td>{@code CONSTRAINT_ENGINE_ENFORCEMENT_POINTS}</td>
 *       <td>webhook, audit, gator</td></tr>
 *   <tr><td>{@code data.ignore-no-referential-driver}</td>
 *       <td>{@code CONSTRAINT_ENGINE_IGNORE_NO_REFERENTIAL_DRIVER}</td><td>{@code false}</td></tr>
 * </table>
 */
public final class EngineConfig {

    private final List<String> driverPriority;
    private final List<String> enforcementPoints;
    private final boolean ignoreNoReferentialDriver;

    private EngineConfig(Builder b) {
        this.driverPriority = List.copyOf(b.driverPriority);
        this.enforcementPoints = List.copyOf(b.enforcementPoints);
        this.ignoreNoReferentialDriver = b.ignoreNoReferentialDriver;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /** Driver names, highest priority first. Empty means registration order. */
    public List<String> driverPriority() {
        return driverPriority;
    }

    public List<String> enforcementPoints() {
        return enforcementPoints;
    }

    public boolean ignoreNoReferentialDriver() {
        return ignoreNoReferentialDriver;
    }

    @Override
    public String toString() {
        return "EngineConfig[driverPriority=" + driverPriority + ", enforcementPoints=" + enforcementPoints
                + ", ignoreNoReferentialDriver=" + ignoreNoReferentialDriver + "]";
    }

    /** Builder for {@link EngineConfig}. */
    public static final class Builder {
        private List<String> driverPriority = List.of();
        private List<String> enforcementPoints = EnforcementPoints.DEFAULTS;
        private boolean ignoreNoReferentialDriver;

        private Builder() {}

        public Builder driverPriority(List<String> driverPriority) {
            this.driverPriority = Objects.requireNonNull(driverPriority, "driverPriority must not be null");
            return this;
        }

        public Builder enforcementPoints(List<String> enforcementPoints) {
            Objects.requireNonNull(enforcementPoints, "enforcementPoints must not be null");
            if (enforcementPoints.isEmpty()) {
                throw new IllegalArgumentException("enforcementPoints must not be empty");
            }
            this.enforcementPoints = enforcementPoints;
            return this;
        }

        public Builder ignoreNoReferentialDriver(boolean ignoreNoReferentialDriver) {
            this.ignoreNoReferentialDriver = ignoreNoReferentialDriver;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
