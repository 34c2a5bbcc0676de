package io.constraintengine.core.engine;

import io.constraintengine.core.error.EngineConfigurationException;
import io.constraintengine.core.error.NoDriverException;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.TemplateCode;
import io.constraintengine.core.model.TemplateTarget;
import io.constraintengine.core.spi.Driver;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drivers keyed by engine name, in priority order: a lower index wins when a template declares
 * code for several engines. Immutable once the engine is built.
 */
public final class DriverRegistry {

    private final Map<String, Driver> drivers;

    private DriverRegistry(Map<String, Driver> drivers) {
        this.drivers = Collections.unmodifiableMap(drivers);
    }

    /**
     * Creates a registry. Drivers named in {@code priority} come first, in that order; the rest
     * follow in registration order.
     *
     * @throws EngineConfigurationException if no drivers are given, two drivers share a name, or
     *     {@code priority} names an unregistered driver
     */
    public static DriverRegistry of(List<Driver> registered, List<String> priority) {
        if (registered.isEmpty()) {
            throw new EngineConfigurationException("no drivers registered");
        }
        Map<String, Driver> byName = new LinkedHashMap<>();
        for (Driver driver : registered) {
            String name = driver.name();
            if (name == null || name.isEmpty()) {
                throw new EngineConfigurationException("driver name must not be null or empty");
            }
            if (byName.putIfAbsent(name, driver) != null) {
                throw new EngineConfigurationException("duplicate driver name: '" + name + "'");
            }
        }
        Map<String, Driver> ordered = new LinkedHashMap<>();
        for (String name : priority) {
            Driver driver = byName.get(name);
            if (driver == null) {
                throw new EngineConfigurationException(
                        "driver priority names unregistered driver '" + name + "'; registered: " + byName.keySet());
            }
            ordered.put(name, driver);
        }
        byName.forEach(ordered::putIfAbsent);
        return new DriverRegistry(ordered);
    }

    /** Looks up a driver by engine name. */
    public Optional<Driver> getDriver(String name) {
        return Optional.ofNullable(drivers.get(name));
    }

    /**
     * Returns the highest-priority driver among the engines {@code template} declares code for.
     *
     * @throws NoDriverException if none of the declared engines has a driver
     */
    public Driver driverFor(ConstraintTemplate template) {
        List<String> declared = new ArrayList<>();
        for (TemplateTarget target : template.targets()) {
            for (TemplateCode code : target.code()) {
                declared.add(code.engine());
            }
        }
        for (Map.Entry<String, Driver> entry : drivers.entrySet()) {
            if (declared.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        throw new NoDriverException(
                "no driver available for template '" + template.name() + "': declared engines " + declared
                        + ", registered drivers " + drivers.keySet(),
                template.name());
    }

    /** Drivers in priority order. */
    public Collection<Driver> all() {
        return drivers.values();
    }

    /** Engine names in priority order. */
    public List<String> names() {
        return List.copyOf(drivers.keySet());
    }

    public int size() {
        return drivers.size();
    }

    public boolean hasDriver(String name) {
        return drivers.containsKey(name);
    }

    /** Returns {@code true} if any driver stores referential data. */
    public boolean anyAcceptsReferentialData() {
        return drivers.values().stream().anyMatch(Driver::acceptsReferentialData);
    }
}
