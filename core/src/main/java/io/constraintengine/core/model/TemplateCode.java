package io.constraintengine.core.model;

import java.util.Objects;

/**
 * One engine-specific implementation of a template: the engine name that selects a driver, and
 * the source that driver compiles.
 *
 * @param engine engine name, e.g. {@code "jslt"}
 * @param source policy source code for that engine
 */
public record TemplateCode(String engine, String source) {

    public TemplateCode {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
