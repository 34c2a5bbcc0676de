package io.constraintengine.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The target a template is written for, together with its code for one or more engines.
 *
 * @param target target handler name, e.g. {@code "admission.k8s.gatekeeper.sh"}
 * @param code   engine-specific sources, in declaration order
 */
public record TemplateTarget(String target, List<TemplateCode> code) {

    public TemplateTarget {
        Objects.requireNonNull(target, "target must not be null");
        code = code == null ? List.of() : List.copyOf(code);
    }

    /** Returns the source declared for {@code engine}, if any. */
    public Optional<TemplateCode> codeFor(String engine) {
        return code.stream().filter(c -> c.engine().equals(engine)).findFirst();
    }
}
