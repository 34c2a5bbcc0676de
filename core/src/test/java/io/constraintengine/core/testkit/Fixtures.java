package io.constraintengine.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.TemplateCode;
import io.constraintengine.core.model.TemplateTarget;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Shared builders for templates, constraints and JSON used across engine tests. */
public final class Fixtures {

    public static final ObjectMapper JSON = new ObjectMapper();

    /** Parameters schema accepted by {@link RecordingDriver} templates. */
    public static final String PARAMETERS_SCHEMA = """
            {"type": "object",
             "properties": {
               "violate": {"type": "boolean"},
               "msg": {"type": "string"},
               "level": {"type": "string", "default": "low"}}}
            """;

    private Fixtures() {}

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode object(String text) {
        return (ObjectNode) json(text);
    }

    /** Template named after {@code kind} with the standard parameters schema and code for each engine. */
    public static ConstraintTemplate template(String kind, String target, String... engines) {
        List<TemplateCode> code = Arrays.stream(engines)
                .map(e -> new TemplateCode(e, "source for " + kind))
                .toList();
        return new ConstraintTemplate(
                kind.toLowerCase(Locale.ROOT), kind, json(PARAMETERS_SCHEMA), List.of(new TemplateTarget(target, code)));
    }

    /** Constraint of {@code kind} in the constraints group with the given {@code spec} JSON. */
    public static Constraint constraint(String kind, String name, String spec) {
        return Constraint.of(json("""
                {"apiVersion": "constraints.gatekeeper.sh/v1beta1",
                 "kind": "%s",
                 "metadata": {"name": "%s"},
                 "spec": %s}
                """.formatted(kind, name, spec)));
    }

    /** Constraint that the recording driver always reports with {@code msg}. */
    public static Constraint violating(String kind, String name, String msg) {
        return constraint(kind, name, "{\"parameters\": {\"violate\": true, \"msg\": \"" + msg + "\"}}");
    }
}
