package io.constraintengine.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.spi.TargetHandler;

/**
 * Derives the schema of a template's constraint kind. The output depends only on the template's
 * kind and parameters schema and on the target's match schema, so the same inputs always produce
 * an equal schema.
 *
 * <pre>
 * {type: object, properties: {
 *   apiVersion, kind, metadata,
 *   spec: {type: object, properties: {
 *     match: &lt;target match schema&gt;,
 *     parameters: &lt;template parameters schema&gt;,
 *     enforcementAction, scopedEnforcementActions}}}}
 * </pre>
 */
public final class SchemaGenerator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Returns the uncompiled schema for {@code template} on {@code target}. */
    public ObjectNode generate(ConstraintTemplate template, TargetHandler target) {
        ObjectNode spec = NODES.objectNode();
        spec.put("type", "object");
        ObjectNode specProps = spec.putObject("properties");
        specProps.set("match", target.matchSchema().deepCopy());
        specProps.set("parameters", parametersSchema(template));
        specProps.set("enforcementAction", typed("string"));
        specProps.set("scopedEnforcementActions", scopedEnforcementActionsSchema());

        ObjectNode metadata = typed("object");
        metadata.putObject("properties").set("name", typed("string"));

        ObjectNode root = NODES.objectNode();
        root.put("type", "object");
        ObjectNode props = root.putObject("properties");
        props.set("apiVersion", typed("string"));
        props.set("kind", typed("string"));
        props.set("metadata", metadata);
        props.set("spec", spec);
        return root;
    }

    private static JsonNode parametersSchema(ConstraintTemplate template) {
        if (!template.hasParametersSchema()) {
            // Any value is accepted when the template declares no schema.
            return NODES.objectNode();
        }
        return template.parametersSchema().deepCopy();
    }

    private static ObjectNode scopedEnforcementActionsSchema() {
        ObjectNode point = typed("object");
        point.putObject("properties").set("name", typed("string"));

        ObjectNode entry = typed("object");
        ObjectNode entryProps = entry.putObject("properties");
        entryProps.set("action", typed("string"));
        ObjectNode points = typed("array");
        points.set("items", point);
        entryProps.set("enforcementPoints", points);
        ArrayNode required = entry.putArray("required");
        required.add("action");

        ObjectNode list = typed("array");
        list.set("items", entry);
        return list;
    }

    private static ObjectNode typed(String type) {
        ObjectNode node = NODES.objectNode();
        node.put("type", type);
        return node;
    }
}
