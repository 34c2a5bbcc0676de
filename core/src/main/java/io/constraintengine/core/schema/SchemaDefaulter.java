package io.constraintengine.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Applies {@code default} keywords from a schema to a JSON value, the way the Kubernetes API
 * server defaults custom resources: a property's default is set only when the property is absent
 * from an object that exists. Objects are never created to hold a default.
 */
public final class SchemaDefaulter {

    /** Fills defaults into {@code value} in place. */
    public void apply(JsonNode schema, JsonNode value) {
        if (schema == null || !schema.isObject() || value == null) {
            return;
        }
        if (value.isObject()) {
            ObjectNode object = (ObjectNode) value;
            JsonNode properties = schema.get("properties");
            if (properties != null && properties.isObject()) {
                for (Map.Entry<String, JsonNode> property : properties.properties()) {
                    String name = property.getKey();
                    JsonNode propertySchema = property.getValue();
                    if (!object.has(name) && propertySchema.has("default")) {
                        object.set(name, propertySchema.get("default").deepCopy());
                    }
                    apply(propertySchema, object.get(name));
                }
            }
            JsonNode additional = schema.get("additionalProperties");
            if (additional != null && additional.isObject()) {
                object.properties().forEach(e -> {
                    if (properties == null || !properties.has(e.getKey())) {
                        apply(additional, e.getValue());
                    }
                });
            }
        } else if (value.isArray()) {
            JsonNode items = schema.get("items");
            if (items != null && items.isObject()) {
                value.forEach(element -> apply(items, element));
            }
        }
    }
}
