package io.constraintengine.core.schema;

import static io.constraintengine.core.testkit.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaDefaulter}. */
class SchemaDefaulterTest {

    private static final JsonNode SCHEMA = json("""
            {"type": "object",
             "properties": {
               "mode": {"type": "string", "default": "strict"},
               "limits": {"type": "object", "properties": {"cpu": {"type": "string", "default": "1"}}},
               "rules": {"type": "array",
                         "items": {"type": "object", "properties": {"enabled": {"type": "boolean", "default": true}}}},
               "extra": {"type": "object",
                         "additionalProperties": {"type": "object", "properties": {"n": {"default": 0}}}}}}
            """);

    private final SchemaDefaulter defaulter = new SchemaDefaulter();

    @Test
    void absentPropertiesReceiveDefaults() {
        JsonNode value = json("{\"limits\": {}}");

        defaulter.apply(SCHEMA, value);

        assertThat(value).isEqualTo(json("{\"limits\": {\"cpu\": \"1\"}, \"mode\": \"strict\"}"));
    }

    @Test
    void presentValuesAreKept() {
        JsonNode value = json("{\"mode\": \"lenient\"}");

        defaulter.apply(SCHEMA, value);

        assertThat(value.path("mode").asText()).isEqualTo("lenient");
    }

    @Test
    void objectsAreNotCreatedToHoldDefaults() {
        JsonNode value = json("{}");

        defaulter.apply(SCHEMA, value);

        assertThat(value.has("limits")).isFalse();
    }

    @Test
    void arrayItemsAndAdditionalPropertiesAreDefaulted() {
        JsonNode value = json("{\"rules\": [{}, {\"enabled\": false}], \"extra\": {\"a\": {}}}");

        defaulter.apply(SCHEMA, value);

        assertThat(value.at("/rules/0/enabled").asBoolean()).isTrue();
        assertThat(value.at("/rules/1/enabled").asBoolean()).isFalse();
        assertThat(value.at("/extra/a/n").asInt(-1)).isZero();
    }
}
