package io.constraintengine.core.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;

/**
 * Schema of the constraint kind a template defines, in source and compiled form.
 *
 * @param kind the constraint kind
 * @param source the generated JSON schema; callers must not mutate it
 * @param compiled the compiled validator for {@code source}
 */
public record GeneratedSchema(String kind, ObjectNode source, JsonSchema compiled) {}
