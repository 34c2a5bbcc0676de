package io.constraintengine.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.constraintengine.core.error.ConstraintSchemaException;
import io.constraintengine.core.error.InvalidConstraintException;
import io.constraintengine.core.error.InvalidConstraintTemplateException;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.ConstraintsApi;
import io.constraintengine.core.spi.TargetHandler;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Validates generated schemas and the constraints checked against them. Stateless and
 * thread-safe.
 */
public final class SchemaValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Set<String> VALID_TYPES =
            Set.of("object", "array", "string", "number", "integer", "boolean", "null");

    /** DNS-1035 label, applied to the lowercased kind. */
    private static final Pattern KIND_PATTERN = Pattern.compile("[a-z]([-a-z0-9]*[a-z0-9])?");

    private static final Pattern DNS_1123_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");

    private static final int MAX_KIND_LENGTH = 63;
    private static final int MAX_NAME_LENGTH = 253;

    private final SchemaGenerator generator;

    public SchemaValidator() {
        this(new SchemaGenerator());
    }

    public SchemaValidator(SchemaGenerator generator) {
        this.generator = generator;
    }

    /**
     * Generates the schema for {@code template}, checks that it is structurally sound and compiles
     * it.
     *
     * @throws InvalidConstraintTemplateException if the kind or the parameters schema is invalid
     */
    public GeneratedSchema createSchema(ConstraintTemplate template, TargetHandler target) {
        String kind = template.kind();
        if (kind == null
                || kind.isEmpty()
                || kind.length() > MAX_KIND_LENGTH
                || !KIND_PATTERN.matcher(kind.toLowerCase(Locale.ROOT)).matches()) {
            throw new InvalidConstraintTemplateException(
                    "invalid kind '" + kind + "': must be a DNS-1035 label when lowercased", template.name());
        }
        if (template.hasParametersSchema()) {
            checkStructure(template.parametersSchema(), "parameters", template.name());
        }
        ObjectNode source = generator.generate(template, target);
        try {
            JsonSchema compiled = SCHEMA_FACTORY.getSchema(source);
            // Validating a value forces every keyword validator to be built.
            compiled.validate(source.objectNode());
            return new GeneratedSchema(kind, source, compiled);
        } catch (RuntimeException e) {
            throw new InvalidConstraintTemplateException(
                    "invalid parameters schema: " + e.getMessage(), e, template.name());
        }
    }

    /**
     * Validates a constraint's name, kind, group and version, then its content against {@code
     * schema}. The schema check runs last.
     *
     * @throws InvalidConstraintException for metadata errors
     * @throws ConstraintSchemaException if the content does not conform to the schema
     */
    public void validateConstraint(Constraint constraint, GeneratedSchema schema) {
        String name = constraint.name();
        if (!isDns1123Subdomain(name)) {
            throw new InvalidConstraintException("invalid name: '" + name + "' is not a DNS-1123 subdomain", name);
        }
        if (!constraint.kind().equals(schema.kind())) {
            throw new InvalidConstraintException(
                    "wrong kind '" + constraint.kind() + "' for constraint '" + name + "'; want '" + schema.kind() + "'",
                    name);
        }
        if (!ConstraintsApi.GROUP.equals(constraint.group())) {
            throw new InvalidConstraintException(
                    "unsupported group '" + constraint.group() + "' for constraint '" + name + "'; allowed group: '"
                            + ConstraintsApi.GROUP + "'",
                    name);
        }
        if (!ConstraintsApi.SUPPORTED_VERSIONS.contains(constraint.version())) {
            throw new InvalidConstraintException(
                    "unsupported version '" + constraint.version() + "' for constraint '" + name
                            + "'; supported versions: " + new TreeSet<>(ConstraintsApi.SUPPORTED_VERSIONS),
                    name);
        }
        Set<ValidationMessage> errors = schema.compiled().validate(constraint.toJson());
        if (!errors.isEmpty()) {
            List<String> violations = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .toList();
            throw new ConstraintSchemaException(
                    "constraint '" + name + "' does not match the schema of " + schema.kind() + ": "
                            + String.join("; ", violations),
                    name,
                    violations);
        }
    }

    static boolean isDns1123Subdomain(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            return false;
        }
        for (String label : name.split("\\.", -1)) {
            if (!DNS_1123_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }

    private static void checkStructure(JsonNode schema, String path, String template) {
        if (!schema.isObject()) {
            throw invalid(path, "must be an object", template);
        }
        JsonNode type = schema.get("type");
        if (type != null) {
            if (type.isTextual()) {
                checkType(type.asText(), path, template);
            } else if (type.isArray()) {
                type.forEach(t -> checkType(t.asText(), path, template));
            } else {
                throw invalid(path, "'type' must be a string or a list of strings", template);
            }
        }
        JsonNode properties = schema.get("properties");
        if (properties != null) {
            if (!properties.isObject()) {
                throw invalid(path, "'properties' must be an object", template);
            }
            for (Map.Entry<String, JsonNode> field : properties.properties()) {
                checkStructure(field.getValue(), path + "." + field.getKey(), template);
            }
        }
        JsonNode items = schema.get("items");
        if (items != null) {
            if (!items.isObject()) {
                throw invalid(path, "'items' must be a single schema object", template);
            }
            checkStructure(items, path + "[]", template);
        }
        JsonNode additional = schema.get("additionalProperties");
        if (additional != null && additional.isObject()) {
            checkStructure(additional, path + ".*", template);
        }
        JsonNode required = schema.get("required");
        if (required != null && (!required.isArray() || !allTextual(required))) {
            throw invalid(path, "'required' must be a list of strings", template);
        }
    }

    private static void checkType(String type, String path, String template) {
        if (!VALID_TYPES.contains(type)) {
            throw invalid(
                    path,
                    "unknown type '" + type + "', expected one of: object, array, string, number, integer, boolean, null",
                    template);
        }
    }

    private static boolean allTextual(JsonNode array) {
        for (JsonNode n : array) {
            if (!n.isTextual()) {
                return false;
            }
        }
        return true;
    }

    private static InvalidConstraintTemplateException invalid(String path, String message, String template) {
        return new InvalidConstraintTemplateException("invalid schema at '" + path + "': " + message, template);
    }
}
