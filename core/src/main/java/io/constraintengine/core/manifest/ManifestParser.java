package io.constraintengine.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.constraintengine.core.error.InvalidConstraintException;
import io.constraintengine.core.error.InvalidConstraintTemplateException;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.TemplateCode;
import io.constraintengine.core.model.TemplateTarget;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads constraint templates and constraints from the Kubernetes resource form they are authored
 * in (YAML or JSON).
 *
 * <pre>
 * metadata:
 *   name: k8srequiredlabels
 * spec:
 *   crd:
 *     spec:
 *       names:
 *         kind: K8sRequiredLabels
 *       validation:
 *         openAPIV3Schema: {...}
 *   targets:
 *     - target: admission.k8s.gatekeeper.sh
 *       code:
 *         - engine: jslt
 *           source: ...
 * </pre>
 *
 * <p>Only the structure is checked here; naming rules and schema validity are enforced when the
 * template is added to an engine.
 */
public final class ManifestParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Parses a template from a YAML or JSON file.
     *
     * @throws InvalidConstraintTemplateException if the file cannot be read or is malformed
     */
    public ConstraintTemplate parseTemplate(Path path) {
        try {
            return parseTemplate(Files.readString(path));
        } catch (IOException e) {
            throw new InvalidConstraintTemplateException(
                    "Failed to read template file: " + path + ": " + e.getMessage(), e, null);
        }
    }

    /**
     * Parses a template from YAML or JSON text.
     *
     * @throws InvalidConstraintTemplateException if the text is malformed
     */
    public ConstraintTemplate parseTemplate(String yaml) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new InvalidConstraintTemplateException("Failed to parse template YAML: " + e.getOriginalMessage(), e, null);
        }
        return templateFromJson(root);
    }

    /**
     * Converts an already-parsed template resource.
     *
     * @throws InvalidConstraintTemplateException if required fields are missing or mistyped
     */
    public ConstraintTemplate templateFromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidConstraintTemplateException("template must be a mapping", null);
        }
        String name = requireString(root.path("metadata"), "name", "metadata", null);
        JsonNode crdSpec = root.path("spec").path("crd").path("spec");
        String kind = requireString(crdSpec.path("names"), "kind", "spec.crd.spec.names", name);
        JsonNode schema = crdSpec.path("validation").path("openAPIV3Schema");

        JsonNode targetsNode = root.path("spec").path("targets");
        if (!targetsNode.isArray()) {
            throw new InvalidConstraintTemplateException("field 'spec.targets' must be a list", name);
        }
        List<TemplateTarget> targets = new ArrayList<>();
        for (JsonNode targetNode : targetsNode) {
            String target = requireString(targetNode, "target", "spec.targets[]", name);
            List<TemplateCode> code = new ArrayList<>();
            JsonNode codeNode = targetNode.path("code");
            if (!codeNode.isMissingNode() && !codeNode.isArray()) {
                throw new InvalidConstraintTemplateException("field 'spec.targets[].code' must be a list", name);
            }
            for (JsonNode c : codeNode) {
                code.add(new TemplateCode(
                        requireString(c, "engine", "spec.targets[].code[]", name),
                        requireString(c, "source", "spec.targets[].code[]", name)));
            }
            targets.add(new TemplateTarget(target, code));
        }
        return new ConstraintTemplate(name, kind, schema.isMissingNode() ? null : schema.deepCopy(), targets);
    }

    /**
     * Parses a constraint from a YAML or JSON file.
     *
     * @throws InvalidConstraintException if the file cannot be read or is not a mapping
     */
    public Constraint parseConstraint(Path path) {
        try {
            return parseConstraint(Files.readString(path));
        } catch (IOException e) {
            throw new InvalidConstraintException("Failed to read constraint file: " + path + ": " + e.getMessage(), e, null);
        }
    }

    /**
     * Parses a constraint from YAML or JSON text.
     *
     * @throws InvalidConstraintException if the text is malformed or not a mapping
     */
    public Constraint parseConstraint(String yaml) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new InvalidConstraintException("Failed to parse constraint YAML: " + e.getOriginalMessage(), e, null);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConstraintException("constraint must be a mapping", null);
        }
        return Constraint.of(root);
    }

    /** Parses arbitrary YAML or JSON, e.g. an object to review. */
    public JsonNode parseObject(String yaml) {
        try {
            return YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse YAML: " + e.getOriginalMessage(), e);
        }
    }

    private static String requireString(JsonNode node, String field, String block, String template) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            throw new InvalidConstraintTemplateException(
                    "Missing or invalid '" + field + "' in '" + block + "'", template);
        }
        return value.asText();
    }
}
