package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.error.InvalidConstraintException;
import io.constraintengine.core.error.TargetHandlerException;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.Result;
import io.constraintengine.core.spi.Matcher;
import io.constraintengine.core.spi.ProcessedData;
import io.constraintengine.core.spi.TargetHandler;
import io.constraintengine.core.spi.TargetLibrary;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Target for Kubernetes admission control.
 *
 * <p>Reviews are admission requests ({@code kind}, {@code name}, {@code namespace}, {@code
 * operation}, {@code object}, {@code oldObject}). Accepted inputs:
 *
 * <ul>
 *   <li>admission request JSON, used as is;
 *   <li>object JSON with {@code apiVersion} and {@code kind}, wrapped into a {@code CREATE}
 *       request;
 *   <li>{@link AugmentedReview} and {@link AugmentedObject}, which also carry the object's
 *       Namespace under {@code _unstable.namespace}.
 * </ul>
 *
 * <p>Referential data is stored under {@code cluster/<groupVersion>/<Kind>/<name>} for
 * cluster-scoped objects and {@code namespace/<namespace>/<groupVersion>/<Kind>/<name>} for
 * namespaced ones, with the {@code /} of the group version escaped as {@code %2F}. {@link
 * WipeData} maps to the empty key.
 */
public final class K8sValidationTarget implements TargetHandler {

    /** Target name templates declare. */
    public static final String NAME = "admission.k8s.gatekeeper.sh";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final K8sTargetLibrary library = new K8sTargetLibrary();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode matchSchema() {
        return MatchSchema.build();
    }

    @Override
    public TargetLibrary library() {
        return library;
    }

    @Override
    public Optional<ProcessedData> processData(Object data) {
        if (data instanceof WipeData) {
            return Optional.of(new ProcessedData("", null));
        }
        if (data instanceof JsonNode node && node.isObject()) {
            return Optional.of(new ProcessedData(dataKey(node), node));
        }
        return Optional.empty();
    }

    @Override
    public Optional<JsonNode> handleReview(Object object) {
        if (object instanceof AugmentedReview augmented) {
            ObjectNode review = requireObject(augmented.request(), "admission request").deepCopy();
            if (augmented.namespace() != null) {
                review.putObject("_unstable").set("namespace", augmented.namespace().deepCopy());
            }
            return Optional.of(review);
        }
        if (object instanceof AugmentedObject augmented) {
            return Optional.of(toAdmissionRequest(requireObject(augmented.object(), "object"), augmented.namespace()));
        }
        if (object instanceof JsonNode node && node.isObject()) {
            if (isAdmissionRequest(node)) {
                return Optional.of(node.deepCopy());
            }
            if (node.path("apiVersion").isTextual() && node.path("kind").isTextual()) {
                return Optional.of(toAdmissionRequest(node, null));
            }
        }
        return Optional.empty();
    }

    /**
     * Attaches the reviewed object (or {@code oldObject}, for deletes) with its {@code apiVersion}
     * and {@code kind} as the result's resource.
     *
     * @throws TargetHandlerException if the review lacks kind information or an object
     */
    @Override
    public Result handleViolation(Result result) {
        JsonNode review = result.review();
        if (review == null || !review.isObject()) {
            throw new TargetHandlerException("result has no review to attach a resource from", NAME);
        }
        String group = kindField(review, "group");
        String version = kindField(review, "version");
        String kind = kindField(review, "kind");

        JsonNode object = review.get("object");
        if (object == null || !object.isObject()) {
            object = review.get("oldObject");
        }
        if (object == null || !object.isObject()) {
            throw new TargetHandlerException("no object or oldObject returned in review", NAME);
        }
        ObjectNode resource = object.deepCopy();
        resource.put("apiVersion", group.isEmpty() ? version : group + "/" + version);
        resource.put("kind", kind);
        return result.withResource(resource);
    }

    /**
     * Validates the label selectors in {@code spec.match}.
     *
     * @throws InvalidConstraintException if a selector is invalid
     */
    @Override
    public void validateConstraint(Constraint constraint) {
        JsonNode match = constraint.match();
        List<String> errors = new ArrayList<>();
        errors.addAll(LabelSelectors.validate(match.path("labelSelector"), "spec.match.labelSelector"));
        errors.addAll(LabelSelectors.validate(match.path("namespaceSelector"), "spec.match.namespaceSelector"));
        if (!errors.isEmpty()) {
            throw new InvalidConstraintException(
                    "invalid match for constraint " + constraint.key() + ": " + String.join("; ", errors),
                    constraint.name());
        }
    }

    @Override
    public Matcher toMatcher(Constraint constraint) {
        return new K8sMatcher(constraint.key().toString(), constraint.match());
    }

    /**
     * Wraps an object into a {@code CREATE} admission request.
     *
     * @param namespace the object's Namespace, or {@code null}
     */
    static ObjectNode toAdmissionRequest(JsonNode object, JsonNode namespace) {
        String apiVersion = object.path("apiVersion").asText("");
        int slash = apiVersion.indexOf('/');
        ObjectNode request = NODES.objectNode();
        ObjectNode kind = request.putObject("kind");
        kind.put("group", slash < 0 ? "" : apiVersion.substring(0, slash));
        kind.put("version", slash < 0 ? apiVersion : apiVersion.substring(slash + 1));
        kind.put("kind", object.path("kind").asText(""));
        request.put("name", object.path("metadata").path("name").asText(""));
        String ns = object.path("metadata").path("namespace").asText("");
        if (namespace != null && namespace.isObject()) {
            ns = namespace.path("metadata").path("name").asText(ns);
        }
        request.put("namespace", ns);
        request.put("operation", "CREATE");
        request.set("object", object.deepCopy());
        if (namespace != null && namespace.isObject()) {
            request.putObject("_unstable").set("namespace", namespace.deepCopy());
        }
        return request;
    }

    /**
     * Storage key of a Kubernetes object.
     *
     * @throws TargetHandlerException if the object has no version or kind
     */
    static String dataKey(JsonNode object) {
        String name = object.path("metadata").path("name").asText("");
        String apiVersion = object.path("apiVersion").asText("");
        int slash = apiVersion.indexOf('/');
        String version = slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
        if (version.isEmpty()) {
            throw new TargetHandlerException("resource " + name + " has no version", NAME);
        }
        String kind = object.path("kind").asText("");
        if (kind.isEmpty()) {
            throw new TargetHandlerException("resource " + name + " has no kind", NAME);
        }
        String gv = apiVersion.replace("/", "%2F");
        String namespace = object.path("metadata").path("namespace").asText("");
        if (namespace.isEmpty()) {
            return String.join("/", "cluster", gv, kind, name);
        }
        return String.join("/", "namespace", namespace, gv, kind, name);
    }

    private static boolean isAdmissionRequest(JsonNode node) {
        return node.path("kind").isObject() && (node.has("object") || node.has("oldObject"));
    }

    private static JsonNode requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new TargetHandlerException(what + " must be a JSON object", NAME);
        }
        return node;
    }

    private static String kindField(JsonNode review, String field) {
        JsonNode value = review.path("kind").path(field);
        if (!value.isTextual()) {
            throw new TargetHandlerException("review[kind][" + field + "] does not exist or is not a string", NAME);
        }
        return value.asText();
    }
}
