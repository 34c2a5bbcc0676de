package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.constraintengine.core.error.TargetHandlerException;
import io.constraintengine.core.spi.Matcher;

/**
 * Decides whether a constraint's {@code spec.match} selects the object in an admission review.
 * Every criterion that is present must hold; an absent criterion matches everything.
 *
 * <ul>
 *   <li>{@code kinds}: any entry whose {@code apiGroups} and {@code kinds} contain the object's
 *       group and kind, or {@code *}. An empty list within an entry matches all.
 *   <li>{@code scope}: {@code *}, {@code Cluster} or {@code Namespaced}.
 *   <li>{@code namespaces}, {@code excludedNamespaces}: name globs. Cluster-scoped objects other
 *       than Namespaces are never filtered by them; a Namespace is filtered by its own name.
 *   <li>{@code labelSelector}: against the object's labels ({@code oldObject} on delete).
 *   <li>{@code namespaceSelector}: against the labels of the object's Namespace, taken from
 *       {@code _unstable.namespace}. Matching fails with an error when a namespaced object's
 *       Namespace is not available.
 *   <li>{@code name}: a name glob.
 * </ul>
 */
final class K8sMatcher implements Matcher {

    private static final String NAMESPACE_KIND = "Namespace";

    private final String constraint;
    private final JsonNode match;

    K8sMatcher(String constraint, JsonNode match) {
        this.constraint = constraint;
        this.match = match == null ? MissingNode.getInstance() : match;
    }

    @Override
    public boolean match(JsonNode review) {
        JsonNode object = reviewedObject(review);
        String group = review.path("kind").path("group").asText("");
        String kind = review.path("kind").path("kind").asText("");
        String namespace = namespaceOf(review, object);
        boolean isNamespace = group.isEmpty() && NAMESPACE_KIND.equals(kind);

        return kindMatches(group, kind)
                && scopeMatches(namespace, isNamespace)
                && namespacesMatch(object, namespace, isNamespace)
                && labelSelectorMatches(object)
                && namespaceSelectorMatches(review, object, namespace, isNamespace)
                && nameMatches(object, review);
    }

    private boolean kindMatches(String group, String kind) {
        JsonNode kinds = match.path("kinds");
        if (!kinds.isArray() || kinds.isEmpty()) {
            return true;
        }
        for (JsonNode selector : kinds) {
            if (listMatches(selector.path("apiGroups"), group) && listMatches(selector.path("kinds"), kind)) {
                return true;
            }
        }
        return false;
    }

    private static boolean listMatches(JsonNode values, String value) {
        if (!values.isArray() || values.isEmpty()) {
            return true;
        }
        for (JsonNode v : values) {
            String s = v.asText("");
            if (s.equals("*") || s.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean scopeMatches(String namespace, boolean isNamespace) {
        String scope = match.path("scope").asText("*");
        boolean namespaced = !namespace.isEmpty() && !isNamespace;
        return switch (scope) {
            case "Cluster" -> !namespaced;
            case "Namespaced" -> namespaced;
            default -> true;
        };
    }

    private boolean namespacesMatch(JsonNode object, String namespace, boolean isNamespace) {
        String effective = isNamespace ? object.path("metadata").path("name").asText("") : namespace;
        if (effective.isEmpty()) {
            return true;
        }
        JsonNode included = match.path("namespaces");
        if (included.isArray() && !anyGlobMatches(included, effective)) {
            return false;
        }
        JsonNode excluded = match.path("excludedNamespaces");
        return !excluded.isArray() || !anyGlobMatches(excluded, effective);
    }

    private boolean labelSelectorMatches(JsonNode object) {
        JsonNode selector = match.path("labelSelector");
        if (!selector.isObject()) {
            return true;
        }
        return LabelSelectors.matches(selector, object.path("metadata").path("labels"));
    }

    private boolean namespaceSelectorMatches(JsonNode review, JsonNode object, String namespace, boolean isNamespace) {
        JsonNode selector = match.path("namespaceSelector");
        if (!selector.isObject()) {
            return true;
        }
        if (isNamespace) {
            return LabelSelectors.matches(selector, object.path("metadata").path("labels"));
        }
        if (namespace.isEmpty()) {
            return true;
        }
        JsonNode ns = review.path("_unstable").path("namespace");
        if (!ns.isObject()) {
            throw new TargetHandlerException(
                    "constraint " + constraint + " has a namespaceSelector but the Namespace '" + namespace
                            + "' of the reviewed object is unknown",
                    K8sValidationTarget.NAME);
        }
        return LabelSelectors.matches(selector, ns.path("metadata").path("labels"));
    }

    private boolean nameMatches(JsonNode object, JsonNode review) {
        JsonNode pattern = match.path("name");
        if (!pattern.isTextual()) {
            return true;
        }
        String name = object.path("metadata").path("name").asText(review.path("name").asText(""));
        return globMatches(pattern.asText(), name);
    }

    private static JsonNode reviewedObject(JsonNode review) {
        JsonNode object = review.path("object");
        if (object.isObject()) {
            return object;
        }
        JsonNode old = review.path("oldObject");
        return old.isObject() ? old : MissingNode.getInstance();
    }

    private static String namespaceOf(JsonNode review, JsonNode object) {
        String ns = review.path("namespace").asText("");
        return ns.isEmpty() ? object.path("metadata").path("namespace").asText("") : ns;
    }

    private static boolean anyGlobMatches(JsonNode patterns, String value) {
        for (JsonNode p : patterns) {
            if (globMatches(p.asText(""), value)) {
                return true;
            }
        }
        return false;
    }

    /** Supports a single leading or trailing {@code *}; anything else is an exact match. */
    static boolean globMatches(String pattern, String value) {
        if (pattern.endsWith("*")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        if (pattern.startsWith("*")) {
            return value.endsWith(pattern.substring(1));
        }
        return pattern.equals(value);
    }
}
