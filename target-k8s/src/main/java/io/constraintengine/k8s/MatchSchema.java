package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** JSON schema of {@code spec.match} for Kubernetes admission constraints. */
final class MatchSchema {

    /**
     * A namespace or object name, optionally with a prefix ({@code kube-*}) or suffix ({@code
     * *-system}) wildcard, but not both.
     */
    static final String WILDCARD_NAME_PATTERN = "^(\\*|\\*-)?[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\*|-\\*)?$";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private MatchSchema() {}

    static ObjectNode build() {
        ObjectNode root = typed("object");
        ObjectNode props = root.putObject("properties");

        ObjectNode kindSelector = typed("object");
        ObjectNode kindProps = kindSelector.putObject("properties");
        kindProps.set("apiGroups", stringList(null));
        kindProps.set("kinds", stringList(null));
        ObjectNode kinds = typed("array");
        kinds.set("items", kindSelector);
        props.set("kinds", kinds);

        props.set("namespaces", stringList(WILDCARD_NAME_PATTERN));
        props.set("excludedNamespaces", stringList(WILDCARD_NAME_PATTERN));
        props.set("labelSelector", labelSelector());
        props.set("namespaceSelector", labelSelector());

        ObjectNode scope = typed("string");
        ArrayNode scopes = scope.putArray("enum");
        scopes.add("*").add("Cluster").add("Namespaced");
        props.set("scope", scope);

        ObjectNode name = typed("string");
        name.put("pattern", WILDCARD_NAME_PATTERN);
        props.set("name", name);
        return root;
    }

    private static ObjectNode labelSelector() {
        ObjectNode selector = typed("object");
        ObjectNode props = selector.putObject("properties");

        ObjectNode matchLabels = typed("object");
        matchLabels.set("additionalProperties", typed("string"));
        props.set("matchLabels", matchLabels);

        ObjectNode expression = typed("object");
        ObjectNode exprProps = expression.putObject("properties");
        exprProps.set("key", typed("string"));
        ObjectNode operator = typed("string");
        operator.putArray("enum").add("In").add("NotIn").add("Exists").add("DoesNotExist");
        exprProps.set("operator", operator);
        exprProps.set("values", stringList(null));
        ObjectNode expressions = typed("array");
        expressions.set("items", expression);
        props.set("matchExpressions", expressions);
        return selector;
    }

    private static ObjectNode stringList(String pattern) {
        ObjectNode item = typed("string");
        if (pattern != null) {
            item.put("pattern", pattern);
        }
        ObjectNode list = typed("array");
        list.set("items", item);
        return list;
    }

    private static ObjectNode typed(String type) {
        ObjectNode node = NODES.objectNode();
        node.put("type", type);
        return node;
    }
}
