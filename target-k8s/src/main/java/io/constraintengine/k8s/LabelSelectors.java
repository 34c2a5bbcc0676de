package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validation and evaluation of Kubernetes label selectors ({@code matchLabels} and {@code
 * matchExpressions}), held as JSON.
 */
final class LabelSelectors {

    private static final Pattern NAME_PART = Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");
    private static final Pattern DNS_1123_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_PREFIX_LENGTH = 253;

    private LabelSelectors() {}

    /**
     * Returns the problems found in {@code selector}; empty if it is valid. {@code path} prefixes
     * each message.
     */
    static List<String> validate(JsonNode selector, String path) {
        List<String> errors = new ArrayList<>();
        if (selector == null || selector.isMissingNode() || selector.isNull()) {
            return errors;
        }
        if (!selector.isObject()) {
            errors.add(path + ": must be an object");
            return errors;
        }
        JsonNode matchLabels = selector.path("matchLabels");
        if (matchLabels.isObject()) {
            for (Map.Entry<String, JsonNode> label : matchLabels.properties()) {
                validateKey(label.getKey(), path + ".matchLabels", errors);
                String value = label.getValue().asText("");
                if (!isValidLabelValue(value)) {
                    errors.add(path + ".matchLabels: invalid label value '" + value + "' for key '" + label.getKey() + "'");
                }
            }
        }
        JsonNode expressions = selector.path("matchExpressions");
        int i = 0;
        for (JsonNode expression : expressions) {
            String exprPath = path + ".matchExpressions[" + i++ + "]";
            validateKey(expression.path("key").asText(""), exprPath + ".key", errors);
            String operator = expression.path("operator").asText("");
            int values = expression.path("values").size();
            switch (operator) {
                case "In", "NotIn" -> {
                    if (values == 0) {
                        errors.add(exprPath + ".values: must be specified when `operator` is 'In' or 'NotIn'");
                    }
                }
                case "Exists", "DoesNotExist" -> {
                    if (values > 0) {
                        errors.add(exprPath + ".values: may not be specified when `operator` is 'Exists' or 'DoesNotExist'");
                    }
                }
                default -> errors.add(exprPath + ".operator: not a valid selector operator: '" + operator + "'");
            }
        }
        return errors;
    }

    /** Returns {@code true} if {@code labels} satisfy every requirement in {@code selector}. */
    static boolean matches(JsonNode selector, JsonNode labels) {
        JsonNode matchLabels = selector.path("matchLabels");
        for (Map.Entry<String, JsonNode> required : matchLabels.properties()) {
            JsonNode actual = labels.path(required.getKey());
            if (!actual.isTextual() || !actual.asText().equals(required.getValue().asText())) {
                return false;
            }
        }
        for (JsonNode expression : selector.path("matchExpressions")) {
            String key = expression.path("key").asText();
            JsonNode actual = labels.path(key);
            boolean present = actual.isTextual();
            boolean inValues = present && contains(expression.path("values"), actual.asText());
            boolean satisfied = switch (expression.path("operator").asText()) {
                case "In" -> inValues;
                case "NotIn" -> !inValues;
                case "Exists" -> present;
                case "DoesNotExist" -> !present;
                default -> false;
            };
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    private static boolean contains(JsonNode values, String value) {
        for (JsonNode v : values) {
            if (v.asText().equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static void validateKey(String key, String path, List<String> errors) {
        String name = key;
        int slash = key.indexOf('/');
        if (slash >= 0) {
            String prefix = key.substring(0, slash);
            name = key.substring(slash + 1);
            if (prefix.isEmpty() || prefix.length() > MAX_PREFIX_LENGTH || !isDnsSubdomain(prefix)) {
                errors.add(path + ": invalid label key prefix in '" + key + "'");
                return;
            }
        }
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || !NAME_PART.matcher(name).matches()) {
            errors.add(path + ": invalid label key '" + key + "'");
        }
    }

    private static boolean isValidLabelValue(String value) {
        return value.isEmpty() || (value.length() <= MAX_NAME_LENGTH && NAME_PART.matcher(value).matches());
    }

    private static boolean isDnsSubdomain(String value) {
        for (String label : value.split("\\.", -1)) {
            if (!DNS_1123_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }
}
