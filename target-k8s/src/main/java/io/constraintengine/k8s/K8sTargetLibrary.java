package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.spi.TargetLibrary;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit helpers for the Kubernetes target: turns stored objects back into admission requests,
 * resolving each namespaced object's Namespace from the stored data, and applies the same
 * matching as reviews.
 */
final class K8sTargetLibrary implements TargetLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(K8sTargetLibrary.class);

    private static final String NAMESPACE_KEY_PREFIX = "cluster/v1/Namespace/";

    @Override
    public Optional<JsonNode> auditReview(String key, JsonNode object, Map<String, JsonNode> inventory) {
        if (object == null || !object.isObject()) {
            return Optional.empty();
        }
        if (key.startsWith("cluster/")) {
            return Optional.of(K8sValidationTarget.toAdmissionRequest(object, null));
        }
        if (key.startsWith("namespace/")) {
            String[] segments = key.split("/");
            JsonNode namespace = segments.length > 1 ? inventory.get(NAMESPACE_KEY_PREFIX + segments[1]) : null;
            if (namespace == null) {
                LOG.debug("Namespace not in inventory: key={}, namespace={}", key, segments.length > 1 ? segments[1] : "");
            }
            return Optional.of(K8sValidationTarget.toAdmissionRequest(object, namespace));
        }
        LOG.debug("Skipping stored entry with unrecognized key: key={}", key);
        return Optional.empty();
    }

    @Override
    public boolean matches(Constraint constraint, JsonNode review) {
        return new K8sMatcher(constraint.key().toString(), constraint.match()).match(review);
    }
}
