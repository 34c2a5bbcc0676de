package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A Kubernetes object together with the Namespace object it lives in.
 *
 * @param object the object JSON ({@code apiVersion}, {@code kind}, {@code metadata}, ...)
 * @param namespace the namespace object, or {@code null} if unknown or cluster-scoped
 */
public record AugmentedObject(JsonNode object, JsonNode namespace) {

    public AugmentedObject {
        Objects.requireNonNull(object, "object must not be null");
    }
}
