package io.constraintengine.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * An admission request together with the Namespace object of the namespace it targets. The
 * namespace is exposed to policies as {@code _unstable.namespace} and used for {@code
 * namespaceSelector} matching.
 *
 * @param request the admission request JSON
 * @param namespace the namespace object, or {@code null} if unknown or cluster-scoped
 */
public record AugmentedReview(JsonNode request, JsonNode namespace) {

    public AugmentedReview {
        Objects.requireNonNull(request, "request must not be null");
    }
}
