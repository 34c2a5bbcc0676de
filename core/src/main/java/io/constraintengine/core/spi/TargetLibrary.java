package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.model.Constraint;
import java.util.Map;
import java.util.Optional;

/**
 * Target-specific helpers a driver uses during audit, when it evaluates stored data rather than a
 * review supplied by the caller.
 */
public interface TargetLibrary {

    /**
     * Shapes a stored object into a review payload.
     *
     * @param key the key the object was stored under
     * @param object the stored value
     * @param inventory everything stored for the target, keyed the same way
     * @return empty if the entry is not a reviewable object
     */
    Optional<JsonNode> auditReview(String key, JsonNode object, Map<String, JsonNode> inventory);

    /**
     * Returns {@code true} if {@code constraint} applies to {@code review}.
     *
     * @throws io.constraintengine.core.error.TargetHandlerException if matching cannot be decided
     */
    boolean matches(Constraint constraint, JsonNode review);
}
