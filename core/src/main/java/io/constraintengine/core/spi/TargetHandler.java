package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.Result;
import java.util.Optional;

/**
 * Adapter for one target domain. Shapes inputs into review payloads, derives data keys, validates
 * the domain-specific part of constraints and decides which constraints apply to a review.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface TargetHandler {

    /** Target name, e.g. {@code "admission.k8s.gatekeeper.sh"}. Must match {@code [a-zA-Z][a-zA-Z0-9.]*}. */
    String name();

    /** JSON schema of {@code spec.match} for constraints on this target. */
    ObjectNode matchSchema();

    /** Helpers drivers use to evaluate this target's stored data during audit. */
    TargetLibrary library();

    /**
     * Converts {@code data} into a storage key and value.
     *
     * @return empty if this target does not handle {@code data}
     * @throws io.constraintengine.core.error.TargetHandlerException if the target claims the data
     *     but cannot derive a key
     */
    Optional<ProcessedData> processData(Object data);

    /**
     * Shapes {@code object} into a review payload.
     *
     * @return empty if this target does not handle {@code object}
     * @throws io.constraintengine.core.error.TargetHandlerException if the target claims the
     *     object but it is malformed
     */
    Optional<JsonNode> handleReview(Object object);

    /** Enriches a driver result, typically attaching the offending resource. */
    Result handleViolation(Result result);

    /**
     * Checks the target-specific semantics of a constraint that has already passed schema
     * validation.
     *
     * @throws io.constraintengine.core.error.InvalidConstraintException if invalid
     */
    void validateConstraint(Constraint constraint);

    /** Builds the matcher that decides whether {@code constraint} applies to a review payload. */
    Matcher toMatcher(Constraint constraint);
}
