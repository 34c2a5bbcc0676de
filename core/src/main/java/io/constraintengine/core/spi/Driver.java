package io.constraintengine.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.QueryOptions;
import java.util.List;

/**
 * Pluggable policy evaluation backend for one engine language. The engine selects a driver per
 * template from the engines the template declares code for, in configured priority order.
 *
 * <p>Implementations MUST be thread-safe: reviews and audits call {@link #query} and {@link
 * #audit} concurrently. Structural calls ({@code add*}/{@code remove*} for templates and
 * constraints) are serialized by the engine. Failures are reported by throwing; the engine wraps
 * them per target and never retries.
 */
public interface Driver {

    /**
     * Returns the engine name this driver executes, e.g. {@code "jslt"}. Matched against {@link
     * io.constraintengine.core.model.TemplateCode#engine()}.
     */
    String name();

    /**
     * Compiles and stores the template's code for this engine. Called again with the new
     * definition when a template is updated.
     *
     * @throws io.constraintengine.core.error.InvalidConstraintTemplateException if the code does
     *     not compile
     */
    void addTemplate(ConstraintTemplate template);

    /** Drops the template's compiled code. Removing an unknown template is a no-op. */
    void removeTemplate(ConstraintTemplate template);

    /** Stores or replaces a constraint. Its template has already been added. */
    void addConstraint(Constraint constraint);

    /** Removes a constraint. Removing an unknown constraint is a no-op. */
    void removeConstraint(Constraint constraint);

    /**
     * Stores referential data under {@code key} for {@code target}. Keys are {@code /}-separated
     * paths chosen by the target handler.
     */
    void addData(String target, String key, JsonNode data);

    /**
     * Removes the data stored under {@code key} and every key below it. An empty key removes all
     * of the target's data.
     */
    void removeData(String target, String key);

    /**
     * Evaluates {@code constraints} against a single review payload.
     *
     * @param target the target that produced {@code review}
     * @param constraints constraints that matched the review, all served by this driver
     * @param review the review payload shaped by the target handler
     * @param options tracing and stats flags
     * @return violations, stats and optional trace
     */
    QueryResponse query(String target, List<Constraint> constraints, JsonNode review, QueryOptions options);

    /**
     * Evaluates {@code constraints} against every object previously stored for {@code target}
     * via {@link #addData}. Shaping and matching of stored objects use the target's {@link
     * TargetLibrary}.
     */
    QueryResponse audit(String target, List<Constraint> constraints, QueryOptions options);

    /** Returns a human-readable dump of the driver's state, for debugging. */
    String dump();

    /** Returns {@code true} if this driver stores data passed to {@link #addData}. */
    default boolean acceptsReferentialData() {
        return false;
    }

    /** Receives a target's library once, when the engine is built. */
    default void addLibrary(String target, TargetLibrary library) {}
}
