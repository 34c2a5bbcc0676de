package io.constraintengine.core.spi;

import java.util.Set;

/**
 * Observability hooks. Implementations bridge to metrics or tracing systems; the engine itself
 * depends on neither.
 *
 * <p>Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are
 * caught and logged by the engine and never affect the operation being reported.
 */
public interface TelemetryListener {

    /** Called after a template is registered or updated. */
    void onTemplateAdded(TemplateAddedEvent event);

    /** Called when a template is rejected by validation, compilation or driver resolution. */
    void onTemplateRejected(TemplateRejectedEvent event);

    /** Called after a constraint is stored (including no-op updates). */
    void onConstraintAdded(ConstraintAddedEvent event);

    /** Called after every review or audit. */
    void onQueryCompleted(QueryCompletedEvent event);

    // --- Event records ---

    /** A template was accepted by {@code driver}. */
    record TemplateAddedEvent(String template, String driver, boolean changed) {}

    /** A template was rejected. */
    record TemplateRejectedEvent(String template, String errorDetail) {}

    /** A constraint was stored. */
    record ConstraintAddedEvent(String kind, String name, boolean changed) {}

    /** A query finished. {@code kind} is {@code "review"} or {@code "audit"}. */
    record QueryCompletedEvent(String kind, Set<String> targets, int resultCount, int errorCount, long durationMs) {}
}
