package io.constraintengine.core.model;

import java.util.List;

/**
 * Per-call options for review and audit.
 *
 * @param tracing ask drivers to return an evaluation trace
 * @param stats ask drivers to return evaluation statistics
 * @param enforcementPoints restrict evaluation to these points; empty means every point the
 *     engine serves
 */
public record QueryOptions(boolean tracing, boolean stats, List<String> enforcementPoints) {

    private static final QueryOptions DEFAULTS = new QueryOptions(false, false, List.of());

    public QueryOptions {
        enforcementPoints = enforcementPoints == null ? List.of() : List.copyOf(enforcementPoints);
    }

    public static QueryOptions defaults() {
        return DEFAULTS;
    }

    public QueryOptions withTracing(boolean tracing) {
        return new QueryOptions(tracing, stats, enforcementPoints);
    }

    public QueryOptions withStats(boolean stats) {
        return new QueryOptions(tracing, stats, enforcementPoints);
    }

    public QueryOptions withEnforcementPoints(String... points) {
        return new QueryOptions(tracing, stats, List.of(points));
    }
}
