package io.constraintengine.core.spi;

import io.constraintengine.core.model.Result;
import io.constraintengine.core.model.StatsEntry;
import java.util.List;

/**
 * What a driver returns from a query or audit.
 *
 * @param results violations, in any order
 * @param stats evaluation statistics; empty unless requested
 * @param trace evaluation trace, or {@code null} unless requested
 */
public record QueryResponse(List<Result> results, List<StatsEntry> stats, String trace) {

    public QueryResponse {
        results = results == null ? List.of() : List.copyOf(results);
        stats = stats == null ? List.of() : List.copyOf(stats);
    }

    public static QueryResponse empty() {
        return new QueryResponse(List.of(), List.of(), null);
    }
}
