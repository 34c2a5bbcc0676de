package io.constraintengine.core.model;

import java.util.Map;

/**
 * Driver statistics for one evaluated unit.
 *
 * @param scope what the stats describe, e.g. {@code "template"} or {@code "constraint"}
 * @param statsFor identifier within the scope
 * @param stats named measurements
 */
public record StatsEntry(String scope, String statsFor, Map<String, Object> stats) {

    public StatsEntry {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }
}
