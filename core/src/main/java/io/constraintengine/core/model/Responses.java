package io.constraintengine.core.model;

import io.constraintengine.core.error.ErrorMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of a review, audit or data call: per-target responses, the targets that claimed the
 * input, driver statistics and any per-target errors.
 *
 * <p>Errors never replace results. A caller on the admission path typically fails closed when
 * {@link #hasErrors()} is {@code true}; an audit caller logs and keeps the partial results.
 */
public final class Responses {

    private final Map<String, Response> byTarget;
    private final Set<String> handled;
    private final List<StatsEntry> statsEntries;
    private final ErrorMap errors;

    private Responses(Builder b) {
        this.byTarget = Collections.unmodifiableMap(new TreeMap<>(b.byTarget));
        this.handled = Collections.unmodifiableSet(new TreeSet<>(b.handled));
        this.statsEntries = List.copyOf(b.statsEntries);
        this.errors = b.errors.isEmpty() ? null : new ErrorMap(b.errors);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Responses keyed by target name, in target name order. */
    public Map<String, Response> byTarget() {
        return byTarget;
    }

    public Optional<Response> forTarget(String target) {
        return Optional.ofNullable(byTarget.get(target));
    }

    /** Names of the targets (or resources) that handled the call. */
    public Set<String> handled() {
        return handled;
    }

    public boolean isHandled(String name) {
        return handled.contains(name);
    }

    public List<StatsEntry> statsEntries() {
        return statsEntries;
    }

    /** The aggregate of per-target errors, if any target failed. */
    public Optional<ErrorMap> errors() {
        return Optional.ofNullable(errors);
    }

    public boolean hasErrors() {
        return errors != null;
    }

    /** All results flattened in target order, each target's results in their sorted order. */
    public List<Result> results() {
        List<Result> all = new ArrayList<>();
        byTarget.values().forEach(r -> all.addAll(r.results()));
        return all;
    }

    /** Renders the trace of every target that produced one. */
    public String traceDump() {
        StringBuilder b = new StringBuilder();
        byTarget.forEach((target, response) -> {
            b.append("Target: ").append(target).append('\n');
            if (response.trace() == null) {
                b.append("Trace: TRACING DISABLED\n\n");
            } else {
                b.append("Trace:\n").append(response.trace()).append("\n\n");
            }
        });
        return b.toString();
    }

    @Override
    public String toString() {
        return "Responses[targets=" + byTarget.keySet() + ", results=" + results().size() + ", errors="
                + (errors == null ? 0 : errors.size()) + "]";
    }

    /** Accumulates responses across targets and drivers. Not thread-safe. */
    public static final class Builder {
        private final Map<String, Response> byTarget = new LinkedHashMap<>();
        private final Set<String> handled = new TreeSet<>();
        private final List<StatsEntry> statsEntries = new ArrayList<>();
        private final Map<String, Throwable> errors = new LinkedHashMap<>();

        private Builder() {}

        public Builder response(Response response) {
            byTarget.put(response.target(), response);
            return this;
        }

        public Builder handled(String name) {
            handled.add(name);
            return this;
        }

        public Builder stats(List<StatsEntry> entries) {
            statsEntries.addAll(entries);
            return this;
        }

        /** Records an error under {@code key}; a second error for the same key is suppressed onto the first. */
        public Builder error(String key, Throwable error) {
            Throwable existing = errors.putIfAbsent(key, error);
            if (existing != null && existing != error) {
                existing.addSuppressed(error);
            }
            return this;
        }

        public Responses build() {
            return new Responses(this);
        }
    }
}
