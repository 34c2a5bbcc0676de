package io.constraintengine.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * All results for one target from a single review or audit call.
 *
 * @param target target name
 * @param results results ordered by constraint kind, then constraint name, then message
 * @param trace driver trace output, or {@code null} if tracing was not requested
 */
public record Response(String target, List<Result> results, String trace) {

    private static final ConstraintKey NO_CONSTRAINT = new ConstraintKey("", "");

    private static final Comparator<Result> ORDER = Comparator.comparing(
                    (Result r) -> r.constraint() == null ? NO_CONSTRAINT : r.constraint().key())
            .thenComparing(Result::msg);

    public Response {
        Objects.requireNonNull(target, "target must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    /** Creates a response whose results are sorted into their canonical order. The sort is stable. */
    public static Response sorted(String target, List<Result> results, String trace) {
        List<Result> copy = new ArrayList<>(results);
        copy.sort(ORDER);
        return new Response(target, copy, trace);
    }
}
