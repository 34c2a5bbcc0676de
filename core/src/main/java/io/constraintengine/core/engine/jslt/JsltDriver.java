package io.constraintengine.core.engine.jslt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.constraintengine.core.engine.ConstraintEngine;
import io.constraintengine.core.error.DriverException;
import io.constraintengine.core.error.InvalidConstraintTemplateException;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintKey;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.QueryOptions;
import io.constraintengine.core.model.Result;
import io.constraintengine.core.model.StatsEntry;
import io.constraintengine.core.model.TemplateCode;
import io.constraintengine.core.model.TemplateTarget;
import io.constraintengine.core.spi.Driver;
import io.constraintengine.core.spi.QueryResponse;
import io.constraintengine.core.spi.TargetLibrary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver that evaluates templates written in JSLT, using the Schibsted JSLT library.
 *
 * <p>A template's JSLT source is applied to the input
 *
 * <pre>
 * {"review": &lt;review payload&gt;, "parameters": &lt;spec.parameters&gt;, "data": {"inventory": &lt;stored data&gt;}}
 * </pre>
 *
 * and must return an array of violations, each {@code {"msg": string, "details": any}}. A {@code
 * null} or empty array means no violations. Stored data appears under {@code data.inventory} as a
 * tree whose path segments are the segments of the storage key.
 *
 * <p>Thread-safe.
 */
public final class JsltDriver implements Driver {

    private static final Logger LOG = LoggerFactory.getLogger(JsltDriver.class);
    private static final ObjectMapper DUMP_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Engine name templates use in their code blocks. */
    public static final String NAME = "jslt";

    /** Compiled code per template name. */
    private final Map<String, CompiledTemplate> templates = new ConcurrentHashMap<>();

    private final Map<ConstraintKey, Constraint> constraints = new ConcurrentHashMap<>();

    /** Stored data per target, keyed by storage path. */
    private final Map<String, NavigableMap<String, JsonNode>> data = new ConcurrentHashMap<>();

    private final Map<String, TargetLibrary> libraries = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void addTemplate(ConstraintTemplate template) {
        if (template.targets().size() != 1) {
            throw new InvalidConstraintTemplateException(
                    "jslt templates must declare exactly one target", template.name());
        }
        TemplateTarget target = template.targets().get(0);
        TemplateCode code = target.codeFor(NAME)
                .orElseThrow(() -> new InvalidConstraintTemplateException(
                        "template declares no '" + NAME + "' code", template.name()));
        Expression expression;
        try {
            expression = Parser.compileString(code.source());
        } catch (JsltException e) {
            throw new InvalidConstraintTemplateException(
                    "Failed to compile JSLT for template '" + template.name() + "': " + e.getMessage(),
                    e,
                    template.name());
        }
        templates.put(template.name(), new CompiledTemplate(template.name(), target.target(), expression));
        LOG.debug("Compiled template: template={}", template.name());
    }

    @Override
    public void removeTemplate(ConstraintTemplate template) {
        templates.remove(template.name());
    }

    @Override
    public void addConstraint(Constraint constraint) {
        constraints.put(constraint.key(), constraint);
    }

    @Override
    public void removeConstraint(Constraint constraint) {
        constraints.remove(constraint.key());
    }

    @Override
    public void addData(String target, String key, JsonNode value) {
        if (key.isEmpty()) {
            throw new IllegalArgumentException("data key must not be empty");
        }
        data.computeIfAbsent(target, t -> new ConcurrentSkipListMap<>()).put(key, value.deepCopy());
    }

    @Override
    public void removeData(String target, String key) {
        NavigableMap<String, JsonNode> stored = data.get(target);
        if (stored == null) {
            return;
        }
        if (key.isEmpty()) {
            stored.clear();
            return;
        }
        String prefix = key + "/";
        stored.keySet().removeIf(k -> k.equals(key) || k.startsWith(prefix));
    }

    @Override
    public boolean acceptsReferentialData() {
        return true;
    }

    @Override
    public void addLibrary(String target, TargetLibrary library) {
        libraries.put(target, library);
    }

    @Override
    public QueryResponse query(String target, List<Constraint> toEvaluate, JsonNode review, QueryOptions options) {
        NavigableMap<String, JsonNode> snapshot = snapshot(target);
        ObjectNode inventory = inventory(snapshot);
        Evaluation evaluation = new Evaluation(options);
        for (Constraint constraint : toEvaluate) {
            evaluation.evaluate(target, constraint, review, inventory);
        }
        return evaluation.response();
    }

    @Override
    public QueryResponse audit(String target, List<Constraint> toEvaluate, QueryOptions options) {
        TargetLibrary library = libraries.get(target);
        if (library == null) {
            throw new DriverException("no library registered for target '" + target + "'", NAME, target);
        }
        NavigableMap<String, JsonNode> snapshot = snapshot(target);
        ObjectNode inventory = inventory(snapshot);
        Evaluation evaluation = new Evaluation(options);
        for (Map.Entry<String, JsonNode> stored : snapshot.entrySet()) {
            Optional<JsonNode> review = library.auditReview(stored.getKey(), stored.getValue(), snapshot);
            if (review.isEmpty()) {
                continue;
            }
            for (Constraint constraint : toEvaluate) {
                boolean matches;
                try {
                    matches = library.matches(constraint, review.get());
                } catch (RuntimeException e) {
                    evaluation.results.add(Result.builder(target, ConstraintEngine.AUTO_REJECT_PREFIX + e.getMessage())
                            .constraint(constraint)
                            .review(review.get())
                            .build());
                    continue;
                }
                if (matches) {
                    evaluation.evaluate(target, constraint, review.get(), inventory);
                }
            }
        }
        return evaluation.response();
    }

    @Override
    public String dump() {
        ObjectNode root = NODES.objectNode();
        ArrayNode templateNames = root.putArray("templates");
        new TreeMap<>(templates).keySet().forEach(templateNames::add);
        ArrayNode constraintKeys = root.putArray("constraints");
        constraints.keySet().stream().sorted().forEach(k -> constraintKeys.add(k.toString()));
        ObjectNode dataCounts = root.putObject("data");
        new TreeMap<>(data).forEach((target, stored) -> dataCounts.put(target, stored.size()));
        try {
            return DUMP_MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new DriverException("Failed to render driver state: " + e.getMessage(), e, NAME, null);
        }
    }

    private NavigableMap<String, JsonNode> snapshot(String target) {
        NavigableMap<String, JsonNode> stored = data.get(target);
        return stored == null ? Collections.emptyNavigableMap() : new TreeMap<>(stored);
    }

    /** Nests {@code a/b/c -> v} into {@code {"a": {"b": {"c": v}}}}. */
    static ObjectNode inventory(Map<String, JsonNode> stored) {
        ObjectNode root = NODES.objectNode();
        for (Map.Entry<String, JsonNode> e : stored.entrySet()) {
            String[] segments = e.getKey().split("/");
            ObjectNode node = root;
            for (int i = 0; i < segments.length - 1; i++) {
                JsonNode child = node.get(segments[i]);
                node = child instanceof ObjectNode o ? o : node.putObject(segments[i]);
            }
            node.set(segments[segments.length - 1], e.getValue());
        }
        return root;
    }

    /** Accumulates results, stats and trace for one query or audit call. */
    private final class Evaluation {
        private final QueryOptions options;
        private final List<Result> results = new ArrayList<>();
        private final List<StatsEntry> stats = new ArrayList<>();
        private final StringBuilder trace;

        Evaluation(QueryOptions options) {
            this.options = options;
            this.trace = options.tracing() ? new StringBuilder() : null;
        }

        void evaluate(String target, Constraint constraint, JsonNode review, ObjectNode inventory) {
            String templateName = ConstraintTemplate.nameForKind(constraint.kind());
            CompiledTemplate compiled = templates.get(templateName);
            if (compiled == null) {
                throw new DriverException(
                        "template '" + templateName + "' is not loaded for constraint " + constraint.key(), NAME, target);
            }
            ObjectNode input = NODES.objectNode();
            input.set("review", review == null ? NODES.nullNode() : review);
            JsonNode parameters = constraint.parameters();
            input.set("parameters", parameters.isMissingNode() ? NODES.objectNode() : parameters);
            input.putObject("data").set("inventory", inventory);

            long start = System.nanoTime();
            JsonNode output;
            try {
                output = compiled.expression().apply(input);
            } catch (JsltException e) {
                throw new DriverException(
                        "JSLT evaluation failed for constraint " + constraint.key() + ": " + e.getMessage(),
                        e,
                        NAME,
                        target);
            }
            long elapsed = System.nanoTime() - start;

            int violations = 0;
            if (output != null && !output.isNull() && !output.isMissingNode()) {
                if (!output.isArray()) {
                    throw new DriverException(
                            "template '" + templateName + "' must return an array of violations, got "
                                    + output.getNodeType(),
                            NAME,
                            target);
                }
                for (JsonNode violation : output) {
                    JsonNode msg = violation.path("msg");
                    if (!msg.isTextual()) {
                        throw new DriverException(
                                "violation from template '" + templateName + "' has no string 'msg'", NAME, target);
                    }
                    Result.Builder result = Result.builder(target, msg.asText())
                            .constraint(constraint)
                            .review(review);
                    if (violation.has("details")) {
                        result.details(violation.get("details"));
                    }
                    results.add(result.build());
                    violations++;
                }
            }
            if (trace != null) {
                trace.append("evaluated ")
                        .append(constraint.key())
                        .append(": ")
                        .append(violations)
                        .append(" violation(s)\n");
            }
            if (options.stats()) {
                stats.add(new StatsEntry(
                        "constraint", constraint.key().toString(), Map.of("evalTimeNs", elapsed, "violations", violations)));
            }
        }

        QueryResponse response() {
            return new QueryResponse(results, stats, trace == null ? null : trace.toString());
        }
    }

    private record CompiledTemplate(String name, String target, Expression expression) {}
}
