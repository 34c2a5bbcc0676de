package io.constraintengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.config.EngineConfig;
import io.constraintengine.core.error.ChangeTargetsException;
import io.constraintengine.core.error.DriverException;
import io.constraintengine.core.error.EngineConfigurationException;
import io.constraintengine.core.error.ErrorMap;
import io.constraintengine.core.error.InvalidConstraintException;
import io.constraintengine.core.error.InvalidConstraintTemplateException;
import io.constraintengine.core.error.MissingConstraintException;
import io.constraintengine.core.error.MissingConstraintTemplateException;
import io.constraintengine.core.error.NoReferentialDriverException;
import io.constraintengine.core.error.TargetHandlerException;
import io.constraintengine.core.model.Constraint;
import io.constraintengine.core.model.ConstraintKey;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.ConstraintsApi;
import io.constraintengine.core.model.EnforcementActions;
import io.constraintengine.core.model.QueryOptions;
import io.constraintengine.core.model.Response;
import io.constraintengine.core.model.Responses;
import io.constraintengine.core.model.Result;
import io.constraintengine.core.schema.GeneratedSchema;
import io.constraintengine.core.schema.SchemaDefaulter;
import io.constraintengine.core.schema.SchemaValidator;
import io.constraintengine.core.spi.DataCache;
import io.constraintengine.core.spi.Driver;
import io.constraintengine.core.spi.Matcher;
import io.constraintengine.core.spi.ProcessedData;
import io.constraintengine.core.spi.QueryResponse;
import io.constraintengine.core.spi.TargetHandler;
import io.constraintengine.core.spi.TelemetryListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles constraint templates, stores their constraints and answers review and audit queries
 * across every registered target and driver.
 *
 * <p>Template and constraint registration hold an exclusive lock for their whole duration,
 * including the driver calls they make, so a driver migration is never interleaved with another
 * change. Reviews, audits and {@code get*} calls share a read lock and run concurrently. Data
 * ingestion does not take the lock; drivers must be thread-safe.
 *
 * <p>Concurrent mutation calls are serialized but not otherwise supported: a mutation that fails
 * half-way leaves the state its driver calls already committed, and callers are expected to retry
 * or remove. Callers that need stronger guarantees must serialize mutations themselves.
 *
 * <p>Query-time failures are isolated per target: they are collected into {@link
 * Responses#errors()} next to the results obtained for every other target.
 */
public final class ConstraintEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintEngine.class);

    private static final Pattern TARGET_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9.]*$");

    /** Message prefix of results produced when matching a constraint fails. */
    public static final String AUTO_REJECT_PREFIX = "unable to match constraints: ";

    private final Map<String, TargetHandler> targets;
    private final DriverRegistry drivers;
    private final List<String> enforcementPoints;
    private final boolean ignoreNoReferentialDriver;
    private final DataCache dataCache;
    private final TelemetryListener telemetryListener;
    private final SchemaValidator schemaValidator = new SchemaValidator();
    private final SchemaDefaulter schemaDefaulter = new SchemaDefaulter();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TemplateEntry> templates = new TreeMap<>();

    private ConstraintEngine(Builder b, Map<String, TargetHandler> targets, DriverRegistry drivers) {
        this.targets = targets;
        this.drivers = drivers;
        this.enforcementPoints = List.copyOf(b.enforcementPoints);
        this.ignoreNoReferentialDriver = b.ignoreNoReferentialDriver;
        this.dataCache = b.dataCache; // nullable
        this.telemetryListener = b.telemetryListener; // nullable
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Templates ---

    /**
     * Validates {@code template} and generates its schema without registering anything.
     *
     * @return a copy of the generated schema
     * @throws InvalidConstraintTemplateException if the template is invalid
     */
    public ObjectNode createSchema(ConstraintTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        TargetHandler target = validateTemplateMetadata(template);
        return schemaValidator.createSchema(template, target).source().deepCopy();
    }

    /**
     * Registers or updates a template. Adding a template identical to the registered one is a
     * no-op that makes no driver calls.
     *
     * <p>When the template's driver changes, the new driver receives the template and every
     * stored constraint before the template is removed from the old driver.
     *
     * @return responses whose {@code handled} set names the template's target
     * @throws InvalidConstraintTemplateException if the template is invalid
     * @throws io.constraintengine.core.error.NoDriverException if no driver serves the template
     * @throws ChangeTargetsException if the target changes while constraints exist
     * @throws DriverException if a previous driver fails to release the template; the new driver
     *     already serves it, and adding the template again finishes the cleanup
     */
    public Responses addTemplate(ConstraintTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        try {
            return doAddTemplate(template);
        } catch (RuntimeException e) {
            notifyTemplateRejected(template.name(), e.getMessage());
            throw e;
        }
    }

    private Responses doAddTemplate(ConstraintTemplate template) {
        TargetHandler target = validateTemplateMetadata(template);
        GeneratedSchema schema = schemaValidator.createSchema(template, target);
        Driver driver = drivers.driverFor(template);
        String name = template.name();

        lock.writeLock().lock();
        try {
            TemplateEntry existing = templates.get(name);
            boolean found = existing != null;
            TemplateEntry entry = found ? existing : new TemplateEntry();
            if (found
                    && entry.template().semanticEquals(template)
                    && !entry.needsConstraintReplay()
                    && entry.activeDrivers().size() == 1
                    && entry.activeDrivers().contains(driver.name())) {
                LOG.debug("Template unchanged: template={}", name);
                notifyTemplateAdded(name, driver.name(), false);
                return handled(target.name());
            }
            if (found
                    && entry.hasConstraints()
                    && !entry.template().targetNames().equals(template.targetNames())) {
                throw new ChangeTargetsException(
                        "cannot change targets of template '" + name + "' from " + entry.template().targetNames()
                                + " to " + template.targetNames() + " while it has constraints",
                        name);
            }
            if (found && !driver.name().equals(entry.driver())) {
                LOG.info("Migrating template: template={}, from={}, to={}", name, entry.driver(), driver.name());
                entry.needsConstraintReplay(true);
            }

            driver.addTemplate(template.copy());
            entry.activeDrivers().add(driver.name());
            if (!found) {
                templates.put(name, entry);
            }

            if (entry.needsConstraintReplay()) {
                for (ConstraintEntry constraint : entry.constraints()) {
                    driver.addConstraint(constraint.constraint());
                }
                entry.needsConstraintReplay(false);
            }

            // Routing moves to the new driver before the old ones are cleared. A teardown failure
            // leaves the old driver in the active set; a retried add clears it.
            entry.update(template, schema, target, driver.name());
            LOG.info("Template added: template={}, kind={}, target={}, driver={}", name, template.kind(),
                    target.name(), driver.name());
            notifyTemplateAdded(name, driver.name(), true);

            RuntimeException teardownFailure = null;
            Iterator<String> active = entry.activeDrivers().iterator();
            while (active.hasNext()) {
                String old = active.next();
                if (old.equals(driver.name())) {
                    continue;
                }
                try {
                    drivers.getDriver(old).ifPresent(d -> {
                        for (ConstraintEntry constraint : entry.constraints()) {
                            d.removeConstraint(constraint.constraint());
                        }
                        d.removeTemplate(entry.template());
                    });
                    active.remove();
                } catch (RuntimeException e) {
                    LOG.warn("Failed to clear previous driver: template={}, driver={}", name, old, e);
                    if (teardownFailure == null) {
                        teardownFailure = new DriverException(
                                "driver '" + old + "' failed to release template '" + name + "': " + e.getMessage(),
                                e,
                                old,
                                name);
                    }
                }
            }
            if (teardownFailure != null) {
                throw teardownFailure;
            }
            return handled(target.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a template and all of its constraints from every driver that may hold them. Removing
     * an unknown template is a no-op.
     */
    public Responses removeTemplate(ConstraintTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        String name = template.name();

        lock.writeLock().lock();
        try {
            TemplateEntry entry = templates.get(name);
            if (entry == null) {
                LOG.debug("Remove of unknown template ignored: template={}", name);
                return Responses.builder().build();
            }
            removeFromActiveDrivers(entry);
            templates.remove(name);
            LOG.info("Template removed: template={}, constraints={}", name, entry.constraints().size());
            return handled(entry.target().name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a copy of the registered template with the same name as {@code template}.
     *
     * @throws MissingConstraintTemplateException if no such template is registered
     */
    public ConstraintTemplate getTemplate(ConstraintTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        return getTemplate(template.name());
    }

    /**
     * Returns a copy of the registered template called {@code name}.
     *
     * @throws MissingConstraintTemplateException if no such template is registered
     */
    public ConstraintTemplate getTemplate(String name) {
        lock.readLock().lock();
        try {
            TemplateEntry entry = templates.get(name);
            if (entry == null) {
                throw new MissingConstraintTemplateException("template '" + name + "' not found", name);
            }
            return entry.template().copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Names of the registered templates, sorted. */
    public List<String> templateNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(templates.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Constraints ---

    /**
     * Stores a constraint after applying its template's defaults and validating it. A constraint
     * semantically equal to the stored one is not sent to the driver again.
     *
     * @throws InvalidConstraintException if metadata, schema or target validation fails
     * @throws MissingConstraintTemplateException if no template defines the constraint's kind
     */
    public Responses addConstraint(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        validateConstraintMetadata(constraint);

        lock.writeLock().lock();
        try {
            TemplateEntry entry = templateForKind(constraint.kind());
            Constraint defaulted = applyDefaults(constraint, entry.schema());
            String name = defaulted.name();

            ConstraintEntry cached = entry.constraint(name);
            if (cached != null && cached.constraint().semanticEquals(defaulted)) {
                LOG.debug("Constraint unchanged: constraint={}", defaulted.key());
                notifyConstraintAdded(defaulted.key(), false);
                return handled(entry.target().name());
            }

            validate(entry, defaulted);
            ConstraintEntry prepared = prepare(entry, defaulted);
            drivers.getDriver(entry.driver())
                    .orElseThrow(() -> new IllegalStateException("driver '" + entry.driver() + "' disappeared"))
                    .addConstraint(defaulted);
            entry.putConstraint(name, prepared);

            LOG.debug("Constraint added: constraint={}, action={}", defaulted.key(), prepared.enforcementAction());
            notifyConstraintAdded(defaulted.key(), true);
            return handled(entry.target().name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a constraint from every driver serving its template. Succeeds without effect if the
     * template or the constraint is unknown.
     *
     * @throws InvalidConstraintException if the constraint's metadata is invalid
     */
    public Responses removeConstraint(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        validateConstraintMetadata(constraint);

        lock.writeLock().lock();
        try {
            TemplateEntry entry = templates.get(ConstraintTemplate.nameForKind(constraint.kind()));
            if (entry == null) {
                LOG.debug("Remove of constraint with unknown template ignored: constraint={}", constraint.key());
                return Responses.builder().build();
            }
            ConstraintEntry cached = entry.constraint(constraint.name());
            Constraint stored = cached == null ? constraint.withoutStatus() : cached.constraint();
            for (String driverName : entry.activeDrivers()) {
                drivers.getDriver(driverName).ifPresent(d -> d.removeConstraint(stored));
            }
            entry.removeConstraint(constraint.name());
            LOG.debug("Constraint removed: constraint={}", constraint.key());
            return handled(entry.target().name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a copy of the stored constraint with the same kind and name.
     *
     * @throws MissingConstraintTemplateException if no template defines the kind
     * @throws MissingConstraintException if the constraint is not stored
     */
    public Constraint getConstraint(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        validateConstraintMetadata(constraint);

        lock.readLock().lock();
        try {
            TemplateEntry entry = templateForKind(constraint.kind());
            ConstraintEntry cached = entry.constraint(constraint.name());
            if (cached == null) {
                throw new MissingConstraintException(
                        "constraint " + constraint.key() + " not found", constraint.name());
            }
            return Constraint.of(cached.constraint().toJson());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs the same validation as {@link #addConstraint} without storing anything.
     *
     * @throws InvalidConstraintException if the constraint is invalid
     * @throws MissingConstraintTemplateException if no template defines the constraint's kind
     */
    public void validateConstraint(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        validateConstraintMetadata(constraint);

        lock.readLock().lock();
        try {
            TemplateEntry entry = templateForKind(constraint.kind());
            Constraint defaulted = applyDefaults(constraint, entry.schema());
            validate(entry, defaulted);
            prepare(entry, defaulted);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Removes every template and constraint from every driver and forgets them. */
    public void reset() {
        lock.writeLock().lock();
        try {
            Iterator<TemplateEntry> it = templates.values().iterator();
            while (it.hasNext()) {
                removeFromActiveDrivers(it.next());
                it.remove();
            }
            LOG.info("Engine reset");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- Data ---

    /**
     * Stores referential data for every target that handles {@code data}: first in the data
     * cache, then in every driver that accepts it. A driver failure rolls back the cache entry and
     * is reported under the target's key.
     *
     * @throws NoReferentialDriverException if no driver accepts data and the engine is not
     *     configured to ignore that
     */
    public Responses addData(Object data) {
        Objects.requireNonNull(data, "data must not be null");
        if (!checkReferentialDriver()) {
            return Responses.builder().build();
        }
        Responses.Builder out = Responses.builder();
        for (TargetHandler target : targets.values()) {
            Optional<ProcessedData> processed = processData(target, data, out);
            if (processed.isEmpty()) {
                continue;
            }
            String key = processed.get().key();
            if (processed.get().isWipe()) {
                out.error(target.name(), new TargetHandlerException("cannot add data with an empty key", target.name()));
                continue;
            }
            JsonNode value = processed.get().value();
            if (dataCache != null) {
                dataCache.add(target.name(), key, value);
            }
            boolean failed = forEachDataDriver(
                    target.name(), key, out, (driver, k) -> driver.addData(target.name(), k, value));
            if (failed) {
                if (dataCache != null) {
                    dataCache.remove(target.name(), key);
                }
                continue;
            }
            out.handled(target.name());
        }
        return out.build();
    }

    /**
     * Removes referential data for every target that handles {@code data}: first from every
     * driver, then from the data cache. The cache entry is kept if any driver fails.
     *
     * @throws NoReferentialDriverException if no driver accepts data and the engine is not
     *     configured to ignore that
     */
    public Responses removeData(Object data) {
        Objects.requireNonNull(data, "data must not be null");
        if (!checkReferentialDriver()) {
            return Responses.builder().build();
        }
        Responses.Builder out = Responses.builder();
        for (TargetHandler target : targets.values()) {
            Optional<ProcessedData> processed = processData(target, data, out);
            if (processed.isEmpty()) {
                continue;
            }
            String key = processed.get().key();
            boolean failed =
                    forEachDataDriver(target.name(), key, out, (driver, k) -> driver.removeData(target.name(), k));
            if (failed) {
                continue;
            }
            if (dataCache != null) {
                dataCache.remove(target.name(), key);
            }
            out.handled(target.name());
        }
        return out.build();
    }

    private boolean checkReferentialDriver() {
        if (drivers.anyAcceptsReferentialData()) {
            return true;
        }
        if (ignoreNoReferentialDriver) {
            LOG.warn("No driver accepts referential data; data call ignored");
            return false;
        }
        throw new NoReferentialDriverException(
                "no registered driver accepts referential data; registered drivers: " + drivers.names());
    }

    private Optional<ProcessedData> processData(TargetHandler target, Object data, Responses.Builder out) {
        try {
            Optional<ProcessedData> processed = target.processData(data);
            if (processed.isEmpty()) {
                LOG.debug("Target does not handle data: target={}", target.name());
            }
            return processed;
        } catch (RuntimeException e) {
            out.error(target.name(), e);
            return Optional.empty();
        }
    }

    /** Returns {@code true} if any driver failed. */
    private boolean forEachDataDriver(
            String target, String key, Responses.Builder out, BiConsumer<Driver, String> call) {
        boolean failed = false;
        for (Driver driver : drivers.all()) {
            if (!driver.acceptsReferentialData()) {
                continue;
            }
            try {
                call.accept(driver, key);
            } catch (RuntimeException e) {
                out.error(target, new DriverException(
                        "driver '" + driver.name() + "' failed for data key '" + key + "': " + e.getMessage(),
                        e,
                        driver.name(),
                        target));
                failed = true;
            }
        }
        return failed;
    }

    // --- Queries ---

    /** Reviews {@code object} with default options. */
    public Responses review(Object object) {
        return review(object, QueryOptions.defaults());
    }

    /**
     * Evaluates {@code object} against every constraint whose target handles it.
     *
     * <p>A constraint whose matcher fails produces an automatic rejection result rather than being
     * skipped. Results within each target are sorted, so identical calls return identical
     * sequences.
     *
     * @throws IllegalArgumentException if {@code options} names an enforcement point the engine
     *     does not serve
     */
    public Responses review(Object object, QueryOptions options) {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(options, "options must not be null");
        List<String> eps = resolveEnforcementPoints(options);
        long start = System.nanoTime();
        Responses.Builder out = Responses.builder();

        lock.readLock().lock();
        try {
            for (TargetHandler target : targets.values()) {
                Optional<JsonNode> review;
                try {
                    review = target.handleReview(object);
                } catch (RuntimeException e) {
                    out.error(target.name(), e);
                    continue;
                }
                if (review.isEmpty()) {
                    LOG.debug("Target does not handle object: target={}", target.name());
                    continue;
                }
                out.handled(target.name());
                reviewTarget(target, review.get(), eps, options, out);
            }
        } finally {
            lock.readLock().unlock();
        }
        return completed("review", out.build(), start);
    }

    private void reviewTarget(
            TargetHandler target, JsonNode review, List<String> eps, QueryOptions options, Responses.Builder out) {
        Map<String, List<ConstraintMatchResult>> byDriver = new LinkedHashMap<>();
        List<Result> results = new ArrayList<>();
        for (TemplateEntry entry : templates.values()) {
            if (!entry.target().name().equals(target.name())) {
                continue;
            }
            for (ConstraintEntry constraint : entry.constraints()) {
                ConstraintMatchResult match = constraint.matches(target.name(), review, eps);
                if (match == null) {
                    continue;
                }
                if (match.isError()) {
                    results.add(autoReject(target.name(), match, review));
                } else {
                    byDriver.computeIfAbsent(entry.driver(), k -> new ArrayList<>()).add(match);
                }
            }
        }
        List<String> traces = new ArrayList<>();
        byDriver.forEach((driverName, matches) -> {
            Driver driver = drivers.getDriver(driverName).orElseThrow();
            List<Constraint> constraints = matches.stream().map(ConstraintMatchResult::constraint).toList();
            try {
                QueryResponse response = driver.query(target.name(), constraints, review, options);
                collect(response, matches, review, results, traces, out);
            } catch (RuntimeException e) {
                out.error(target.name(), driverFailure(driverName, target.name(), e));
            }
        });
        out.response(finish(target, results, traces, options, out));
    }

    /** Audits with default options. */
    public Responses audit() {
        return audit(QueryOptions.defaults());
    }

    /**
     * Evaluates every stored object of every target against the constraints active at the
     * requested enforcement points. Drivers do the per-object matching through the target's
     * library.
     *
     * @throws IllegalArgumentException if {@code options} names an enforcement point the engine
     *     does not serve
     */
    public Responses audit(QueryOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<String> eps = resolveEnforcementPoints(options);
        long start = System.nanoTime();
        Responses.Builder out = Responses.builder();

        lock.readLock().lock();
        try {
            for (TargetHandler target : targets.values()) {
                Map<String, List<ConstraintMatchResult>> byDriver = new LinkedHashMap<>();
                for (TemplateEntry entry : templates.values()) {
                    if (!entry.target().name().equals(target.name())) {
                        continue;
                    }
                    for (ConstraintEntry constraint : entry.constraints()) {
                        if (!constraint.appliesAt(eps)) {
                            continue;
                        }
                        List<String> scoped = EnforcementActions.isScoped(constraint.enforcementAction())
                                ? constraint.scopedActions(eps)
                                : List.of();
                        byDriver.computeIfAbsent(entry.driver(), k -> new ArrayList<>())
                                .add(ConstraintMatchResult.matched(
                                        constraint.constraint(), constraint.enforcementAction(), scoped));
                    }
                }
                out.handled(target.name());
                List<Result> results = new ArrayList<>();
                List<String> traces = new ArrayList<>();
                byDriver.forEach((driverName, matches) -> {
                    Driver driver = drivers.getDriver(driverName).orElseThrow();
                    List<Constraint> constraints = matches.stream().map(ConstraintMatchResult::constraint).toList();
                    try {
                        collect(driver.audit(target.name(), constraints, options), matches, null, results, traces, out);
                    } catch (RuntimeException e) {
                        out.error(target.name(), driverFailure(driverName, target.name(), e));
                    }
                });
                out.response(finish(target, results, traces, options, out));
            }
        } finally {
            lock.readLock().unlock();
        }
        return completed("audit", out.build(), start);
    }

    /** Concatenated state dumps of every driver, in priority order. */
    public String dump() {
        StringBuilder b = new StringBuilder();
        for (Driver driver : drivers.all()) {
            b.append("Driver: ").append(driver.name()).append('\n');
            b.append(driver.dump()).append('\n');
        }
        return b.toString();
    }

    /** Names of the registered targets, sorted. */
    public Set<String> knownTargets() {
        return targets.keySet();
    }

    private void collect(
            QueryResponse response,
            List<ConstraintMatchResult> matches,
            JsonNode review,
            List<Result> results,
            List<String> traces,
            Responses.Builder out) {
        Map<ConstraintKey, ConstraintMatchResult> byKey = new HashMap<>();
        matches.forEach(m -> byKey.put(m.constraint().key(), m));
        for (Result result : response.results()) {
            ConstraintMatchResult match = result.constraint() == null ? null : byKey.get(result.constraint().key());
            Result enriched = match == null ? result : result.withEnforcement(match.enforcementAction(), match.scopedActions());
            if (enriched.review() == null && review != null) {
                enriched = enriched.toBuilder().review(review).build();
            }
            results.add(enriched);
        }
        out.stats(response.stats());
        if (response.trace() != null) {
            traces.add(response.trace());
        }
    }

    private Response finish(
            TargetHandler target, List<Result> results, List<String> traces, QueryOptions options, Responses.Builder out) {
        List<Result> handledResults = new ArrayList<>(results.size());
        for (Result result : results) {
            try {
                handledResults.add(target.handleViolation(result));
            } catch (RuntimeException e) {
                out.error(target.name(), e);
                handledResults.add(result);
            }
        }
        String trace = options.tracing() ? String.join("\n", traces) : null;
        return Response.sorted(target.name(), handledResults, trace);
    }

    private static Result autoReject(String target, ConstraintMatchResult match, JsonNode review) {
        return Result.builder(target, AUTO_REJECT_PREFIX + match.error().getMessage())
                .constraint(match.constraint())
                .enforcementAction(match.enforcementAction())
                .scopedEnforcementActions(match.scopedActions())
                .review(review)
                .build();
    }

    private static DriverException driverFailure(String driver, String target, RuntimeException e) {
        return new DriverException(
                "driver '" + driver + "' failed for target '" + target + "': " + e.getMessage(), e, driver, target);
    }

    private List<String> resolveEnforcementPoints(QueryOptions options) {
        if (options.enforcementPoints().isEmpty()) {
            return enforcementPoints;
        }
        for (String ep : options.enforcementPoints()) {
            if (!enforcementPoints.contains(ep)) {
                throw new IllegalArgumentException(
                        "enforcement point '" + ep + "' is not served by this engine; served: " + enforcementPoints);
            }
        }
        return options.enforcementPoints();
    }

    private Responses completed(String kind, Responses responses, long startNanos) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        int errorCount = responses.errors().map(ErrorMap::size).orElse(0);
        LOG.debug(
                "Query complete: kind={}, targets={}, results={}, errors={}, duration_ms={}",
                kind,
                responses.byTarget().keySet(),
                responses.results().size(),
                errorCount,
                durationMs);
        if (telemetryListener != null) {
            try {
                telemetryListener.onQueryCompleted(new TelemetryListener.QueryCompletedEvent(
                        kind, responses.byTarget().keySet(), responses.results().size(), errorCount, durationMs));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onQueryCompleted failed", e);
            }
        }
        return responses;
    }

    // --- Validation helpers ---

    private TargetHandler validateTemplateMetadata(ConstraintTemplate template) {
        String name = template.name();
        if (name == null || name.isEmpty()) {
            throw new InvalidConstraintTemplateException("template has no name", name);
        }
        String kind = template.kind();
        if (kind == null || !name.equals(ConstraintTemplate.nameForKind(kind))) {
            throw new InvalidConstraintTemplateException(
                    "template's name '" + name + "' is not equal to the lowercase of its kind '" + kind + "'", name);
        }
        if (template.targets().size() != 1) {
            throw new InvalidConstraintTemplateException(
                    template.targets().isEmpty()
                            ? "no targets specified: template must specify one target"
                            : "multi-target templates are not currently supported",
                    name);
        }
        String targetName = template.targets().get(0).target();
        TargetHandler target = targets.get(targetName);
        if (target == null) {
            throw new InvalidConstraintTemplateException(
                    "target '" + targetName + "' not recognized; known targets: " + targets.keySet(), name);
        }
        return target;
    }

    private static void validateConstraintMetadata(Constraint constraint) {
        if (constraint.name().isEmpty()) {
            throw new InvalidConstraintException("constraint has no metadata.name", constraint.name());
        }
        if (!ConstraintsApi.GROUP.equals(constraint.group())) {
            throw new InvalidConstraintException(
                    "wrong API group for constraint '" + constraint.name() + "': got '" + constraint.group()
                            + "', want '" + ConstraintsApi.GROUP + "'",
                    constraint.name());
        }
        if (constraint.kind().isEmpty()) {
            throw new InvalidConstraintException("constraint '" + constraint.name() + "' has no kind", constraint.name());
        }
    }

    private TemplateEntry templateForKind(String kind) {
        String name = ConstraintTemplate.nameForKind(kind);
        TemplateEntry entry = templates.get(name);
        if (entry == null) {
            throw new MissingConstraintTemplateException(
                    "no template registered for kind '" + kind + "' (template '" + name + "')", name);
        }
        return entry;
    }

    private Constraint applyDefaults(Constraint constraint, GeneratedSchema schema) {
        ObjectNode json = constraint.withoutStatus().toJson();
        schemaDefaulter.apply(schema.source(), json);
        return Constraint.of(json);
    }

    private void validate(TemplateEntry entry, Constraint constraint) {
        try {
            entry.target().validateConstraint(constraint);
        } catch (InvalidConstraintException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidConstraintException(
                    "target '" + entry.target().name() + "' rejected constraint " + constraint.key() + ": "
                            + e.getMessage(),
                    e,
                    constraint.name());
        }
        schemaValidator.validateConstraint(constraint, entry.schema());
    }

    private ConstraintEntry prepare(TemplateEntry entry, Constraint constraint) {
        String action = EnforcementActions.enforcementAction(constraint);
        Map<String, List<String>> actions = EnforcementActions.actionsForEnforcementPoints(constraint, enforcementPoints);
        Matcher matcher;
        try {
            matcher = entry.target().toMatcher(constraint);
        } catch (RuntimeException e) {
            throw new InvalidConstraintException(
                    "cannot build matcher for constraint " + constraint.key() + ": " + e.getMessage(),
                    e,
                    constraint.name());
        }
        return new ConstraintEntry(constraint, Map.of(entry.target().name(), matcher), action, actions);
    }

    /** Removes every constraint, then the template, from each active driver. */
    private void removeFromActiveDrivers(TemplateEntry entry) {
        Iterator<String> active = entry.activeDrivers().iterator();
        while (active.hasNext()) {
            String driverName = active.next();
            Optional<Driver> driver = drivers.getDriver(driverName);
            if (driver.isPresent()) {
                for (ConstraintEntry constraint : entry.constraints()) {
                    driver.get().removeConstraint(constraint.constraint());
                }
                driver.get().removeTemplate(entry.template());
            }
            active.remove();
        }
    }

    private static Responses handled(String target) {
        return Responses.builder().handled(target).build();
    }

    // --- Telemetry ---

    private void notifyTemplateAdded(String template, String driver, boolean changed) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onTemplateAdded(new TelemetryListener.TemplateAddedEvent(template, driver, changed));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onTemplateAdded failed", e);
        }
    }

    private void notifyTemplateRejected(String template, String detail) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onTemplateRejected(new TelemetryListener.TemplateRejectedEvent(template, detail));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onTemplateRejected failed", e);
        }
    }

    private void notifyConstraintAdded(ConstraintKey key, boolean changed) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onConstraintAdded(
                    new TelemetryListener.ConstraintAddedEvent(key.kind(), key.name(), changed));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onConstraintAdded failed", e);
        }
    }

    // --- Builder ---

    /**
     * Builder for {@link ConstraintEngine}. Targets and drivers are required; everything else
     * defaults from {@link EngineConfig#defaults()}.
     */
    public static final class Builder {
        private final List<TargetHandler> targets = new ArrayList<>();
        private final List<Driver> drivers = new ArrayList<>();
        private List<String> driverPriority = List.of();
        private List<String> enforcementPoints = EngineConfig.defaults().enforcementPoints();
        private boolean ignoreNoReferentialDriver;
        private DataCache dataCache;
        private TelemetryListener telemetryListener;

        private Builder() {}

        public Builder target(TargetHandler target) {
            targets.add(Objects.requireNonNull(target, "target must not be null"));
            return this;
        }

        /** Registers a driver. Registration order is the priority order unless configured otherwise. */
        public Builder driver(Driver driver) {
            drivers.add(Objects.requireNonNull(driver, "driver must not be null"));
            return this;
        }

        /** Applies every setting in {@code config}; later builder calls override it. */
        public Builder config(EngineConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            this.driverPriority = config.driverPriority();
            this.enforcementPoints = config.enforcementPoints();
            this.ignoreNoReferentialDriver = config.ignoreNoReferentialDriver();
            return this;
        }

        public Builder driverPriority(String... names) {
            this.driverPriority = List.of(names);
            return this;
        }

        public Builder enforcementPoints(String... points) {
            this.enforcementPoints = List.of(points);
            return this;
        }

        public Builder ignoreNoReferentialDriver(boolean ignore) {
            this.ignoreNoReferentialDriver = ignore;
            return this;
        }

        public Builder dataCache(DataCache dataCache) {
            this.dataCache = dataCache;
            return this;
        }

        public Builder telemetryListener(TelemetryListener telemetryListener) {
            this.telemetryListener = telemetryListener;
            return this;
        }

        /**
         * Builds the engine and hands every target's library to every driver.
         *
         * @throws EngineConfigurationException if targets or drivers are missing, duplicated or
         *     badly named, or no enforcement points are configured
         */
        public ConstraintEngine build() {
            if (targets.isEmpty()) {
                throw new EngineConfigurationException("no targets registered");
            }
            Map<String, TargetHandler> byName = new TreeMap<>();
            for (TargetHandler target : targets) {
                String name = target.name();
                if (name == null || !TARGET_NAME.matcher(name).matches()) {
                    throw new EngineConfigurationException(
                            "invalid target name '" + name + "': must match " + TARGET_NAME.pattern());
                }
                if (byName.putIfAbsent(name, target) != null) {
                    throw new EngineConfigurationException("duplicate target name: '" + name + "'");
                }
            }
            if (enforcementPoints.isEmpty()) {
                throw new EngineConfigurationException("at least one enforcement point is required");
            }
            DriverRegistry registry = DriverRegistry.of(drivers, driverPriority);
            for (Driver driver : registry.all()) {
                byName.values().forEach(t -> driver.addLibrary(t.name(), t.library()));
            }
            LOG.info(
                    "Constraint engine built: targets={}, drivers={}, enforcement_points={}",
                    byName.keySet(),
                    registry.names(),
                    enforcementPoints);
            return new ConstraintEngine(this, Collections.unmodifiableMap(byName), registry);
        }
    }
}
