package io.constraintengine.core.engine;

import static io.constraintengine.core.testkit.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.constraintengine.core.error.DriverException;
import io.constraintengine.core.error.TargetHandlerException;
import io.constraintengine.core.model.EnforcementPoints;
import io.constraintengine.core.model.QueryOptions;
import io.constraintengine.core.model.Responses;
import io.constraintengine.core.model.Result;
import io.constraintengine.core.testkit.Fixtures;
import io.constraintengine.core.testkit.RecordingDriver;
import io.constraintengine.core.testkit.StubTarget;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for reviewing a single object against the stored constraints. */
class ReviewTest {

    private static final String TARGET = "test.target";

    private RecordingDriver driver;
    private ConstraintEngine engine;

    @BeforeEach
    void setUp() {
        driver = new RecordingDriver("rec");
        engine = ConstraintEngine.builder().target(new StubTarget(TARGET)).driver(driver).build();
        engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
        engine.addTemplate(Fixtures.template("AllowedRepos", TARGET, "rec"));
    }

    @Test
    void violationCarriesConstraintActionAndResource() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "owner", "missing owner"));

        Responses responses = engine.review(json("{\"label\": \"web\"}"));

        assertThat(responses.handled()).containsExactly(TARGET);
        assertThat(responses.hasErrors()).isFalse();
        List<Result> results = responses.results();
        assertThat(results).hasSize(1);
        Result result = results.get(0);
        assertThat(result.target()).isEqualTo(TARGET);
        assertThat(result.msg()).isEqualTo("missing owner");
        assertThat(result.constraint().name()).isEqualTo("owner");
        assertThat(result.enforcementAction()).isEqualTo("deny");
        assertThat(result.scopedEnforcementActions()).isEmpty();
        assertThat(result.review()).isEqualTo(json("{\"label\": \"web\"}"));
        assertThat(result.resource().asText()).isEqualTo("handled by test.target");
    }

    @Test
    void constraintsThatDoNotMatchAreNotEvaluated() {
        engine.addConstraint(Fixtures.constraint(
                "RequiredLabels", "db-only", "{\"match\": {\"label\": \"db\"}, \"parameters\": {\"violate\": true}}"));
        driver.clearEvents();

        Responses responses = engine.review(json("{\"label\": \"web\"}"));

        assertThat(responses.results()).isEmpty();
        assertThat(responses.forTarget(TARGET)).isPresent();
        assertThat(driver.events()).doesNotContain("rec:query:test.target");
    }

    @Test
    void resultsAreOrderedByKindThenNameThenMessage() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "b", "m"));
        engine.addConstraint(Fixtures.violating("RequiredLabels", "a", "m"));
        engine.addConstraint(Fixtures.violating("AllowedRepos", "z", "m"));

        Responses first = engine.review(json("{}"));
        Responses second = engine.review(json("{}"));

        assertThat(first.results())
                .extracting(r -> r.constraint().key().toString())
                .containsExactly("AllowedRepos/z", "RequiredLabels/a", "RequiredLabels/b");
        assertThat(second.results()).isEqualTo(first.results());
    }

    @Test
    void matcherFailureBecomesAnAutomaticRejection() {
        engine.addConstraint(Fixtures.constraint("RequiredLabels", "broken", "{\"match\": {\"fail\": true}}"));

        Responses responses = engine.review(json("{}"));

        assertThat(responses.results()).hasSize(1);
        Result result = responses.results().get(0);
        assertThat(result.msg()).startsWith(ConstraintEngine.AUTO_REJECT_PREFIX).contains("matcher exploded");
        assertThat(result.enforcementAction()).isEqualTo("deny");
        assertThat(responses.hasErrors()).isFalse();
    }

    @Test
    void objectNoTargetHandlesProducesNoResponses() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "owner", "m"));

        Responses responses = engine.review("not json");

        assertThat(responses.handled()).isEmpty();
        assertThat(responses.byTarget()).isEmpty();
        assertThat(responses.hasErrors()).isFalse();
    }

    @Test
    void handleReviewFailureOfOneTargetDoesNotHideTheOthers() {
        RecordingDriver shared = new RecordingDriver("rec");
        ConstraintEngine twoTargets = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .target(new StubTarget("broken.target", true))
                .driver(shared)
                .build();
        twoTargets.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
        twoTargets.addConstraint(Fixtures.violating("RequiredLabels", "owner", "missing owner"));

        Responses responses = twoTargets.review(json("{}"));

        assertThat(responses.results()).extracting(Result::msg).containsExactly("missing owner");
        assertThat(responses.errors()).hasValueSatisfying(errors -> {
            assertThat(errors.errors()).containsOnlyKeys("broken.target");
            assertThat(errors.get("broken.target")).isInstanceOf(TargetHandlerException.class);
        });
    }

    @Test
    void driverFailureIsReportedPerTarget() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "owner", "m"));
        driver.failQueries(true);

        Responses responses = engine.review(json("{}"));

        assertThat(responses.results()).isEmpty();
        assertThat(responses.errors()).hasValueSatisfying(errors -> {
            assertThat(errors.get(TARGET)).isInstanceOf(DriverException.class);
            assertThat(((DriverException) errors.get(TARGET)).driver()).isEqualTo("rec");
            assertThat(errors.getMessage()).contains("test.target: driver 'rec' failed");
        });
    }

    @Test
    void scopedConstraintOnlyAppliesAtItsEnforcementPoints() {
        engine.addConstraint(Fixtures.constraint("RequiredLabels", "audit-only", """
                {"enforcementAction": "scoped",
                 "scopedEnforcementActions": [
                   {"action": "Warn", "enforcementPoints": [{"name": "audit.gatekeeper.sh"}]}],
                 "parameters": {"violate": true, "msg": "warned"}}
                """));

        Responses atWebhook =
                engine.review(json("{}"), QueryOptions.defaults().withEnforcementPoints(EnforcementPoints.WEBHOOK));
        Responses atAudit =
                engine.review(json("{}"), QueryOptions.defaults().withEnforcementPoints(EnforcementPoints.AUDIT));

        assertThat(atWebhook.results()).isEmpty();
        assertThat(atAudit.results()).hasSize(1);
        assertThat(atAudit.results().get(0).enforcementAction()).isEqualTo("scoped");
        assertThat(atAudit.results().get(0).scopedEnforcementActions()).containsExactly("warn");
    }

    @Test
    void wildcardEnforcementPointAppliesEverywhere() {
        engine.addConstraint(Fixtures.constraint("RequiredLabels", "everywhere", """
                {"enforcementAction": "scoped",
                 "scopedEnforcementActions": [
                   {"action": "deny", "enforcementPoints": [{"name": "*"}]},
                   {"action": "warn", "enforcementPoints": [{"name": "gator.gatekeeper.sh"}]}],
                 "parameters": {"violate": true}}
                """));

        Responses responses = engine.review(json("{}"));

        assertThat(responses.results().get(0).scopedEnforcementActions()).containsExactly("deny", "warn");
    }

    @Test
    void unknownEnforcementPointIsRejected() {
        assertThatThrownBy(() -> engine.review(json("{}"), QueryOptions.defaults().withEnforcementPoints("nowhere")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    void traceIsOnlyReturnedWhenRequested() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "owner", "m"));

        Responses plain = engine.review(json("{}"));
        Responses traced = engine.review(json("{}"), QueryOptions.defaults().withTracing(true));

        assertThat(plain.forTarget(TARGET).orElseThrow().trace()).isNull();
        assertThat(plain.traceDump()).contains("TRACING DISABLED");
        assertThat(traced.forTarget(TARGET).orElseThrow().trace()).isEqualTo("rec evaluated 1 constraint(s) for test.target");
        assertThat(traced.traceDump()).contains("Target: test.target").contains("rec evaluated");
    }

    @Test
    void statsAreCollectedWhenRequested() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "owner", "m"));

        Responses responses = engine.review(json("{}"), QueryOptions.defaults().withStats(true));

        assertThat(responses.statsEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.statsFor()).isEqualTo("rec");
            assertThat(entry.stats()).containsEntry("constraints", 1);
        });
    }
}
