package io.constraintengine.core.engine;

import static io.constraintengine.core.testkit.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

import io.constraintengine.core.model.EnforcementPoints;
import io.constraintengine.core.model.QueryOptions;
import io.constraintengine.core.model.Responses;
import io.constraintengine.core.model.Result;
import io.constraintengine.core.testkit.Fixtures;
import io.constraintengine.core.testkit.RecordingDriver;
import io.constraintengine.core.testkit.StubTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for auditing stored data against the stored constraints. */
class AuditTest {

    private static final String TARGET = "test.target";

    private RecordingDriver driver;
    private ConstraintEngine engine;

    @BeforeEach
    void setUp() {
        driver = new RecordingDriver("rec");
        engine = ConstraintEngine.builder().target(new StubTarget(TARGET)).driver(driver).build();
        engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
        engine.addData(json("{\"key\": \"ns/a/web\", \"label\": \"web\"}"));
        engine.addData(json("{\"key\": \"ns/a/db\", \"label\": \"db\"}"));
    }

    @Test
    void everyMatchingStoredObjectIsEvaluated() {
        engine.addConstraint(Fixtures.constraint(
                "RequiredLabels", "web-only", "{\"match\": {\"label\": \"web\"}, \"parameters\": {\"violate\": true}}"));

        Responses responses = engine.audit();

        assertThat(responses.handled()).containsExactly(TARGET);
        assertThat(responses.results()).singleElement().satisfies(result -> {
            assertThat(result.constraint().name()).isEqualTo("web-only");
            assertThat(result.enforcementAction()).isEqualTo("deny");
            assertThat(result.review().path("key").asText()).isEqualTo("ns/a/web");
        });
    }

    @Test
    void auditWithoutConstraintsStillAnswersForEveryTarget() {
        Responses responses = engine.audit();

        assertThat(responses.forTarget(TARGET)).hasValueSatisfying(r -> assertThat(r.results()).isEmpty());
        assertThat(driver.events()).doesNotContain("rec:audit:test.target");
    }

    @Test
    void constraintsWithoutAnActionAtTheAuditPointAreSkipped() {
        engine.addConstraint(Fixtures.constraint("RequiredLabels", "webhook-only", """
                {"enforcementAction": "scoped",
                 "scopedEnforcementActions": [
                   {"action": "deny", "enforcementPoints": [{"name": "validation.gatekeeper.sh"}]}],
                 "parameters": {"violate": true}}
                """));
        engine.addConstraint(Fixtures.violating("RequiredLabels", "always", "m"));

        Responses responses =
                engine.audit(QueryOptions.defaults().withEnforcementPoints(EnforcementPoints.AUDIT));

        assertThat(responses.results())
                .extracting(r -> r.constraint().name())
                .containsExactly("always", "always");
    }

    @Test
    void auditResultsAreSortedAndStable() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "b", "second"));
        engine.addConstraint(Fixtures.violating("RequiredLabels", "a", "first"));

        Responses first = engine.audit();
        Responses second = engine.audit();

        assertThat(first.results()).extracting(Result::msg).containsExactly("first", "first", "second", "second");
        assertThat(second.results()).isEqualTo(first.results());
    }

    @Test
    void driverFailureDuringAuditIsIsolated() {
        engine.addConstraint(Fixtures.violating("RequiredLabels", "a", "m"));
        driver.failQueries(true);

        Responses responses = engine.audit();

        assertThat(responses.hasErrors()).isTrue();
        assertThat(responses.forTarget(TARGET)).isPresent();
        assertThat(responses.results()).isEmpty();
    }
}
