package io.constraintengine.core.engine;

import static io.constraintengine.core.testkit.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constraintengine.core.error.ChangeTargetsException;
import io.constraintengine.core.error.InvalidConstraintTemplateException;
import io.constraintengine.core.error.MissingConstraintTemplateException;
import io.constraintengine.core.error.NoDriverException;
import io.constraintengine.core.model.ConstraintTemplate;
import io.constraintengine.core.model.Responses;
import io.constraintengine.core.model.TemplateCode;
import io.constraintengine.core.model.TemplateTarget;
import io.constraintengine.core.testkit.Fixtures;
import io.constraintengine.core.testkit.RecordingDriver;
import io.constraintengine.core.testkit.StubTarget;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for template registration, update, removal and schema creation. */
class TemplateRegistrationTest {

    private static final String TARGET = "test.target";
    private static final String OTHER_TARGET = "other.target";

    private RecordingDriver driver;
    private ConstraintEngine engine;

    @BeforeEach
    void setUp() {
        driver = new RecordingDriver("rec");
        engine = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .target(new StubTarget(OTHER_TARGET))
                .driver(driver)
                .build();
    }

    @Nested
    class Add {

        @Test
        void addedTemplateIsRetrievableAndHandledByItsTarget() {
            ConstraintTemplate template = Fixtures.template("RequiredLabels", TARGET, "rec");

            Responses responses = engine.addTemplate(template);

            assertThat(responses.handled()).containsExactly(TARGET);
            assertThat(engine.getTemplate("requiredlabels").semanticEquals(template)).isTrue();
            assertThat(engine.templateNames()).containsExactly("requiredlabels");
            assertThat(driver.hasTemplate("requiredlabels")).isTrue();
        }

        @Test
        void addingAnIdenticalTemplateTwiceCallsTheDriverOnce() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));

            assertThat(driver.events()).containsExactly("rec:addTemplate:requiredlabels");
        }

        @Test
        void changedTemplateIsSentToTheDriverAgain() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
            ConstraintTemplate changed = new ConstraintTemplate(
                    "requiredlabels",
                    "RequiredLabels",
                    json("{\"type\": \"object\"}"),
                    List.of(new TemplateTarget(TARGET, List.of(new TemplateCode("rec", "other source")))));

            engine.addTemplate(changed);

            assertThat(driver.events()).containsExactly("rec:addTemplate:requiredlabels", "rec:addTemplate:requiredlabels");
            assertThat(engine.getTemplate("requiredlabels").parametersSchema()).isEqualTo(json("{\"type\": \"object\"}"));
        }

        @Test
        void returnedTemplateIsACopy() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));

            ConstraintTemplate copy = engine.getTemplate("requiredlabels");
            ((ObjectNode) copy.parametersSchema()).put("type", "string");

            assertThat(engine.getTemplate("requiredlabels").parametersSchema().path("type").asText()).isEqualTo("object");
        }

        @Test
        void failingDriverLeavesNothingRegistered() {
            driver.failTemplates(true);

            assertThatThrownBy(() -> engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec")))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> engine.getTemplate("requiredlabels"))
                    .isInstanceOf(MissingConstraintTemplateException.class);
        }
    }

    @Nested
    class Validation {

        @Test
        void nameMustEqualLowercaseKind() {
            ConstraintTemplate template = new ConstraintTemplate(
                    "required-labels",
                    "RequiredLabels",
                    null,
                    List.of(new TemplateTarget(TARGET, List.of(new TemplateCode("rec", "src")))));

            assertThatThrownBy(() -> engine.addTemplate(template))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("lowercase of its kind");
            assertThat(driver.events()).isEmpty();
        }

        @Test
        void templateWithoutTargetsIsRejected() {
            ConstraintTemplate template = new ConstraintTemplate("requiredlabels", "RequiredLabels", null, List.of());

            assertThatThrownBy(() -> engine.addTemplate(template))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("no targets specified");
        }

        @Test
        void templateWithTwoTargetsIsRejected() {
            List<TemplateCode> code = List.of(new TemplateCode("rec", "src"));
            ConstraintTemplate template = new ConstraintTemplate(
                    "requiredlabels",
                    "RequiredLabels",
                    null,
                    List.of(new TemplateTarget(TARGET, code), new TemplateTarget(OTHER_TARGET, code)));

            assertThatThrownBy(() -> engine.addTemplate(template))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("multi-target");
        }

        @Test
        void unknownTargetIsRejected() {
            assertThatThrownBy(() -> engine.addTemplate(Fixtures.template("RequiredLabels", "nope.target", "rec")))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("nope.target");
        }

        @Test
        void templateWithoutAKnownEngineHasNoDriver() {
            assertThatThrownBy(() -> engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rego")))
                    .isInstanceOf(NoDriverException.class)
                    .hasMessageContaining("rego");
        }

        @Test
        void kindMustBeADns1035Label() {
            ConstraintTemplate template = Fixtures.template("Required_Labels", TARGET, "rec");

            assertThatThrownBy(() -> engine.addTemplate(template))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("DNS-1035");
        }

        @Test
        void unknownSchemaTypeIsRejected() {
            ConstraintTemplate template = new ConstraintTemplate(
                    "requiredlabels",
                    "RequiredLabels",
                    json("{\"type\": \"object\", \"properties\": {\"labels\": {\"type\": \"strin\"}}}"),
                    List.of(new TemplateTarget(TARGET, List.of(new TemplateCode("rec", "src")))));

            assertThatThrownBy(() -> engine.addTemplate(template))
                    .isInstanceOf(InvalidConstraintTemplateException.class)
                    .hasMessageContaining("parameters.labels")
                    .hasMessageContaining("strin");
            assertThat(engine.templateNames()).isEmpty();
        }

        @Test
        void targetCannotChangeWhileConstraintsExist() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
            engine.addConstraint(Fixtures.constraint("RequiredLabels", "must-have-owner", "{}"));

            assertThatThrownBy(() -> engine.addTemplate(Fixtures.template("RequiredLabels", OTHER_TARGET, "rec")))
                    .isInstanceOf(ChangeTargetsException.class);
            assertThat(engine.getTemplate("requiredlabels").targetNames()).containsExactly(TARGET);
        }

        @Test
        void targetCanChangeWithoutConstraints() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));

            Responses responses = engine.addTemplate(Fixtures.template("RequiredLabels", OTHER_TARGET, "rec"));

            assertThat(responses.handled()).containsExactly(OTHER_TARGET);
            assertThat(engine.getTemplate("requiredlabels").targetNames()).containsExactly(OTHER_TARGET);
        }
    }

    @Nested
    class Remove {

        @Test
        void removingATemplateRemovesItsConstraintsFirst() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
            engine.addConstraint(Fixtures.constraint("RequiredLabels", "a", "{}"));
            engine.addConstraint(Fixtures.constraint("RequiredLabels", "b", "{}"));
            driver.clearEvents();

            Responses responses = engine.removeTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));

            assertThat(responses.handled()).containsExactly(TARGET);
            assertThat(driver.events())
                    .containsExactly(
                            "rec:removeConstraint:RequiredLabels/a",
                            "rec:removeConstraint:RequiredLabels/b",
                            "rec:removeTemplate:requiredlabels");
            assertThatThrownBy(() -> engine.getConstraint(Fixtures.constraint("RequiredLabels", "a", "{}")))
                    .isInstanceOf(MissingConstraintTemplateException.class);
        }

        @Test
        void removingAnUnknownTemplateIsANoOp() {
            Responses responses = engine.removeTemplate(Fixtures.template("Unknown", TARGET, "rec"));

            assertThat(responses.handled()).isEmpty();
            assertThat(driver.events()).isEmpty();
        }

        @Test
        void resetForgetsEverything() {
            engine.addTemplate(Fixtures.template("RequiredLabels", TARGET, "rec"));
            engine.addConstraint(Fixtures.constraint("RequiredLabels", "a", "{}"));

            engine.reset();

            assertThat(engine.templateNames()).isEmpty();
            assertThat(driver.constraintCount()).isZero();
            assertThat(driver.hasTemplate("requiredlabels")).isFalse();
        }
    }

    @Test
    void createSchemaRegistersNothing() {
        ConstraintTemplate template = Fixtures.template("RequiredLabels", TARGET, "rec");

        var schema = engine.createSchema(template);

        assertThat(schema.at("/properties/spec/properties/parameters")).isEqualTo(template.parametersSchema());
        assertThat(schema.at("/properties/spec/properties/match/properties/label/type").asText()).isEqualTo("string");
        assertThat(engine.templateNames()).isEmpty();
        assertThat(driver.events()).isEmpty();
    }
}
