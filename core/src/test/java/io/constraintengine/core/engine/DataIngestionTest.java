package io.constraintengine.core.engine;

import static io.constraintengine.core.testkit.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.constraintengine.core.cache.InMemoryDataCache;
import io.constraintengine.core.error.DriverException;
import io.constraintengine.core.error.NoReferentialDriverException;
import io.constraintengine.core.error.TargetHandlerException;
import io.constraintengine.core.model.Responses;
import io.constraintengine.core.testkit.RecordingDriver;
import io.constraintengine.core.testkit.StubTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for referential data ingestion and removal. */
class DataIngestionTest {

    private static final String TARGET = "test.target";

    private RecordingDriver driver;
    private InMemoryDataCache cache;
    private ConstraintEngine engine;

    @BeforeEach
    void setUp() {
        driver = new RecordingDriver("rec");
        cache = new InMemoryDataCache();
        engine = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .driver(driver)
                .dataCache(cache)
                .build();
    }

    @Test
    void addedDataReachesDriverAndCache() {
        Responses responses = engine.addData(json("{\"key\": \"ns/a/web\", \"label\": \"web\"}"));

        assertThat(responses.handled()).containsExactly(TARGET);
        assertThat(responses.hasErrors()).isFalse();
        assertThat(driver.data(TARGET)).containsOnlyKeys("ns/a/web");
        assertThat(cache.get(TARGET, "ns/a/web")).hasValueSatisfying(v -> assertThat(v.path("label").asText())
                .isEqualTo("web"));
    }

    @Test
    void removalDropsEverythingBelowTheKey() {
        engine.addData(json("{\"key\": \"ns/a/web\"}"));
        engine.addData(json("{\"key\": \"ns/a/db\"}"));
        engine.addData(json("{\"key\": \"ns/b/web\"}"));

        Responses responses = engine.removeData(json("{\"key\": \"ns/a\"}"));

        assertThat(responses.handled()).containsExactly(TARGET);
        assertThat(driver.data(TARGET)).containsOnlyKeys("ns/b/web");
        assertThat(cache.snapshot(TARGET)).containsOnlyKeys("ns/b/web");
    }

    @Test
    void wipeClearsTheTargetButCannotBeAdded() {
        engine.addData(json("{\"key\": \"ns/a/web\"}"));

        Responses added = engine.addData(StubTarget.WIPE);
        Responses removed = engine.removeData(StubTarget.WIPE);

        assertThat(added.errors()).hasValueSatisfying(e -> assertThat(e.get(TARGET))
                .isInstanceOf(TargetHandlerException.class));
        assertThat(removed.handled()).containsExactly(TARGET);
        assertThat(driver.data(TARGET)).isEmpty();
        assertThat(cache.size(TARGET)).isZero();
    }

    @Test
    void unhandledDataIsIgnored() {
        Responses responses = engine.addData(json("{\"no-key\": true}"));

        assertThat(responses.handled()).isEmpty();
        assertThat(driver.events()).isEmpty();
    }

    @Test
    void driverFailureOnAddRollsBackTheCache() {
        driver.failData(true);

        Responses responses = engine.addData(json("{\"key\": \"ns/a/web\"}"));

        assertThat(responses.handled()).isEmpty();
        assertThat(responses.errors()).hasValueSatisfying(e -> assertThat(e.get(TARGET))
                .isInstanceOf(DriverException.class)
                .hasMessageContaining("ns/a/web"));
        assertThat(cache.size(TARGET)).isZero();
    }

    @Test
    void driverFailureOnRemoveKeepsTheCacheEntry() {
        engine.addData(json("{\"key\": \"ns/a/web\"}"));
        driver.failData(true);

        Responses responses = engine.removeData(json("{\"key\": \"ns/a/web\"}"));

        assertThat(responses.hasErrors()).isTrue();
        assertThat(cache.get(TARGET, "ns/a/web")).isPresent();
    }

    @Test
    void onlyDriversThatAcceptDataReceiveIt() {
        RecordingDriver stateless = new RecordingDriver("stateless").acceptsData(false);
        ConstraintEngine twoDrivers = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .driver(stateless)
                .driver(driver)
                .build();

        twoDrivers.addData(json("{\"key\": \"ns/a/web\"}"));

        assertThat(stateless.events()).isEmpty();
        assertThat(driver.events()).containsExactly("rec:addData:ns/a/web");
    }

    @Test
    void dataWithoutAReferentialDriverFails() {
        ConstraintEngine noData = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .driver(new RecordingDriver("stateless").acceptsData(false))
                .build();

        assertThatThrownBy(() -> noData.addData(json("{\"key\": \"ns/a/web\"}")))
                .isInstanceOf(NoReferentialDriverException.class)
                .hasMessageContaining("stateless");
    }

    @Test
    void missingReferentialDriverCanBeIgnored() {
        RecordingDriver stateless = new RecordingDriver("stateless").acceptsData(false);
        ConstraintEngine noData = ConstraintEngine.builder()
                .target(new StubTarget(TARGET))
                .driver(stateless)
                .ignoreNoReferentialDriver(true)
                .build();

        Responses responses = noData.removeData(json("{\"key\": \"ns/a/web\"}"));

        assertThat(responses.handled()).isEmpty();
        assertThat(responses.hasErrors()).isFalse();
        assertThat(stateless.events()).isEmpty();
    }
}
