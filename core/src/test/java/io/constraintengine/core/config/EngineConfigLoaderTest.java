package io.constraintengine.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.constraintengine.core.model.EnforcementPoints;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link EngineConfigLoader}. */
class EngineConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path path = tempDir.resolve("engine.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    @Test
    void yamlValuesAreApplied() throws IOException {
        Path config = write("""
                drivers:
                  priority: [jslt, other]
                enforcement-points:
                  - audit.gatekeeper.sh
                data:
                  ignore-no-referential-driver: true
                """);

        EngineConfig loaded = EngineConfigLoader.load(config, NO_ENV);

        assertThat(loaded.driverPriority()).containsExactly("jslt", "other");
        assertThat(loaded.enforcementPoints()).containsExactly(EnforcementPoints.AUDIT);
        assertThat(loaded.ignoreNoReferentialDriver()).isTrue();
    }

    @Test
    void emptyFileYieldsDefaults() throws IOException {
        EngineConfig loaded = EngineConfigLoader.load(write(""), NO_ENV);

        assertThat(loaded.driverPriority()).isEmpty();
        assertThat(loaded.enforcementPoints()).isEqualTo(EnforcementPoints.DEFAULTS);
        assertThat(loaded.ignoreNoReferentialDriver()).isFalse();
    }

    @Test
    void environmentOverridesYaml() throws IOException {
        Path config = write("""
                drivers:
                  priority: [jslt]
                data:
                  ignore-no-referential-driver: false
                """);
        Map<String, String> env = Map.of(
                "CONSTRAINT_ENGINE_DRIVER_PRIORITY", " other , jslt ",
                "CONSTRAINT_ENGINE_IGNORE_NO_REFERENTIAL_DRIVER", "TRUE");

        EngineConfig loaded = EngineConfigLoader.load(config, env::get);

        assertThat(loaded.driverPriority()).containsExactly("other", "jslt");
        assertThat(loaded.ignoreNoReferentialDriver()).isTrue();
    }

    @Test
    void blankEnvironmentValuesCountAsUnset() {
        EngineConfig loaded = EngineConfigLoader.fromEnvironment(Map.of("CONSTRAINT_ENGINE_ENFORCEMENT_POINTS", "  ")::get);

        assertThat(loaded.enforcementPoints()).isEqualTo(EnforcementPoints.DEFAULTS);
    }

    @Test
    void invalidBooleanInEnvironmentIsRejected() {
        assertThatThrownBy(() -> EngineConfigLoader.fromEnvironment(
                        Map.of("CONSTRAINT_ENGINE_IGNORE_NO_REFERENTIAL_DRIVER", "yes")::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("yes");
    }

    @Test
    void nonBooleanFlagInYamlIsRejected() throws IOException {
        Path config = write("""
                data:
                  ignore-no-referential-driver: "sometimes"
                """);

        assertThatThrownBy(() -> EngineConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("must be a boolean");
    }

    @Test
    void emptyEnforcementPointListIsRejected() throws IOException {
        Path config = write("enforcement-points: []\n");

        assertThatThrownBy(() -> EngineConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> EngineConfigLoader.load(tempDir.resolve("absent.yaml"), NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedYamlIsRejected() throws IOException {
        Path config = write("drivers: [unclosed\n");

        assertThatThrownBy(() -> EngineConfigLoader.load(config, NO_ENV)).isInstanceOf(ConfigLoadException.class);
    }

    @Test
    void configFromTestResourcesLoads() throws Exception {
        Path config = Path.of(getClass().getResource("/config/engine.yaml").toURI());

        EngineConfig loaded = EngineConfigLoader.load(config, NO_ENV);

        assertThat(loaded.driverPriority()).containsExactly("jslt");
        assertThat(loaded.enforcementPoints())
                .containsExactly(EnforcementPoints.WEBHOOK, EnforcementPoints.AUDIT);
    }
}
