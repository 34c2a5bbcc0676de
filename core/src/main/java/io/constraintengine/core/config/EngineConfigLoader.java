package io.constraintengine.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * drivers:
 *   priority: [jslt]
 * enforcement-points:
 *   - validation.gatekeeper.sh
 *   - audit.gatekeeper.sh
 * data:
 *   ignore-no-referential-driver: false
 * </pre>
 *
 * <p>Environment variables take precedence over YAML. A variable counts as set only if it is
 * defined and non-blank after trimming; list values are comma-separated.
 */
public final class EngineConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_DRIVER_PRIORITY = "CONSTRAINT_ENGINE_DRIVER_PRIORITY";
    static final String ENV_ENFORCEMENT_POINTS = "CONSTRAINT_ENGINE_ENFORCEMENT_POINTS";
    static final String ENV_IGNORE_NO_REFERENTIAL_DRIVER = "CONSTRAINT_ENGINE_IGNORE_NO_REFERENTIAL_DRIVER";

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}. The
     * lookup returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Builds configuration from defaults and the environment only. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("configuration root must be a mapping");
        }

        JsonNode drivers = root.path("drivers");
        if (drivers.has("priority")) builder.driverPriority(stringList(drivers.get("priority"), "drivers.priority"));
        if (root.has("enforcement-points"))
            builder.enforcementPoints(stringList(root.get("enforcement-points"), "enforcement-points"));
        JsonNode data = root.path("data");
        if (data.has("ignore-no-referential-driver")) {
            JsonNode flag = data.get("ignore-no-referential-driver");
            if (!flag.isBoolean()) {
                throw new ConfigLoadException("data.ignore-no-referential-driver must be a boolean");
            }
            builder.ignoreNoReferentialDriver(flag.asBoolean());
        }

        // --- Environment variable overlay ---
        envList(envLookup, ENV_DRIVER_PRIORITY, builder::driverPriority);
        envList(envLookup, ENV_ENFORCEMENT_POINTS, builder::enforcementPoints);
        if (isSet(envLookup, ENV_IGNORE_NO_REFERENTIAL_DRIVER)) {
            builder.ignoreNoReferentialDriver(parseBoolean(envLookup.apply(ENV_IGNORE_NO_REFERENTIAL_DRIVER)));
        }
        return builder.build();
    }

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new ConfigLoadException(key + " must be a list of non-empty strings");
            }
            values.add(element.asText().trim());
        }
        return values;
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envList(Function<String, String> envLookup, String envVar, Consumer<List<String>> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Arrays.stream(envLookup.apply(envVar).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }
    }

    private static boolean parseBoolean(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) {
            return true;
        }
        if (v.equals("false")) {
            return false;
        }
        throw new ConfigLoadException("Invalid boolean for " + ENV_IGNORE_NO_REFERENTIAL_DRIVER + ": '" + value + "'");
    }
}
