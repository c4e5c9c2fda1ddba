package io.apicheck.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * limits:
 *   max-depth: 100
 *   max-steps: 1000000
 * validation:
 *   dialect: auto          # auto | json-schema | openapi-3.0
 * output:
 *   format: text           # text | json
 * logging:
 *   level: INFO
 *   format: text           # text | json
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code APICHECK_MAX_DEPTH},
 * {@code APICHECK_MAX_STEPS}, {@code APICHECK_DIALECT}, {@code APICHECK_OUTPUT},
 * {@code APICHECK_LOG_LEVEL}, {@code APICHECK_LOG_FORMAT}). An env var is "set" if and only if it
 * is defined and its trimmed value is non-empty. Missing keys keep the {@link CliConfig.Builder}
 * defaults.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration using {@link System#getenv} for the overlay.
     *
     * @param configPath the YAML file, or {@code null} for defaults plus environment only
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration.
     *
     * @param configPath the YAML file, or {@code null} for defaults plus environment only
     * @param envLookup  environment variable lookup; {@code null} result means undefined
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or malformed, or a value is invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        JsonNode root = configPath == null ? YAML_MAPPER.createObjectNode() : readYaml(configPath);
        CliConfig.Builder builder = CliConfig.builder();

        JsonNode limits = root.path("limits");
        if (limits.has("max-depth")) builder.maxDepth(intValue(limits.get("max-depth"), "limits.max-depth"));
        if (limits.has("max-steps")) builder.maxSteps(longValue(limits.get("max-steps"), "limits.max-steps"));

        JsonNode validation = root.path("validation");
        if (validation.has("dialect")) builder.dialect(validation.get("dialect").asText());

        JsonNode output = root.path("output");
        if (output.has("format")) builder.outputFormat(output.get("format").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());

        envInt(envLookup, "APICHECK_MAX_DEPTH", builder::maxDepth);
        envLong(envLookup, "APICHECK_MAX_STEPS", builder::maxSteps);
        envString(envLookup, "APICHECK_DIALECT", builder::dialect);
        envString(envLookup, "APICHECK_OUTPUT", builder::outputFormat);
        envString(envLookup, "APICHECK_LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "APICHECK_LOG_FORMAT", builder::loggingFormat);

        return builder.build();
    }

    private static JsonNode readYaml(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static int intValue(JsonNode node, String key) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got: " + node);
        }
        return node.intValue();
    }

    private static long longValue(JsonNode node, String key) {
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got: " + node);
        }
        return node.longValue();
    }

    // --- Environment helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
            }
        }
    }
}
