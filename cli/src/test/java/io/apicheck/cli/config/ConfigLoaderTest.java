package io.apicheck.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.apicheck.core.engine.ValidatorOptions;
import io.apicheck.core.model.MessageDirection;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("apicheck.yaml"), content);
    }

    @Test
    @DisplayName("no file and no environment → defaults")
    void defaults() {
        CliConfig config = ConfigLoader.load(null, env::get);

        assertThat(config).isEqualTo(CliConfig.DEFAULT);
        assertThat(config.maxDepth()).isEqualTo(100);
        assertThat(config.maxSteps()).isEqualTo(1_000_000L);
        assertThat(config.dialect()).isEqualTo("auto");
        assertThat(config.outputFormat()).isEqualTo("text");
    }

    @Test
    @DisplayName("YAML values are read")
    void yamlValues() throws IOException {
        Path file = write("""
                limits:
                  max-depth: 12
                  max-steps: 5000
                validation:
                  dialect: openapi-3.0
                output:
                  format: json
                logging:
                  level: DEBUG
                  format: json
                """);

        CliConfig config = ConfigLoader.load(file, env::get);

        assertThat(config).isEqualTo(new CliConfig(12, 5000, "openapi-3.0", "json", "DEBUG", "json"));
        assertThat(config.toValidatorOptions(MessageDirection.RESPONSE))
                .isEqualTo(new ValidatorOptions(12, 5000, MessageDirection.RESPONSE));
    }

    @Test
    @DisplayName("environment overrides YAML; blank variables are ignored")
    void envOverridesYaml() throws IOException {
        Path file = write("""
                limits:
                  max-depth: 12
                output:
                  format: json
                """);
        env.put("APICHECK_MAX_DEPTH", " 30 ");
        env.put("APICHECK_OUTPUT", "   ");
        env.put("APICHECK_DIALECT", "json-schema");

        CliConfig config = ConfigLoader.load(file, env::get);

        assertThat(config.maxDepth()).isEqualTo(30);
        assertThat(config.outputFormat()).isEqualTo("json");
        assertThat(config.dialect()).isEqualTo("json-schema");
    }

    @Test
    @DisplayName("an empty file yields defaults")
    void emptyFile() throws IOException {
        assertThat(ConfigLoader.load(write(""), env::get)).isEqualTo(CliConfig.DEFAULT);
    }

    @Test
    @DisplayName("missing file, non-mapping root and malformed YAML are rejected")
    void badFiles() throws IOException {
        Path missing = tempDir.resolve("absent.yaml");
        assertThatThrownBy(() -> ConfigLoader.load(missing, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found");

        Path list = write("- a\n- b\n");
        assertThatThrownBy(() -> ConfigLoader.load(list, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("mapping");

        Path broken = write("limits: [1\n");
        assertThatThrownBy(() -> ConfigLoader.load(broken, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    @DisplayName("invalid values are rejected with the offending key")
    void badValues() throws IOException {
        Path zeroDepth = write("limits:\n  max-depth: 0\n");
        assertThatThrownBy(() -> ConfigLoader.load(zeroDepth, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("limits.max-depth");

        Path textSteps = write("limits:\n  max-steps: lots\n");
        assertThatThrownBy(() -> ConfigLoader.load(textSteps, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("limits.max-steps");

        Path badFormat = write("output:\n  format: xml\n");
        assertThatThrownBy(() -> ConfigLoader.load(badFormat, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("output.format");

        env.put("APICHECK_MAX_STEPS", "1e6");
        assertThatThrownBy(() -> ConfigLoader.load(null, env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("APICHECK_MAX_STEPS");
    }
}
