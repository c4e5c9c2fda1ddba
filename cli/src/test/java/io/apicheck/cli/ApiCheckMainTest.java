package io.apicheck.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@DisplayName("apicheck command line")
class ApiCheckMainTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String PET_SCHEMA = """
            {"type": "object", "required": ["id", "name"],
             "properties": {"id": {"type": "integer"}, "name": {"type": "string"}}}
            """;

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();
    private StringWriter out;
    private StringWriter err;
    private Path schema;

    @BeforeEach
    void setUp() throws IOException {
        schema = write("pet.schema.json", PET_SCHEMA);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = ApiCheckMain.commandLine(env::get);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    @DisplayName("valid data → exit 0 and a success line")
    void validData() throws IOException {
        Path data = write("pet.json", "{\"id\": 1, \"name\": \"Rex\"}");

        assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.VALID);
        assertThat(out.toString()).isEqualToIgnoringNewLines("Validation successful!");
    }

    @Test
    @DisplayName("invalid data → exit 1 and one line per failure")
    void invalidData() throws IOException {
        Path data = write("pet.json", "{\"id\": \"1\"}");

        assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.INVALID);
        assertThat(out.toString().lines())
                .containsExactly(
                        "Validation failed with 2 error(s):",
                        "  (root): Missing required property 'name' [missing_required] at #/required",
                        "  /id: Expected integer but found string [type_mismatch] at #/properties/id/type");
    }

    @Test
    @DisplayName("YAML data is accepted by extension")
    void yamlData() throws IOException {
        Path data = write("pet.yml", "id: 1\nname: Rex\n");

        assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.VALID);
    }

    @Test
    @DisplayName("--data_type overrides the extension")
    void explicitDataType() throws IOException {
        Path data = write("pet.txt", "{\"id\": 1, \"name\": \"Rex\"}");

        assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.INPUT_ERROR);
        assertThat(err.toString()).contains("Unsupported file type");
        assertThat(run("--data_type", "JSON", data.toString(), schema.toString())).isEqualTo(ExitCodes.VALID);
    }

    @Nested
    @DisplayName("input errors → exit 2")
    class InputErrors {

        @Test
        @DisplayName("missing data file")
        void missingFile() {
            assertThat(run(tempDir.resolve("absent.json").toString(), schema.toString()))
                    .isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).startsWith("Error: File not found");
            assertThat(out.toString()).isEmpty();
        }

        @Test
        @DisplayName("malformed data")
        void malformedData() throws IOException {
            Path data = write("broken.json", "{\"id\": ");

            assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).contains("Error: Malformed JSON data");
        }

        @Test
        @DisplayName("malformed schema")
        void malformedSchema() throws IOException {
            Path data = write("pet.json", "{}");
            Path badSchema = write("bad.yaml", "type: [object\n");

            assertThat(run(data.toString(), badSchema.toString())).isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).contains("Malformed YAML schema");
        }

        @Test
        @DisplayName("unknown --output value")
        void badOutput() throws IOException {
            Path data = write("pet.json", "{}");

            assertThat(run("--output", "xml", data.toString(), schema.toString()))
                    .isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).contains("Invalid --output 'xml'");
        }

        @Test
        @DisplayName("invalid environment override")
        void badEnv() throws IOException {
            Path data = write("pet.json", "{}");
            env.put("APICHECK_MAX_DEPTH", "deep");

            assertThat(run(data.toString(), schema.toString())).isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).contains("APICHECK_MAX_DEPTH");
        }

        @Test
        @DisplayName("missing positional argument")
        void missingArgument() {
            assertThat(run("only-one.json")).isEqualTo(ExitCodes.INPUT_ERROR);
            assertThat(err.toString()).contains("schema_file");
        }
    }

    @Test
    @DisplayName("step limit from the environment → exit 3")
    void stepLimit() throws IOException {
        Path listSchema = write("list.json", "{\"type\": \"array\", \"items\": {\"type\": \"integer\"}}");
        String items = IntStream.range(0, 30).mapToObj(Integer::toString).collect(Collectors.joining(",", "[", "]"));
        Path data = write("numbers.json", items);
        env.put("APICHECK_MAX_STEPS", "10");

        assertThat(run(data.toString(), listSchema.toString())).isEqualTo(ExitCodes.LIMIT_EXCEEDED);
        assertThat(err.toString()).contains("max-steps 10");
    }

    @Test
    @DisplayName("JSON output for a single file")
    void jsonOutput() throws IOException {
        Path data = write("pet.json", "{\"id\": 1}");

        assertThat(run("--output", "json", data.toString(), schema.toString())).isEqualTo(ExitCodes.INVALID);

        JsonNode report = JSON.readTree(out.toString());
        assertThat(report.get("file").textValue()).isEqualTo(data.toString());
        assertThat(report.get("valid").booleanValue()).isFalse();
        assertThat(report.get("errorCount").intValue()).isEqualTo(1);
        assertThat(report.get("errors").get(0).get("kind").textValue()).isEqualTo("missing_required");
    }

    @Test
    @DisplayName("several data files → labelled results and the worst exit code")
    void severalFiles() throws IOException {
        Path good = write("good.json", "{\"id\": 1, \"name\": \"Rex\"}");
        Path bad = write("bad.json", "{\"id\": 1}");

        assertThat(run(good.toString(), schema.toString(), bad.toString())).isEqualTo(ExitCodes.INVALID);
        assertThat(out.toString())
                .contains(good + ": Validation successful!")
                .contains(bad + ": Validation failed with 1 error(s):");

        assertThat(run("--output", "json", good.toString(), schema.toString(), bad.toString()))
                .isEqualTo(ExitCodes.INVALID);
        JsonNode reports = JSON.readTree(out.toString());
        assertThat(reports.isArray()).isTrue();
        assertThat(reports.get(0).get("valid").booleanValue()).isTrue();
        assertThat(reports.get(1).get("valid").booleanValue()).isFalse();
    }

    @Test
    @DisplayName("OpenAPI component with pointer and direction")
    void openApiComponent() throws IOException {
        Path api = write("api.yaml", """
                openapi: 3.0.3
                info: {title: Pets, version: "1"}
                paths: {}
                components:
                  schemas:
                    Pet:
                      type: object
                      required: [id, name]
                      properties:
                        id: {type: integer, readOnly: true}
                        name: {type: string, nullable: true}
                """);
        Path request = write("request.json", "{\"name\": null}");
        Path response = write("response.json", "{\"id\": 3, \"name\": \"Rex\"}");
        String pointer = "#/components/schemas/Pet";

        assertThat(run("--schema_pointer", pointer, "--direction", "request", request.toString(), api.toString()))
                .isEqualTo(ExitCodes.VALID);
        assertThat(run("--schema_pointer", pointer, "--direction", "REQUEST", response.toString(), api.toString()))
                .isEqualTo(ExitCodes.INVALID);
        assertThat(out.toString()).contains("[access_mode_violation]");
        assertThat(run("--schema_pointer", pointer, "--direction", "response", response.toString(), api.toString()))
                .isEqualTo(ExitCodes.VALID);
    }

    @Test
    @DisplayName("--dialect json-schema disables OpenAPI keywords")
    void forcedDialect() throws IOException {
        Path api = write("api.json", """
                {"openapi": "3.0.0", "components": {"schemas": {"N": {"type": "string", "nullable": true}}}}
                """);
        Path data = write("null.json", "null");
        String pointer = "#/components/schemas/N";

        assertThat(run("--schema_pointer", pointer, data.toString(), api.toString())).isEqualTo(ExitCodes.VALID);
        assertThat(run("--dialect", "json-schema", "--schema_pointer", pointer, data.toString(), api.toString()))
                .isEqualTo(ExitCodes.INVALID);
    }

    @Test
    @DisplayName("flags override the config file")
    void configFile() throws IOException {
        Path config = write("apicheck.yaml", """
                output:
                  format: json
                logging:
                  level: WARNING
                """);
        Path data = write("pet.json", "{\"id\": 1, \"name\": \"Rex\"}");

        assertThat(run("--config", config.toString(), data.toString(), schema.toString()))
                .isEqualTo(ExitCodes.VALID);
        assertThat(JSON.readTree(out.toString()).get("valid").booleanValue()).isTrue();

        assertThat(run("--config", config.toString(), "--output", "text", data.toString(), schema.toString()))
                .isEqualTo(ExitCodes.VALID);
        assertThat(out.toString()).contains("Validation successful!");
    }

    @Test
    @DisplayName("--help lists the exit codes")
    void help() {
        assertThat(run("--help")).isZero();
        assertThat(out.toString()).contains("Exit codes:").contains("--schema_pointer");
    }
}
