package io.apicheck.core.report;

import static io.apicheck.core.testkit.TestDocuments.instance;
import static io.apicheck.core.testkit.TestDocuments.schema;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apicheck.core.engine.SchemaValidator;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Instance;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.ValidationResult;
import io.apicheck.core.schema.SchemaDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DiagnosticReporter")
class DiagnosticReporterTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final DiagnosticReporter reporter = new DiagnosticReporter();
    private final SchemaValidator validator = new SchemaValidator();
    private final SchemaDocument pet = schema("""
            {"type": "object", "required": ["id"],
             "properties": {"id": {"type": "integer"}, "tags": {"items": {"type": "string"}}}}
            """);

    @Test
    @DisplayName("text lines name the pointer, message, code and schema location")
    void textLines() {
        ValidationResult typeMismatch = validator.validate(pet, instance("{\"id\": \"7\"}"));
        ValidationResult missing = validator.validate(pet, instance("{}"));

        assertThat(reporter.line(typeMismatch.failures().get(0)))
                .isEqualTo("/id: Expected integer but found string [type_mismatch] at #/properties/id/type");
        assertThat(reporter.line(missing.failures().get(0)))
                .isEqualTo("(root): Missing required property 'id' [missing_required] at #/required");
    }

    @Test
    @DisplayName("text report is empty for a valid result")
    void validText() {
        assertThat(reporter.toText(ValidationResult.success())).isEmpty();
    }

    @Test
    @DisplayName("JSON report carries count, codes, categories and RFC 6901 pointers")
    void jsonReport() {
        ValidationResult result = validator.validate(pet, instance("{\"id\": 1, \"tags\": [\"a\", 2]}"));

        ObjectNode report = reporter.toJson(result);

        assertThat(report.get("valid").booleanValue()).isFalse();
        assertThat(report.get("errorCount").intValue()).isEqualTo(1);
        JsonNode error = report.get("errors").get(0);
        assertThat(error.get("kind").textValue()).isEqualTo("type_mismatch");
        assertThat(error.get("category").textValue()).isEqualTo("semantic");
        assertThat(error.get("instancePath").textValue()).isEqualTo("/tags/1");
        assertThat(error.get("schemaPath").textValue()).isEqualTo("/properties/tags/items/type");
        assertThat(error.get("details").get("expected").textValue()).isEqualTo("string");
    }

    @Test
    @DisplayName("valid result renders as valid with no errors")
    void validJson() throws Exception {
        JsonNode parsed = JSON.readTree(reporter.toJsonString(ValidationResult.success()));

        assertThat(parsed.get("valid").booleanValue()).isTrue();
        assertThat(parsed.get("errorCount").intValue()).isZero();
        assertThat(parsed.get("errors")).isEmpty();
    }

    @Test
    @DisplayName("nested records, numbers and lists in details are rendered as JSON")
    void nestedDetails() {
        FailureRecord inner = FailureRecord.of(
                Location.of("a~b"), Location.of("properties", "a/b"), FailureKind.FALSE_SCHEMA, "no");
        FailureRecord outer = new FailureRecord(
                Location.ROOT,
                Location.of("anyOf"),
                FailureKind.ANY_OF_NO_MATCH,
                "none",
                new LinkedHashMap<>(Map.of("bestAlternativeFailures", List.of(inner))));

        JsonNode rendered = reporter.toJson(outer);

        assertThat(rendered.get("instancePath").textValue()).isEmpty();
        JsonNode nested = rendered.get("details").get("bestAlternativeFailures").get(0);
        assertThat(nested.get("instancePath").textValue()).isEqualTo("/a~0b");
        assertThat(nested.get("schemaPath").textValue()).isEqualTo("/properties/a~1b");
        assertThat(nested.get("kind").textValue()).isEqualTo("false_schema");
    }

    @Test
    @DisplayName("structural failures are categorised as such")
    void structuralCategory() {
        ValidationResult result = validator.validate(schema("{\"$ref\": \"#/nowhere\"}"), instance("1"));

        assertThat(reporter.toJson(result).get("errors").get(0).get("category").textValue())
                .isEqualTo("structural");
    }

    @Test
    @DisplayName("editing a report leaves the instance it quotes untouched")
    void reportDoesNotAliasInstance() {
        Instance data = instance("{\"v\": 1}");
        FailureRecord failure = new FailureRecord(
                Location.ROOT,
                Location.of("const"),
                FailureKind.CONST_MISMATCH,
                "differs",
                Map.of("actual", data.node()));

        ObjectNode report = reporter.toJson(ValidationResult.of(List.of(failure)));
        ((ObjectNode) report.get("errors").get(0).get("details").get("actual")).put("v", 2);

        assertThat(data.node().get("v").intValue()).isEqualTo(1);
    }
}
