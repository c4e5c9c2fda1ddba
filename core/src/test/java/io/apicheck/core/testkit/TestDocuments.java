package io.apicheck.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apicheck.core.model.ContentType;
import io.apicheck.core.model.Dialect;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Instance;
import io.apicheck.core.model.ValidationResult;
import io.apicheck.core.schema.DocumentParser;
import io.apicheck.core.schema.SchemaDocument;
import java.util.List;

/** Shorthands for building schema documents and instances from inline JSON in tests. */
public final class TestDocuments {

    private static final DocumentParser PARSER = new DocumentParser();
    private static final ObjectMapper JSON = new ObjectMapper();

    private TestDocuments() {}

    /** Parses a JSON schema, detecting the dialect. */
    public static SchemaDocument schema(String json) {
        return PARSER.parseSchema(json, ContentType.JSON, "test-schema.json");
    }

    public static SchemaDocument schema(String json, Dialect dialect) {
        return PARSER.parseSchema(json, ContentType.JSON, "test-schema.json", dialect);
    }

    public static Instance instance(String json) {
        return PARSER.parseInstance(json, ContentType.JSON, "test-data.json");
    }

    /** Builds {"next": {"next": ...}} nested {@code depth} levels deep. */
    public static Instance nested(String key, int depth) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode current = root;
        for (int i = 0; i < depth; i++) {
            current = current.putObject(key);
        }
        return Instance.of(root);
    }

    public static JsonNode json(String json) {
        return instance(json).node();
    }

    public static List<FailureKind> kinds(ValidationResult result) {
        return result.failures().stream().map(FailureRecord::kind).toList();
    }

    public static List<String> instancePointers(ValidationResult result) {
        return result.failures().stream().map(f -> f.instancePath().toPointer()).toList();
    }
}
