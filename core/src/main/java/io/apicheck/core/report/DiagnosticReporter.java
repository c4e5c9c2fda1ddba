package io.apicheck.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.ValidationResult;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ValidationResult} for people and for machines.
 *
 * <p>
 * Two renderings:
 * <ul>
 * <li><b>JSON</b>: {@code {"valid", "errorCount", "errors": [...]}}, each error carrying
 * {@code kind}, {@code category}, {@code instancePath} and {@code schemaPath} (RFC 6901 pointers),
 * {@code message} and {@code details}. Nested records inside details (e.g. the closest
 * {@code anyOf} alternative) are rendered the same way.</li>
 * <li><b>Text</b>: one line per record,
 * {@code <instance pointer or (root)>: <message> [<kind>] at #<schema pointer>}.</li>
 * </ul>
 *
 * <p>
 * Output depends only on the result, so equal results render identically. Thread-safe and
 * immutable.
 */
public final class DiagnosticReporter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
    private static final String ROOT_LABEL = "(root)";

    /** Builds the JSON report tree. */
    public ObjectNode toJson(ValidationResult result) {
        ObjectNode report = NODES.objectNode();
        report.put("valid", result.valid());
        report.put("errorCount", result.failureCount());
        ArrayNode errors = report.putArray("errors");
        for (FailureRecord failure : result.failures()) {
            errors.add(toJson(failure));
        }
        return report;
    }

    /** Renders the JSON report as indented text. */
    public String toJsonString(ValidationResult result) {
        try {
            return MAPPER.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            // a tree made of plain nodes always serializes
            throw new IllegalStateException("Could not serialize validation report", e);
        }
    }

    /** Renders one line per failure; empty for a valid result. */
    public String toText(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        for (FailureRecord failure : result.failures()) {
            sb.append(line(failure)).append(System.lineSeparator());
        }
        return sb.toString();
    }

    /** Renders a single failure as a text line, without a line terminator. */
    public String line(FailureRecord failure) {
        String where = failure.instancePath().isRoot() ? ROOT_LABEL : failure.instancePath().toPointer();
        return where + ": " + failure.message() + " [" + failure.kind().code() + "] at #"
                + failure.schemaPath().toPointer();
    }

    ObjectNode toJson(FailureRecord failure) {
        ObjectNode error = NODES.objectNode();
        error.put("kind", failure.kind().code());
        error.put("category", failure.category().name().toLowerCase(Locale.ROOT));
        error.put("instancePath", failure.instancePath().toPointer());
        error.put("schemaPath", failure.schemaPath().toPointer());
        error.put("message", failure.message());
        ObjectNode details = error.putObject("details");
        for (Map.Entry<String, Object> entry : failure.details().entrySet()) {
            details.set(entry.getKey(), toNode(entry.getValue()));
        }
        return error;
    }

    private JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode node) {
            // details may hold instance nodes; the report must not alias them
            return node.deepCopy();
        }
        if (value instanceof FailureRecord nested) {
            return toJson(nested);
        }
        if (value instanceof Location location) {
            return NODES.textNode(location.toPointer());
        }
        if (value instanceof Collection<?> items) {
            ArrayNode array = NODES.arrayNode();
            for (Object item : items) {
                array.add(toNode(item));
            }
            return array;
        }
        if (value instanceof BigDecimal decimal) {
            return NODES.numberNode(decimal);
        }
        if (value instanceof BigInteger integer) {
            return NODES.numberNode(integer);
        }
        if (value instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (value instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof String s) {
            return NODES.textNode(s);
        }
        return MAPPER.valueToTree(value);
    }
}
