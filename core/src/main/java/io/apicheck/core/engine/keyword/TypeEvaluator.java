package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.InstanceType;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code type}, single or union. {@code integer} values satisfy {@code number}. In OpenAPI 3.0
 * documents {@code nullable: true} also admits {@code null}.
 */
public final class TypeEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.TYPE_CONSTRAINT;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("type", "nullable");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        if (!"type".equals(keyword)) {
            return List.of(); // nullable is read together with type
        }
        List<String> declared = declaredTypes(node.keyword("type"));
        if (declared == null) {
            return invalidKeyword(instancePath, schemaPath, "type", "expected a string or an array of strings");
        }
        InstanceType actual = InstanceType.of(instance);
        for (String type : declared) {
            if (actual.satisfies(type)) {
                return List.of();
            }
        }
        if (actual == InstanceType.NULL && nullable(node, context)) {
            return List.of();
        }

        Object expected = declared.size() == 1 ? declared.get(0) : declared;
        String message = declared.size() == 1
                ? "Expected " + declared.get(0) + " but found " + actual.typeName()
                : "Expected one of " + declared + " but found " + actual.typeName();
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child("type"),
                FailureKind.TYPE_MISMATCH,
                message,
                details("expected", expected, "actual", actual.typeName())));
    }

    private static boolean nullable(SchemaNode node, EvaluationContext context) {
        JsonNode nullable = node.keyword("nullable");
        return context.dialect().openApiKeywords() && nullable != null && nullable.asBoolean(false);
    }

    private static List<String> declaredTypes(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return List.of(value.textValue());
        }
        if (!value.isArray()) {
            return null;
        }
        List<String> types = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                return null;
            }
            types.add(element.textValue());
        }
        return types;
    }
}
