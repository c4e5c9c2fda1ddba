package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.engine.JsonValues;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.List;
import java.util.Set;

/** {@code enum} and {@code const}, compared with {@link JsonValues#equal structural equality}. */
public final class EnumEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.ENUM;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("enum", "const");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        JsonNode value = node.keyword(keyword);
        if ("const".equals(keyword)) {
            if (JsonValues.equal(value, instance)) {
                return List.of();
            }
            return List.of(new FailureRecord(
                    instancePath,
                    schemaPath.child("const"),
                    FailureKind.CONST_MISMATCH,
                    "Value " + JsonValues.describe(instance) + " does not equal " + JsonValues.describe(value),
                    details("expected", value, "actual", instance)));
        }

        if (value == null || !value.isArray()) {
            return invalidKeyword(instancePath, schemaPath, "enum", "expected an array");
        }
        for (JsonNode allowed : value) {
            if (JsonValues.equal(allowed, instance)) {
                return List.of();
            }
        }
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child("enum"),
                FailureKind.ENUM_MISMATCH,
                "Value " + JsonValues.describe(instance) + " is not one of " + JsonValues.describe(value),
                details("allowed", value, "actual", instance)));
    }
}
