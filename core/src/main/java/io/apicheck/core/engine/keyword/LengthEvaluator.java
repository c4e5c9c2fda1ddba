package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;
import static io.apicheck.core.engine.keyword.KeywordSupport.nonNegativeInt;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.List;
import java.util.Set;

/** String length (in code points) and object property-count bounds. */
public final class LengthEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.TYPE_CONSTRAINT;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("minLength", "maxLength", "minProperties", "maxProperties");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        boolean stringBound = keyword.endsWith("Length");
        if (stringBound ? !instance.isTextual() : !instance.isObject()) {
            return List.of();
        }
        int bound = nonNegativeInt(node.keyword(keyword));
        if (bound < 0) {
            return invalidKeyword(instancePath, schemaPath, keyword, "expected a non-negative integer");
        }
        int actual = stringBound
                ? instance.textValue().codePointCount(0, instance.textValue().length())
                : instance.size();
        boolean minimum = keyword.startsWith("min");
        if (minimum ? actual >= bound : actual <= bound) {
            return List.of();
        }

        FailureKind kind;
        String message;
        if (stringBound) {
            kind = minimum ? FailureKind.TOO_SHORT : FailureKind.TOO_LONG;
            message = String.format(
                    "String has %d character(s), %s %d", actual, minimum ? "at least" : "at most", bound);
        } else {
            kind = minimum ? FailureKind.TOO_FEW_PROPERTIES : FailureKind.TOO_MANY_PROPERTIES;
            message = String.format(
                    "Object has %d propert%s, %s %d",
                    actual,
                    actual == 1 ? "y" : "ies",
                    minimum ? "at least" : "at most",
                    bound);
        }
        return List.of(new FailureRecord(
                instancePath, schemaPath.child(keyword), kind, message, details(keyword, bound, "actual", actual)));
    }
}
