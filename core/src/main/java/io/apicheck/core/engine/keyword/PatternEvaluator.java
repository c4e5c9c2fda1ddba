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
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/** {@code pattern}: the regex must match somewhere in the string (unanchored). */
public final class PatternEvaluator implements ConstraintEvaluator {

    private final RegexCache regexes = new RegexCache();

    @Override
    public SchemaKind kind() {
        return SchemaKind.TYPE_CONSTRAINT;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("pattern");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        if (!instance.isTextual()) {
            return List.of();
        }
        JsonNode value = node.keyword("pattern");
        if (value == null || !value.isTextual()) {
            return invalidKeyword(instancePath, schemaPath, "pattern", "expected a string");
        }
        Optional<Pattern> pattern = regexes.compile(value.textValue());
        if (pattern.isEmpty()) {
            return invalidKeyword(
                    instancePath, schemaPath, "pattern", "malformed regular expression '" + value.textValue() + "'");
        }
        if (pattern.get().matcher(instance.textValue()).find()) {
            return List.of();
        }
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child("pattern"),
                FailureKind.PATTERN_MISMATCH,
                "String " + JsonValues.describe(instance) + " does not match pattern '" + value.textValue() + "'",
                details("pattern", value.textValue(), "actual", instance.textValue())));
    }
}
