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
import io.apicheck.core.spi.FormatPredicate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code format}, checked by the predicate registered under the format name. */
public final class FormatEvaluator implements ConstraintEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(FormatEvaluator.class);

    @Override
    public SchemaKind kind() {
        return SchemaKind.TYPE_CONSTRAINT;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("format");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        JsonNode value = node.keyword("format");
        if (value == null || !value.isTextual()) {
            return invalidKeyword(instancePath, schemaPath, "format", "expected a string");
        }
        String name = value.textValue();
        Optional<FormatPredicate> predicate = context.formats().lookup(name);
        if (predicate.isEmpty()) {
            LOG.debug("No predicate for format '{}' at {}; not checked", name, schemaPath);
            return List.of();
        }
        if (predicate.get().test(instance)) {
            return List.of();
        }
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child("format"),
                FailureKind.FORMAT_MISMATCH,
                "Value " + JsonValues.describe(instance) + " is not a valid " + name,
                details("format", name, "actual", instance)));
    }
}
