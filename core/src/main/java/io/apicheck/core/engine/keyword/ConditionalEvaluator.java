package io.apicheck.core.engine.keyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.List;
import java.util.Set;

/**
 * {@code if}/{@code then}/{@code else}. The {@code if} schema only selects a branch; of its own
 * failures only the structural ones (broken references, invalid keywords) are reported.
 */
public final class ConditionalEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.COMPOSITE;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("if", "then", "else");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        SchemaNode condition = node.child("if");
        if (!"if".equals(keyword) || condition == null) {
            return List.of();
        }
        List<FailureRecord> conditionFailures =
                context.evaluate(condition, instance, instancePath, schemaPath.child("if"));
        List<FailureRecord> failures = EvaluationContext.structural(conditionFailures);
        String branch = conditionFailures.isEmpty() ? "then" : "else";
        SchemaNode selected = node.child(branch);
        if (selected != null) {
            failures.addAll(context.evaluate(selected, instance, instancePath, schemaPath.child(branch)));
        }
        return failures;
    }
}
