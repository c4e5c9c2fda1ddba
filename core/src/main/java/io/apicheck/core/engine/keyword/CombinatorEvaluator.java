package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code allOf}, {@code anyOf}, {@code oneOf} and {@code not}.
 *
 * <p>
 * {@code allOf} reports the failures of every branch. {@code anyOf} and {@code oneOf} summarize a
 * complete miss in one record whose details name the alternative that came closest (fewest
 * failures, first on tie) together with its failures. {@code anyOf} stops at the first matching
 * branch; {@code oneOf} always evaluates every branch.
 *
 * <p>
 * Structural records raised inside an evaluated branch, such as a broken reference, are reported
 * at top level whatever the combinator's verdict.
 */
public final class CombinatorEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.COMPOSITE;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("allOf", "anyOf", "oneOf", "not");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        if ("not".equals(keyword)) {
            return not(node, instance, instancePath, schemaPath, context);
        }
        JsonNode value = node.keyword(keyword);
        if (value == null || !value.isArray()) {
            return invalidKeyword(instancePath, schemaPath, keyword, "expected an array of schemas");
        }
        List<SchemaNode> branches = node.children(keyword);
        Location keywordPath = schemaPath.child(keyword);
        return switch (keyword) {
            case "allOf" -> allOf(branches, instance, instancePath, keywordPath, context);
            case "anyOf" -> anyOf(branches, instance, instancePath, keywordPath, context);
            default -> oneOf(branches, instance, instancePath, keywordPath, context);
        };
    }

    private static List<FailureRecord> allOf(
            List<SchemaNode> branches,
            JsonNode instance,
            Location instancePath,
            Location keywordPath,
            EvaluationContext context) {
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            failures.addAll(context.evaluate(branches.get(i), instance, instancePath, keywordPath.child(i)));
        }
        return failures;
    }

    private static List<FailureRecord> anyOf(
            List<SchemaNode> branches,
            JsonNode instance,
            Location instancePath,
            Location keywordPath,
            EvaluationContext context) {
        List<List<FailureRecord>> attempts = new ArrayList<>(branches.size());
        List<FailureRecord> broken = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            List<FailureRecord> branchFailures =
                    context.evaluate(branches.get(i), instance, instancePath, keywordPath.child(i));
            if (branchFailures.isEmpty()) {
                return broken;
            }
            attempts.add(branchFailures);
            broken.addAll(EvaluationContext.structural(branchFailures));
        }
        List<FailureRecord> failures = new ArrayList<>();
        failures.add(new FailureRecord(
                instancePath,
                keywordPath,
                FailureKind.ANY_OF_NO_MATCH,
                "Value matches none of the " + branches.size() + " alternative(s) (anyOf)",
                missDetails(attempts)));
        failures.addAll(broken);
        return failures;
    }

    private static List<FailureRecord> oneOf(
            List<SchemaNode> branches,
            JsonNode instance,
            Location instancePath,
            Location keywordPath,
            EvaluationContext context) {
        List<List<FailureRecord>> attempts = new ArrayList<>(branches.size());
        List<FailureRecord> broken = new ArrayList<>();
        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            List<FailureRecord> branchFailures =
                    context.evaluate(branches.get(i), instance, instancePath, keywordPath.child(i));
            attempts.add(branchFailures);
            if (branchFailures.isEmpty()) {
                matched.add(i);
            } else {
                broken.addAll(EvaluationContext.structural(branchFailures));
            }
        }
        if (matched.size() == 1) {
            return broken;
        }
        List<FailureRecord> failures = new ArrayList<>();
        if (matched.isEmpty()) {
            failures.add(new FailureRecord(
                    instancePath,
                    keywordPath,
                    FailureKind.ONE_OF_NO_MATCH,
                    "Value matches none of the " + branches.size() + " alternative(s) (oneOf)",
                    missDetails(attempts)));
        } else {
            failures.add(new FailureRecord(
                    instancePath,
                    keywordPath,
                    FailureKind.ONE_OF_AMBIGUOUS,
                    "Value matches " + matched.size() + " alternatives (oneOf) at indices " + matched
                            + "; exactly one is required",
                    details("alternatives", branches.size(), "matched", List.copyOf(matched))));
        }
        failures.addAll(broken);
        return failures;
    }

    private static List<FailureRecord> not(
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        SchemaNode negated = node.child("not");
        if (negated == null) {
            return invalidKeyword(instancePath, schemaPath, "not", "expected a schema");
        }
        Location notPath = schemaPath.child("not");
        List<FailureRecord> negatedFailures = context.evaluate(negated, instance, instancePath, notPath);
        if (!negatedFailures.isEmpty()) {
            return EvaluationContext.structural(negatedFailures);
        }
        return List.of(FailureRecord.of(
                instancePath, notPath, FailureKind.NOT_MATCHED, "Value must not match the schema under 'not'"));
    }

    private static Map<String, Object> missDetails(List<List<FailureRecord>> attempts) {
        List<Integer> counts = new ArrayList<>(attempts.size());
        int best = -1;
        for (int i = 0; i < attempts.size(); i++) {
            counts.add(attempts.get(i).size());
            if (best < 0 || attempts.get(i).size() < attempts.get(best).size()) {
                best = i;
            }
        }
        Map<String, Object> details = details("alternatives", attempts.size(), "failureCounts", counts);
        if (best >= 0) {
            details.put("bestAlternative", best);
            details.put("bestAlternativeFailures", attempts.get(best));
        }
        return details;
    }
}
