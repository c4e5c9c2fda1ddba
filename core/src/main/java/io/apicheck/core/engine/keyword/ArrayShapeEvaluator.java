package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;
import static io.apicheck.core.engine.keyword.KeywordSupport.nonNegativeInt;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.engine.JsonValues;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Array keywords.
 *
 * <p>
 * {@code items} is either one schema for every element (after any {@code prefixItems}) or, in
 * the older positional form, an array of schemas whose overflow is governed by
 * {@code additionalItems}. {@code minContains}/{@code maxContains} refine {@code contains}
 * (default at least one match). Non-array instances pass.
 */
public final class ArrayShapeEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY_SHAPE;
    }

    @Override
    public Set<String> keywords() {
        return Set.of(
                "items",
                "prefixItems",
                "additionalItems",
                "uniqueItems",
                "minItems",
                "maxItems",
                "contains",
                "minContains",
                "maxContains");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        if (!instance.isArray()) {
            return List.of();
        }
        return switch (keyword) {
            case "items" -> items(node, instance, instancePath, schemaPath, context);
            case "prefixItems" -> positional(
                    node.children("prefixItems"), instance, instancePath, schemaPath.child("prefixItems"), context);
            case "uniqueItems" -> uniqueItems(node, instance, instancePath, schemaPath);
            case "minItems", "maxItems" -> itemCount(keyword, node, instance, instancePath, schemaPath);
            case "contains" -> contains(node, instance, instancePath, schemaPath, context);
            default -> List.of(); // additionalItems, minContains, maxContains: read by their primary keyword
        };
    }

    private static List<FailureRecord> items(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        Location itemsPath = schemaPath.child("items");
        if (node.hasChildren("items")) {
            List<SchemaNode> tuple = node.children("items");
            List<FailureRecord> failures = new ArrayList<>(positional(tuple, instance, instancePath, itemsPath, context));
            failures.addAll(additionalItems(node, instance, tuple.size(), instancePath, schemaPath, context));
            return failures;
        }
        SchemaNode every = node.child("items");
        if (every == null) {
            return List.of();
        }
        int start = node.children("prefixItems").size();
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = start; i < instance.size(); i++) {
            failures.addAll(context.evaluate(every, instance.get(i), instancePath.child(i), itemsPath));
        }
        return failures;
    }

    private static List<FailureRecord> positional(
            List<SchemaNode> tuple,
            JsonNode instance,
            Location instancePath,
            Location keywordPath,
            EvaluationContext context) {
        List<FailureRecord> failures = new ArrayList<>();
        int limit = Math.min(tuple.size(), instance.size());
        for (int i = 0; i < limit; i++) {
            failures.addAll(context.evaluate(tuple.get(i), instance.get(i), instancePath.child(i), keywordPath.child(i)));
        }
        return failures;
    }

    private static List<FailureRecord> additionalItems(
            SchemaNode node,
            JsonNode instance,
            int tupleSize,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        SchemaNode additional = node.child("additionalItems");
        if (additional == null || instance.size() <= tupleSize) {
            return List.of();
        }
        Location additionalPath = schemaPath.child("additionalItems");
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = tupleSize; i < instance.size(); i++) {
            if (additional.kind() == SchemaKind.BOOLEAN_LITERAL && !additional.booleanValue()) {
                failures.add(new FailureRecord(
                        instancePath.child(i),
                        additionalPath,
                        FailureKind.ADDITIONAL_ITEMS,
                        "Item " + i + " is not allowed; at most " + tupleSize + " item(s) are defined",
                        details("index", i, "allowed", tupleSize)));
            } else {
                failures.addAll(context.evaluate(additional, instance.get(i), instancePath.child(i), additionalPath));
            }
        }
        return failures;
    }

    private static List<FailureRecord> uniqueItems(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath) {
        JsonNode flag = node.keyword("uniqueItems");
        if (flag == null || !flag.isBoolean()) {
            return invalidKeyword(instancePath, schemaPath, "uniqueItems", "expected a boolean");
        }
        if (!flag.booleanValue()) {
            return List.of();
        }
        for (int i = 0; i < instance.size(); i++) {
            for (int j = i + 1; j < instance.size(); j++) {
                if (JsonValues.equal(instance.get(i), instance.get(j))) {
                    return List.of(new FailureRecord(
                            instancePath,
                            schemaPath.child("uniqueItems"),
                            FailureKind.DUPLICATE_ITEMS,
                            "Items " + i + " and " + j + " are equal; items must be unique",
                            details("indices", List.of(i, j))));
                }
            }
        }
        return List.of();
    }

    private static List<FailureRecord> itemCount(
            String keyword, SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath) {
        int bound = nonNegativeInt(node.keyword(keyword));
        if (bound < 0) {
            return invalidKeyword(instancePath, schemaPath, keyword, "expected a non-negative integer");
        }
        int actual = instance.size();
        boolean minimum = "minItems".equals(keyword);
        if (minimum ? actual >= bound : actual <= bound) {
            return List.of();
        }
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child(keyword),
                minimum ? FailureKind.TOO_FEW_ITEMS : FailureKind.TOO_MANY_ITEMS,
                String.format("Array has %d item(s), %s %d", actual, minimum ? "at least" : "at most", bound),
                details(keyword, bound, "actual", actual)));
    }

    private static List<FailureRecord> contains(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        SchemaNode wanted = node.child("contains");
        if (wanted == null) {
            return invalidKeyword(instancePath, schemaPath, "contains", "expected a schema");
        }
        int min = node.has("minContains") ? nonNegativeInt(node.keyword("minContains")) : 1;
        int max = node.has("maxContains") ? nonNegativeInt(node.keyword("maxContains")) : Integer.MAX_VALUE;
        if (min < 0) {
            return invalidKeyword(instancePath, schemaPath, "minContains", "expected a non-negative integer");
        }
        if (max < 0) {
            return invalidKeyword(instancePath, schemaPath, "maxContains", "expected a non-negative integer");
        }

        Location containsPath = schemaPath.child("contains");
        int matches = 0;
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = 0; i < instance.size(); i++) {
            List<FailureRecord> itemFailures =
                    context.evaluate(wanted, instance.get(i), instancePath.child(i), containsPath);
            if (itemFailures.isEmpty()) {
                matches++;
            } else {
                failures.addAll(EvaluationContext.structural(itemFailures));
            }
        }
        if (matches < min) {
            failures.add(new FailureRecord(
                    instancePath,
                    containsPath,
                    FailureKind.CONTAINS_MISMATCH,
                    String.format("Array has %d matching item(s), at least %d required", matches, min),
                    details("minContains", min, "matches", matches)));
        } else if (matches > max) {
            failures.add(new FailureRecord(
                    instancePath,
                    containsPath,
                    FailureKind.CONTAINS_MISMATCH,
                    String.format("Array has %d matching item(s), at most %d allowed", matches, max),
                    details("maxContains", max, "matches", matches)));
        }
        return failures;
    }
}
