package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.MessageDirection;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Object keywords: {@code properties}, {@code required}, {@code additionalProperties},
 * {@code patternProperties}, {@code propertyNames}, {@code dependentRequired},
 * {@code dependentSchemas} and the older combined {@code dependencies}.
 *
 * <p>
 * In OpenAPI 3.0 documents validated with a {@link MessageDirection}, a {@code readOnly}
 * property is neither required nor allowed in a request, and a {@code writeOnly} property
 * likewise in a response.
 *
 * <p>
 * Non-object instances pass.
 */
public final class ObjectShapeEvaluator implements ConstraintEvaluator {

    private final RegexCache regexes = new RegexCache();

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT_SHAPE;
    }

    @Override
    public Set<String> keywords() {
        return Set.of(
                "properties",
                "required",
                "additionalProperties",
                "patternProperties",
                "propertyNames",
                "dependentRequired",
                "dependentSchemas",
                "dependencies");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        if (!instance.isObject()) {
            return List.of();
        }
        return switch (keyword) {
            case "properties" -> properties(node, instance, instancePath, schemaPath, context);
            case "required" -> required(node, instance, instancePath, schemaPath, context);
            case "additionalProperties" -> additionalProperties(node, instance, instancePath, schemaPath, context);
            case "patternProperties" -> patternProperties(node, instance, instancePath, schemaPath, context);
            case "propertyNames" -> propertyNames(node, instance, instancePath, schemaPath, context);
            case "dependentRequired" -> dependentRequired(
                    node.keyword(keyword), instance, instancePath, schemaPath.child(keyword));
            case "dependentSchemas" -> dependentSchemas(
                    node.childMap(keyword), instance, instancePath, schemaPath.child(keyword), context);
            case "dependencies" -> dependencies(node, instance, instancePath, schemaPath, context);
            default -> List.of();
        };
    }

    private List<FailureRecord> properties(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        Location propertiesPath = schemaPath.child("properties");
        List<FailureRecord> failures = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> property : node.childMap("properties").entrySet()) {
            String name = property.getKey();
            JsonNode value = instance.get(name);
            if (value == null) {
                continue;
            }
            Location valuePath = instancePath.child(name);
            Location propertyPath = propertiesPath.child(name);
            String forbidden = forbiddenAccessMode(property.getValue(), context);
            if (forbidden != null) {
                failures.add(new FailureRecord(
                        valuePath,
                        propertyPath.child(forbidden),
                        FailureKind.ACCESS_MODE_VIOLATION,
                        "Property '" + name + "' is " + forbidden + " and must not appear in a "
                                + context.direction().name().toLowerCase(Locale.ROOT),
                        details("property", name, "accessMode", forbidden)));
            }
            failures.addAll(context.evaluate(property.getValue(), value, valuePath, propertyPath));
        }
        return failures;
    }

    private static List<FailureRecord> required(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        JsonNode required = node.keyword("required");
        if (!isStringArray(required)) {
            return invalidKeyword(instancePath, schemaPath, "required", "expected an array of strings");
        }
        Map<String, SchemaNode> declared = node.childMap("properties");
        List<FailureRecord> failures = new ArrayList<>();
        for (JsonNode entry : required) {
            String name = entry.textValue();
            if (instance.has(name)) {
                continue;
            }
            SchemaNode propertySchema = declared.get(name);
            if (propertySchema != null && forbiddenAccessMode(propertySchema, context) != null) {
                continue; // not expected in this direction
            }
            failures.add(new FailureRecord(
                    instancePath,
                    schemaPath.child("required"),
                    FailureKind.MISSING_REQUIRED,
                    "Missing required property '" + name + "'",
                    details("property", name)));
        }
        return failures;
    }

    private List<FailureRecord> additionalProperties(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        SchemaNode additional = node.child("additionalProperties");
        if (additional == null) {
            return List.of();
        }
        Map<String, SchemaNode> declared = node.childMap("properties");
        Set<String> patterns = node.childMap("patternProperties").keySet();
        Location additionalPath = schemaPath.child("additionalProperties");
        List<FailureRecord> failures = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = instance.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (declared.containsKey(name) || matchesAny(patterns, name)) {
                continue;
            }
            Location valuePath = instancePath.child(name);
            if (additional.kind() == SchemaKind.BOOLEAN_LITERAL && !additional.booleanValue()) {
                failures.add(new FailureRecord(
                        valuePath,
                        additionalPath,
                        FailureKind.ADDITIONAL_PROPERTY,
                        "Property '" + name + "' is not allowed",
                        details("property", name)));
            } else {
                failures.addAll(context.evaluate(additional, field.getValue(), valuePath, additionalPath));
            }
        }
        return failures;
    }

    private List<FailureRecord> patternProperties(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        Location patternsPath = schemaPath.child("patternProperties");
        List<FailureRecord> failures = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> entry : node.childMap("patternProperties").entrySet()) {
            Optional<Pattern> pattern = regexes.compile(entry.getKey());
            if (pattern.isEmpty()) {
                failures.addAll(invalidKeyword(
                        instancePath,
                        schemaPath,
                        "patternProperties",
                        "malformed regular expression '" + entry.getKey() + "'"));
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = instance.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (pattern.get().matcher(field.getKey()).find()) {
                    failures.addAll(context.evaluate(
                            entry.getValue(),
                            field.getValue(),
                            instancePath.child(field.getKey()),
                            patternsPath.child(entry.getKey())));
                }
            }
        }
        return failures;
    }

    private static List<FailureRecord> propertyNames(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        SchemaNode names = node.child("propertyNames");
        if (names == null) {
            return List.of();
        }
        Location namesPath = schemaPath.child("propertyNames");
        List<FailureRecord> failures = new ArrayList<>();
        Iterator<String> keys = instance.fieldNames();
        while (keys.hasNext()) {
            String name = keys.next();
            Location keyPath = instancePath.child(name);
            List<FailureRecord> nameFailures = context.evaluate(names, TextNode.valueOf(name), keyPath, namesPath);
            if (!nameFailures.isEmpty()) {
                failures.add(new FailureRecord(
                        keyPath,
                        namesPath,
                        FailureKind.INVALID_PROPERTY_NAME,
                        "Property name '" + name + "' is not allowed",
                        details("property", name, "failures", nameFailures)));
            }
        }
        return failures;
    }

    private static List<FailureRecord> dependentRequired(
            JsonNode dependents, JsonNode instance, Location instancePath, Location keywordPath) {
        if (dependents == null || !dependents.isObject()) {
            return List.of();
        }
        List<FailureRecord> failures = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = dependents.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getValue().isArray()) {
                failures.addAll(missingDependencies(
                        entry.getKey(), entry.getValue(), instance, instancePath, keywordPath.child(entry.getKey())));
            }
        }
        return failures;
    }

    private static List<FailureRecord> dependentSchemas(
            Map<String, SchemaNode> schemas,
            JsonNode instance,
            Location instancePath,
            Location keywordPath,
            EvaluationContext context) {
        List<FailureRecord> failures = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> entry : schemas.entrySet()) {
            if (instance.has(entry.getKey())) {
                failures.addAll(
                        context.evaluate(entry.getValue(), instance, instancePath, keywordPath.child(entry.getKey())));
            }
        }
        return failures;
    }

    /** Older form: each entry is either a list of names or a schema. */
    private static List<FailureRecord> dependencies(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath, EvaluationContext context) {
        Location keywordPath = schemaPath.child("dependencies");
        List<FailureRecord> failures = new ArrayList<>(
                dependentRequired(node.keyword("dependencies"), instance, instancePath, keywordPath));
        failures.addAll(dependentSchemas(node.childMap("dependencies"), instance, instancePath, keywordPath, context));
        return failures;
    }

    private static List<FailureRecord> missingDependencies(
            String property, JsonNode names, JsonNode instance, Location instancePath, Location entryPath) {
        if (!instance.has(property)) {
            return List.of();
        }
        List<FailureRecord> failures = new ArrayList<>();
        for (JsonNode name : names) {
            if (name.isTextual() && !instance.has(name.textValue())) {
                failures.add(new FailureRecord(
                        instancePath,
                        entryPath,
                        FailureKind.DEPENDENCY_MISSING,
                        "Property '" + name.textValue() + "' is required when '" + property + "' is present",
                        details("property", property, "missing", name.textValue())));
            }
        }
        return failures;
    }

    /**
     * Returns {@code "readOnly"} or {@code "writeOnly"} if the property must not travel in the
     * current direction, else {@code null}. A property defined by {@code $ref} is judged by its
     * target.
     */
    private static String forbiddenAccessMode(SchemaNode property, EvaluationContext context) {
        MessageDirection direction = context.direction();
        if (direction == null || !context.dialect().openApiKeywords()) {
            return null;
        }
        SchemaNode effective = property;
        if (property.kind() == SchemaKind.REFERENCE) {
            effective = context.resolver().find(property.refTarget()).orElse(property);
        }
        String keyword = direction == MessageDirection.REQUEST ? "readOnly" : "writeOnly";
        JsonNode flag = effective.keyword(keyword);
        return flag != null && flag.asBoolean(false) ? keyword : null;
    }

    private boolean matchesAny(Set<String> patterns, String name) {
        for (String source : patterns) {
            Optional<Pattern> pattern = regexes.compile(source);
            if (pattern.isPresent() && pattern.get().matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStringArray(JsonNode value) {
        if (value == null || !value.isArray()) {
            return false;
        }
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                return false;
            }
        }
        return true;
    }
}
