package io.apicheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.apicheck.core.error.SchemaParseException;
import io.apicheck.core.model.Dialect;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SchemaDocument} from a raw JSON tree.
 *
 * <p>
 * Parsing is structural only: it classifies every node and records its child schemas, but does
 * not check keyword values beyond what classification needs. A schema-valued keyword holding
 * something that is not a schema (neither object nor boolean) is kept as a raw keyword and gets
 * no child. Unknown keywords are preserved.
 *
 * <p>
 * Once the tree from the root is built, every local {@code $ref} target that is not already in
 * the arena (e.g. {@code #/components/schemas/Pet} or a schema under an unknown keyword) is parsed
 * in place, transitively. Other schemas can still be looked up by pointer later; see
 * {@link SchemaDocument#node}.
 *
 * <p>
 * Thread-safe: stateless, and each call works on its own arena.
 */
public final class SchemaParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaParser.class);

    /** Keywords whose value is one schema. */
    private static final Set<String> SINGLE_KEYWORDS = Set.of(
            "not",
            "if",
            "then",
            "else",
            "additionalProperties",
            "additionalItems",
            "contains",
            "propertyNames",
            "items");

    /** Keywords whose value is an array of schemas. */
    private static final Set<String> LIST_KEYWORDS = Set.of("allOf", "anyOf", "oneOf", "prefixItems", "items");

    /** Keywords whose value is an object of named schemas. */
    private static final Set<String> MAP_KEYWORDS = Set.of(
            "properties", "patternProperties", "$defs", "definitions", "dependentSchemas", "dependencies");

    private static final Set<String> COMPOSITE_KEYWORDS = Set.of("allOf", "anyOf", "oneOf", "not", "if");

    private static final Set<String> OBJECT_KEYWORDS = Set.of(
            "properties",
            "required",
            "additionalProperties",
            "patternProperties",
            "propertyNames",
            "minProperties",
            "maxProperties",
            "dependentRequired",
            "dependentSchemas",
            "dependencies");

    private static final Set<String> ARRAY_KEYWORDS = Set.of(
            "items",
            "prefixItems",
            "additionalItems",
            "uniqueItems",
            "minItems",
            "maxItems",
            "contains",
            "minContains",
            "maxContains");

    private static final Set<String> ENUM_KEYWORDS = Set.of("enum", "const");

    /**
     * Parses a raw schema tree.
     *
     * @param root    the raw document root; must be an object or a boolean
     * @param dialect keyword profile to record on the document
     * @param source  where the document came from, for error messages
     * @return the parsed document
     * @throws SchemaParseException if the root is not a schema
     */
    public SchemaDocument parse(JsonNode root, Dialect dialect, String source) {
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (root == null || root.isMissingNode()) {
            throw new SchemaParseException("Schema document is empty", source);
        }
        if (!isSchema(root)) {
            throw new SchemaParseException(
                    "Schema document root must be an object or a boolean, got: " + root.getNodeType(), source);
        }

        Map<String, SchemaNode> arena = new LinkedHashMap<>();
        Deque<String> pendingRefs = new ArrayDeque<>();
        build(root, JsonPointers.ROOT, arena, pendingRefs);
        materializeRefTargets(root, arena, pendingRefs);

        LOG.debug("Parsed schema '{}': {} nodes, dialect={}", source, arena.size(), dialect.id());
        return new SchemaDocument(root, dialect, source, arena, this);
    }

    /**
     * Parses the schema at {@code canonicalPointer} and the local reference targets reachable from
     * it, without touching any existing arena.
     *
     * @return the new nodes by pointer; empty if no schema lives at the pointer
     */
    Map<String, SchemaNode> parseDetached(JsonNode root, String canonicalPointer) {
        List<String> segments;
        try {
            segments = JsonPointers.decode(canonicalPointer);
        } catch (IllegalArgumentException e) {
            LOG.debug("Cannot look up malformed pointer '{}': {}", canonicalPointer, e.getMessage());
            return Map.of();
        }
        JsonNode target = walk(root, segments);
        if (target == null || !isSchema(target)) {
            return Map.of();
        }
        Map<String, SchemaNode> detached = new LinkedHashMap<>();
        Deque<String> pendingRefs = new ArrayDeque<>();
        build(target, canonicalPointer, detached, pendingRefs);
        materializeRefTargets(root, detached, pendingRefs);
        LOG.debug("Parsed detached schema at '{}': {} nodes", canonicalPointer, detached.size());
        return detached;
    }

    /** Classifies a raw schema value. */
    static SchemaKind classify(JsonNode raw) {
        if (raw.isBoolean()) {
            return SchemaKind.BOOLEAN_LITERAL;
        }
        JsonNode ref = raw.get("$ref");
        if (ref != null && ref.isTextual()) {
            return SchemaKind.REFERENCE;
        }
        if (hasAny(raw, COMPOSITE_KEYWORDS)) {
            return SchemaKind.COMPOSITE;
        }
        if (hasAny(raw, OBJECT_KEYWORDS)) {
            return SchemaKind.OBJECT_SHAPE;
        }
        if (hasAny(raw, ARRAY_KEYWORDS)) {
            return SchemaKind.ARRAY_SHAPE;
        }
        if (hasAny(raw, ENUM_KEYWORDS)) {
            return SchemaKind.ENUM;
        }
        return SchemaKind.TYPE_CONSTRAINT;
    }

    private SchemaNode build(
            JsonNode raw, String pointer, Map<String, SchemaNode> arena, Deque<String> pendingRefs) {
        SchemaNode existing = arena.get(pointer);
        if (existing != null) {
            return existing;
        }
        SchemaKind kind = classify(raw);
        SchemaNode.Builder builder = SchemaNode.builder(pointer, kind, raw);

        if (raw.isObject()) {
            for (Map.Entry<String, JsonNode> field : raw.properties()) {
                String keyword = field.getKey();
                JsonNode value = field.getValue();
                builder.keyword(keyword, value);
                String keywordPointer = JsonPointers.child(pointer, keyword);

                if (SINGLE_KEYWORDS.contains(keyword) && isSchema(value)) {
                    builder.single(keyword, build(value, keywordPointer, arena, pendingRefs));
                } else if (LIST_KEYWORDS.contains(keyword) && value.isArray()) {
                    builder.list(keyword, buildList(value, keywordPointer, arena, pendingRefs));
                } else if (MAP_KEYWORDS.contains(keyword) && value.isObject()) {
                    builder.map(keyword, buildMap(value, keywordPointer, arena, pendingRefs));
                }
            }
            if (kind == SchemaKind.REFERENCE) {
                String ref = raw.get("$ref").asText();
                builder.refTarget(ref);
                if (JsonPointers.isLocal(ref)) {
                    pendingRefs.add(ref);
                }
            }
        }

        SchemaNode node = builder.build();
        arena.put(pointer, node);
        return node;
    }

    private List<SchemaNode> buildList(
            JsonNode array, String pointer, Map<String, SchemaNode> arena, Deque<String> pendingRefs) {
        List<SchemaNode> children = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (isSchema(element)) {
                children.add(build(element, JsonPointers.child(pointer, i), arena, pendingRefs));
            } else {
                // keep positions stable: a non-schema entry behaves like the empty schema
                children.add(build(BooleanNode.TRUE, JsonPointers.child(pointer, i), arena, pendingRefs));
            }
        }
        return children;
    }

    private Map<String, SchemaNode> buildMap(
            JsonNode object, String pointer, Map<String, SchemaNode> arena, Deque<String> pendingRefs) {
        Map<String, SchemaNode> children = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : object.properties()) {
            if (isSchema(field.getValue())) {
                children.put(
                        field.getKey(),
                        build(field.getValue(), JsonPointers.child(pointer, field.getKey()), arena, pendingRefs));
            }
        }
        return children;
    }

    /**
     * Parses the targets of local references that the walk from the root did not reach. Targets
     * that do not exist or are not schemas are left out; the resolver reports them at use.
     */
    private void materializeRefTargets(JsonNode root, Map<String, SchemaNode> arena, Deque<String> pendingRefs) {
        while (!pendingRefs.isEmpty()) {
            String ref = pendingRefs.poll();
            List<String> segments;
            try {
                segments = JsonPointers.decode(ref);
            } catch (IllegalArgumentException e) {
                LOG.debug("Leaving malformed reference '{}' for the resolver: {}", ref, e.getMessage());
                continue;
            }
            String canonical = JsonPointers.encode(segments);
            if (arena.containsKey(canonical)) {
                continue;
            }
            JsonNode target = walk(root, segments);
            if (target != null && isSchema(target)) {
                build(target, canonical, arena, pendingRefs);
            }
        }
    }

    /**
     * Walks the raw tree by pointer segments.
     *
     * @return the node at the path, or {@code null} if a segment does not exist
     */
    static JsonNode walk(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null) {
                return null;
            }
            if (current.isObject()) {
                current = current.get(segment);
            } else if (current.isArray()) {
                current = current.get(parseIndex(segment));
            } else {
                return null;
            }
        }
        return current;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || (segment.length() > 1 && segment.startsWith("0"))) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static boolean isSchema(JsonNode node) {
        return node != null && (node.isObject() || node.isBoolean());
    }

    private static boolean hasAny(JsonNode raw, Set<String> keywords) {
        for (String keyword : keywords) {
            if (raw.has(keyword)) {
                return true;
            }
        }
        return false;
    }
}
