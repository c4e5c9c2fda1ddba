package io.apicheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One schema in a parsed {@link SchemaDocument}.
 *
 * <p>
 * Holds the keywords in declaration order (unknown ones included), the owned child schemas of
 * schema-valued keywords, and, for references, the {@code $ref} string. A reference target is
 * never held directly: it is looked up by pointer in the document's arena.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class SchemaNode {

    private final String pointer;
    private final SchemaKind kind;
    private final JsonNode raw;
    private final Map<String, JsonNode> keywords;
    private final Map<String, SchemaNode> singles;
    private final Map<String, List<SchemaNode>> lists;
    private final Map<String, Map<String, SchemaNode>> maps;
    private final String refTarget;

    private SchemaNode(Builder builder) {
        this.pointer = builder.pointer;
        this.kind = builder.kind;
        this.raw = builder.raw;
        this.keywords = Collections.unmodifiableMap(builder.keywords);
        this.singles = Collections.unmodifiableMap(builder.singles);
        this.lists = Collections.unmodifiableMap(builder.lists);
        this.maps = Collections.unmodifiableMap(builder.maps);
        this.refTarget = builder.refTarget;
    }

    /** Canonical pointer of this node inside its document, e.g. {@code #/properties/id}. */
    public String pointer() {
        return pointer;
    }

    public SchemaKind kind() {
        return kind;
    }

    /** The raw schema value: an object node, or a boolean node for boolean literals. */
    public JsonNode raw() {
        return raw;
    }

    /** Keyword names in declaration order. */
    public Set<String> keywordNames() {
        return keywords.keySet();
    }

    /** Returns {@code true} if the keyword is declared on this node. */
    public boolean has(String keyword) {
        return keywords.containsKey(keyword);
    }

    /** Raw value of a keyword, or {@code null} if absent. */
    public JsonNode keyword(String keyword) {
        return keywords.get(keyword);
    }

    /** Child schema of a single-schema keyword ({@code not}, {@code items}, ...), or {@code null}. */
    public SchemaNode child(String keyword) {
        return singles.get(keyword);
    }

    /** Child schemas of a list keyword ({@code allOf}, positional {@code items}, ...). */
    public List<SchemaNode> children(String keyword) {
        return lists.getOrDefault(keyword, List.of());
    }

    /** Returns {@code true} if the keyword holds a list of schemas. */
    public boolean hasChildren(String keyword) {
        return lists.containsKey(keyword);
    }

    /** Child schemas of a map keyword ({@code properties}, {@code $defs}, ...), in declaration order. */
    public Map<String, SchemaNode> childMap(String keyword) {
        return maps.getOrDefault(keyword, Map.of());
    }

    /** The {@code $ref} string when {@link #kind()} is {@link SchemaKind#REFERENCE}, else {@code null}. */
    public String refTarget() {
        return refTarget;
    }

    /** Value of a boolean literal schema; {@code false} for any other kind. */
    public boolean booleanValue() {
        return kind == SchemaKind.BOOLEAN_LITERAL && raw.booleanValue();
    }

    @Override
    public String toString() {
        return "SchemaNode[" + pointer + ", " + kind + "]";
    }

    static Builder builder(String pointer, SchemaKind kind, JsonNode raw) {
        return new Builder(pointer, kind, raw);
    }

    /** Mutable builder used by {@link SchemaParser} only. */
    static final class Builder {
        private final String pointer;
        private final SchemaKind kind;
        private final JsonNode raw;
        private final Map<String, JsonNode> keywords = new LinkedHashMap<>();
        private final Map<String, SchemaNode> singles = new LinkedHashMap<>();
        private final Map<String, List<SchemaNode>> lists = new LinkedHashMap<>();
        private final Map<String, Map<String, SchemaNode>> maps = new LinkedHashMap<>();
        private String refTarget;

        private Builder(String pointer, SchemaKind kind, JsonNode raw) {
            this.pointer = Objects.requireNonNull(pointer, "pointer must not be null");
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            this.raw = Objects.requireNonNull(raw, "raw must not be null");
        }

        Builder keyword(String name, JsonNode value) {
            keywords.put(name, value);
            return this;
        }

        Builder single(String name, SchemaNode child) {
            singles.put(name, child);
            return this;
        }

        Builder list(String name, List<SchemaNode> children) {
            lists.put(name, List.copyOf(children));
            return this;
        }

        Builder map(String name, Map<String, SchemaNode> children) {
            maps.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(children)));
            return this;
        }

        Builder refTarget(String refTarget) {
            this.refTarget = refTarget;
            return this;
        }

        SchemaNode build() {
            return new SchemaNode(this);
        }
    }
}
