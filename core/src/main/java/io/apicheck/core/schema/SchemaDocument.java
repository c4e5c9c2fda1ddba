package io.apicheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.model.Dialect;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A parsed schema document: the root {@link SchemaNode}, the raw tree, the dialect it is read
 * with, and the arena mapping canonical pointers to every schema node that can be reached from the
 * root or from a local {@code $ref}.
 *
 * <p>
 * A schema that lives under an unknown keyword and is not the target of any reference (e.g. an
 * OpenAPI component looked up directly by pointer) is parsed on first lookup and memoized. Nodes
 * are immutable and parsing is deterministic, so the document is safe to share across concurrent
 * validations.
 */
public final class SchemaDocument {

    private final JsonNode rawRoot;
    private final Dialect dialect;
    private final String source;
    private final Map<String, SchemaNode> arena;
    private final SchemaParser parser;

    SchemaDocument(
            JsonNode rawRoot, Dialect dialect, String source, Map<String, SchemaNode> arena, SchemaParser parser) {
        this.rawRoot = Objects.requireNonNull(rawRoot, "rawRoot must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.source = source;
        this.arena = new ConcurrentHashMap<>(arena);
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /** The root schema node. */
    public SchemaNode root() {
        return arena.get(JsonPointers.ROOT);
    }

    /** The raw document tree. Callers must not mutate it. */
    public JsonNode rawRoot() {
        return rawRoot;
    }

    public Dialect dialect() {
        return dialect;
    }

    /** Where the document came from (file name or {@code <inline>}). */
    public String source() {
        return source;
    }

    /**
     * Looks up a schema node by canonical pointer.
     *
     * @param canonicalPointer pointer as produced by {@link JsonPointers#canonical}
     * @return the node, or empty if no schema lives at that pointer
     */
    public Optional<SchemaNode> node(String canonicalPointer) {
        SchemaNode node = arena.get(canonicalPointer);
        if (node != null) {
            return Optional.of(node);
        }
        Map<String, SchemaNode> detached = parser.parseDetached(rawRoot, canonicalPointer);
        detached.forEach(arena::putIfAbsent);
        return Optional.ofNullable(arena.get(canonicalPointer));
    }

    /** Number of schema nodes parsed so far. */
    public int size() {
        return arena.size();
    }
}
