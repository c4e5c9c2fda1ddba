package io.apicheck.core.engine;

import io.apicheck.core.error.UnresolvedReferenceException;
import io.apicheck.core.schema.JsonPointers;
import io.apicheck.core.schema.SchemaDocument;
import io.apicheck.core.schema.SchemaNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves local {@code $ref} pointers against one schema document.
 *
 * <p>
 * Only document-local references ({@code #} and {@code #/...}) are supported. Remote URIs,
 * malformed pointers and pointers to something that is not a schema are reported as
 * {@link UnresolvedReferenceException}; the engine turns that into an {@code UNRESOLVED_REFERENCE}
 * record and keeps going.
 *
 * <p>
 * Thread-safe: the document is immutable and all per-call state lives in the
 * {@link ResolutionContext} passed in.
 */
public final class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private final SchemaDocument document;

    public ReferenceResolver(SchemaDocument document) {
        this.document = Objects.requireNonNull(document, "document must not be null");
    }

    /**
     * Resolves a reference.
     *
     * @param ref     the raw {@code $ref} value
     * @param context per-call chain and cache
     * @return the target and whether it is already on the evaluation chain
     * @throws UnresolvedReferenceException if the reference cannot be resolved
     */
    public ResolvedReference resolve(String ref, ResolutionContext context) {
        String pointer = canonicalize(ref);
        SchemaNode cached = context.cached(pointer);
        if (cached != null) {
            boolean recursive = context.inProgress(pointer);
            if (recursive) {
                LOG.trace("Re-entering '{}' at depth {}", pointer, context.depth());
            }
            return new ResolvedReference(pointer, cached, recursive);
        }
        SchemaNode target = document.node(pointer).orElseThrow(() -> new UnresolvedReferenceException(
                "Reference '" + ref + "' does not point to a schema in '" + document.source() + "'", ref));
        context.cache(pointer, target);
        return new ResolvedReference(pointer, target, context.inProgress(pointer));
    }

    /**
     * Looks up a reference target without touching any chain.
     *
     * @return the target, or empty if the reference does not resolve
     */
    public Optional<SchemaNode> find(String ref) {
        if (ref == null || !JsonPointers.isLocal(ref)) {
            return Optional.empty();
        }
        List<String> segments;
        try {
            segments = JsonPointers.decode(ref);
        } catch (IllegalArgumentException e) {
            LOG.trace("Malformed reference '{}': {}", ref, e.getMessage());
            return Optional.empty();
        }
        return document.node(JsonPointers.encode(segments));
    }

    private static String canonicalize(String ref) {
        if (!JsonPointers.isLocal(ref)) {
            throw new UnresolvedReferenceException(
                    "Reference '" + ref + "' is not local to the document; only '#' pointers are supported", ref);
        }
        try {
            return JsonPointers.canonical(ref);
        } catch (IllegalArgumentException e) {
            throw new UnresolvedReferenceException(
                    "Reference '" + ref + "' is not a valid JSON pointer: " + e.getMessage(), ref);
        }
    }
}
