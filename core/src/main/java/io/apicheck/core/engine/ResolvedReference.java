package io.apicheck.core.engine;

import io.apicheck.core.schema.SchemaNode;

/**
 * Outcome of resolving a {@code $ref}.
 *
 * @param pointer   canonical pointer of the target, e.g. {@code #/$defs/node}
 * @param target    the target schema node
 * @param recursive {@code true} if the target is already being evaluated on the current path
 */
public record ResolvedReference(String pointer, SchemaNode target, boolean recursive) {}
