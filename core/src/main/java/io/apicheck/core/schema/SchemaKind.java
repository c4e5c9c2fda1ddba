package io.apicheck.core.schema;

/**
 * Primary classification of a {@link SchemaNode}, derived from the keywords it carries.
 *
 * <p>
 * A node carrying keywords of several families (e.g. {@code type} plus {@code properties}) is
 * classified by the first matching entry in declaration order of this enum; evaluation still
 * covers every keyword of the node.
 */
public enum SchemaKind {
    /** {@code true} or {@code false} used as a whole schema. */
    BOOLEAN_LITERAL,

    /** Carries a {@code $ref}. */
    REFERENCE,

    /** Carries {@code allOf}, {@code anyOf}, {@code oneOf}, {@code not} or {@code if}. */
    COMPOSITE,

    /** Carries object keywords such as {@code properties} or {@code required}. */
    OBJECT_SHAPE,

    /** Carries array keywords such as {@code items} or {@code uniqueItems}. */
    ARRAY_SHAPE,

    /** Carries {@code enum} or {@code const}. */
    ENUM,

    /** Anything else: {@code type}, ranges, lengths, patterns, formats, or the empty schema. */
    TYPE_CONSTRAINT
}
