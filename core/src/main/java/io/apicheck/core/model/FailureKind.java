package io.apicheck.core.model;

import java.util.Locale;

/**
 * Taxonomy of failure records. Each kind belongs to a {@link Category}:
 *
 * <ul>
 * <li>{@link Category#SEMANTIC}: ordinary constraint violations by the instance.</li>
 * <li>{@link Category#STRUCTURAL}: problems with the schema document itself or pathological
 * recursion, reported so that one pass still covers everything else.</li>
 * </ul>
 */
public enum FailureKind {
    TYPE_MISMATCH(Category.SEMANTIC),
    ENUM_MISMATCH(Category.SEMANTIC),
    CONST_MISMATCH(Category.SEMANTIC),
    BELOW_MINIMUM(Category.SEMANTIC),
    ABOVE_MAXIMUM(Category.SEMANTIC),
    NOT_MULTIPLE_OF(Category.SEMANTIC),
    TOO_SHORT(Category.SEMANTIC),
    TOO_LONG(Category.SEMANTIC),
    PATTERN_MISMATCH(Category.SEMANTIC),
    FORMAT_MISMATCH(Category.SEMANTIC),
    TOO_FEW_PROPERTIES(Category.SEMANTIC),
    TOO_MANY_PROPERTIES(Category.SEMANTIC),
    MISSING_REQUIRED(Category.SEMANTIC),
    ADDITIONAL_PROPERTY(Category.SEMANTIC),
    INVALID_PROPERTY_NAME(Category.SEMANTIC),
    DEPENDENCY_MISSING(Category.SEMANTIC),
    ACCESS_MODE_VIOLATION(Category.SEMANTIC),
    TOO_FEW_ITEMS(Category.SEMANTIC),
    TOO_MANY_ITEMS(Category.SEMANTIC),
    DUPLICATE_ITEMS(Category.SEMANTIC),
    ADDITIONAL_ITEMS(Category.SEMANTIC),
    CONTAINS_MISMATCH(Category.SEMANTIC),
    ANY_OF_NO_MATCH(Category.SEMANTIC),
    ONE_OF_NO_MATCH(Category.SEMANTIC),
    ONE_OF_AMBIGUOUS(Category.SEMANTIC),
    NOT_MATCHED(Category.SEMANTIC),
    FALSE_SCHEMA(Category.SEMANTIC),
    UNRESOLVED_REFERENCE(Category.STRUCTURAL),
    DEPTH_EXCEEDED(Category.STRUCTURAL),
    INVALID_KEYWORD(Category.STRUCTURAL);

    /** Failure category. */
    public enum Category {
        SEMANTIC,
        STRUCTURAL
    }

    private final Category category;

    FailureKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /** Stable lower-case code used in rendered reports, e.g. {@code "type_mismatch"}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
