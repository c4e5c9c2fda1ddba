package io.apicheck.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One detected violation.
 *
 * @param instancePath path from the instance root to the offending value
 * @param schemaPath   path from the schema root to the failing keyword, including every
 *                     {@code $ref} traversed on the way
 * @param kind         the failure taxonomy entry
 * @param message      human-readable description
 * @param details      constraint-specific payload (e.g. {@code expected}, {@code actual}), in
 *                     insertion order; never {@code null}
 */
public record FailureRecord(
        Location instancePath, Location schemaPath, FailureKind kind, String message, Map<String, Object> details) {

    public FailureRecord {
        Objects.requireNonNull(instancePath, "instancePath must not be null");
        Objects.requireNonNull(schemaPath, "schemaPath must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Creates a record without details. */
    public static FailureRecord of(Location instancePath, Location schemaPath, FailureKind kind, String message) {
        return new FailureRecord(instancePath, schemaPath, kind, message, Map.of());
    }

    public FailureKind.Category category() {
        return kind.category();
    }
}
