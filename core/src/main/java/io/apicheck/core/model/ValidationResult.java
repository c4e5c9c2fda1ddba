package io.apicheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one instance: a verdict plus every failure found, in the order the
 * evaluators produced them.
 *
 * <p>
 * Invariant: {@code valid == failures.isEmpty()}. Two results built from the same records are
 * {@link #equals equal}.
 *
 * @param valid    {@code true} if the instance conforms
 * @param failures the failure records, empty iff valid
 */
public record ValidationResult(boolean valid, List<FailureRecord> failures) {

    private static final ValidationResult VALID = new ValidationResult(true, List.of());

    public ValidationResult {
        Objects.requireNonNull(failures, "failures must not be null");
        failures = List.copyOf(failures);
        if (valid != failures.isEmpty()) {
            throw new IllegalArgumentException(
                    "valid must be true iff there are no failures (valid=" + valid + ", failures=" + failures.size()
                            + ")");
        }
    }

    /** The result for a conforming instance. */
    public static ValidationResult success() {
        return VALID;
    }

    /** Builds a result from the collected records; valid iff the list is empty. */
    public static ValidationResult of(List<FailureRecord> failures) {
        return failures.isEmpty() ? VALID : new ValidationResult(false, failures);
    }

    public int failureCount() {
        return failures.size();
    }
}
