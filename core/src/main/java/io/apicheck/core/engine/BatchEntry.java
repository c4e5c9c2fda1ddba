package io.apicheck.core.engine;

import io.apicheck.core.error.LimitExceededException;
import io.apicheck.core.model.ValidationResult;

/**
 * Outcome for one instance of a batch: either a result or the limit error that aborted it.
 *
 * @param index  position of the instance in the batch input
 * @param result the validation result, or {@code null} if the call was aborted
 * @param error  the abort cause, or {@code null} if a result is present
 */
public record BatchEntry(int index, ValidationResult result, LimitExceededException error) {

    public BatchEntry {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of result and error must be present");
        }
    }

    public static BatchEntry completed(int index, ValidationResult result) {
        return new BatchEntry(index, result, null);
    }

    public static BatchEntry limitExceeded(int index, LimitExceededException error) {
        return new BatchEntry(index, null, error);
    }

    public boolean aborted() {
        return error != null;
    }

    /** {@code true} only for a completed, valid result. */
    public boolean valid() {
        return result != null && result.valid();
    }
}
