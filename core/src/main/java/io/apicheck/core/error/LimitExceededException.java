package io.apicheck.core.error;

/**
 * Thrown when a single validation call exceeds its step budget. Aborts the whole call; this is a
 * resource-exhaustion guard, not a verdict.
 */
public final class LimitExceededException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    private final long maxSteps;

    public LimitExceededException(long maxSteps, String pointer) {
        super(String.format("Validation exceeded max-steps %d (at schema '%s')", maxSteps, pointer), pointer);
        this.maxSteps = maxSteps;
    }

    /** The step budget that was exceeded. */
    public long maxSteps() {
        return maxSteps;
    }
}
