package io.apicheck.core.error;

/**
 * Abstract base for all apicheck exceptions. Never thrown directly; use the concrete subclasses
 * under {@link DocumentParseException} or {@link EvaluationException}.
 */
public abstract class ApiCheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final Phase phase;

    protected ApiCheckException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ApiCheckException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
