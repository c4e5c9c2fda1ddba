package io.apicheck.core.error;

/**
 * Abstract parent for structural problems found while evaluating an instance. Carries the schema
 * {@code pointer} involved, or {@code null} when the problem is not tied to one location.
 */
public abstract class EvaluationException extends ApiCheckException {

    private static final long serialVersionUID = 1L;

    private final String pointer;

    protected EvaluationException(String message, String pointer) {
        super(message, Phase.EVALUATION);
        this.pointer = pointer;
    }

    protected EvaluationException(String message, Throwable cause, String pointer) {
        super(message, cause, Phase.EVALUATION);
        this.pointer = pointer;
    }

    /** The schema pointer that triggered the error, or {@code null}. */
    public String pointer() {
        return pointer;
    }
}
