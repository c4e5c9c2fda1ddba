package io.apicheck.core.error;

/**
 * Thrown by the reference resolver when a {@code $ref} pointer does not lead to a schema in the
 * document. The reference evaluator turns it into an {@code UNRESOLVED_REFERENCE} failure record,
 * so it never escapes a {@code validate} call.
 */
public final class UnresolvedReferenceException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public UnresolvedReferenceException(String message, String pointer) {
        super(message, pointer);
    }
}
