package io.apicheck.core.error;

/**
 * Abstract parent for precondition failures: raw schema or instance input that cannot be turned
 * into a document tree. Raised before any validation starts and never mixed into failure records.
 * Carries the {@code source} (file name or {@code <inline>}) the input came from.
 */
public abstract class DocumentParseException extends ApiCheckException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected DocumentParseException(String message, String source) {
        super(message, Phase.PARSE);
        this.source = source;
    }

    protected DocumentParseException(String message, Throwable cause, String source) {
        super(message, cause, Phase.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
