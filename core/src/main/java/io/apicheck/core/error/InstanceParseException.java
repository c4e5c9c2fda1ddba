package io.apicheck.core.error;

/** Thrown when the data under validation is not well-formed JSON or YAML. */
public final class InstanceParseException extends DocumentParseException {

    private static final long serialVersionUID = 1L;

    public InstanceParseException(String message, String source) {
        super(message, source);
    }

    public InstanceParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
