package io.apicheck.core.error;

/** Thrown when a schema document has invalid syntax or a root that is not a schema. */
public final class SchemaParseException extends DocumentParseException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
