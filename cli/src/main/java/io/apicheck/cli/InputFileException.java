package io.apicheck.cli;

/** Thrown when an input file is missing, unreadable, or of an unsupported type. */
public class InputFileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InputFileException(String message) {
        super(message);
    }

    public InputFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
