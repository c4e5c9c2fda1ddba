package io.apicheck.cli;

/** Process exit codes of the {@code apicheck} command. */
public final class ExitCodes {

    /** Every input parsed and conforms. */
    public static final int VALID = 0;

    /** Every input parsed, at least one does not conform. */
    public static final int INVALID = 1;

    /** Malformed schema or data, unreadable or unsupported file, bad configuration, usage error. */
    public static final int INPUT_ERROR = 2;

    /** A validation was aborted by the step limit. */
    public static final int LIMIT_EXCEEDED = 3;

    private ExitCodes() {}
}
