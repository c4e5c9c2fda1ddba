package io.apicheck.cli.config;

/**
 * Thrown when configuration loading fails: unreadable file, invalid YAML, or a value of the
 * wrong shape in the file or the environment. The message is suitable for direct output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
