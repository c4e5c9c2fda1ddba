package io.apicheck.cli;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point of the {@code apicheck} command line tool.
 *
 * <p>
 * Exits with one of the {@link ExitCodes}. Unexpected failures are logged and reported as
 * {@link ExitCodes#INPUT_ERROR}.
 */
public final class ApiCheckMain {

    private static final Logger LOG = LoggerFactory.getLogger(ApiCheckMain.class);

    private ApiCheckMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(commandLine(System::getenv).execute(args));
    }

    /**
     * Builds the configured command line.
     *
     * @param envLookup environment variable lookup used for configuration overrides
     */
    static CommandLine commandLine(Function<String, String> envLookup) {
        CommandLine commandLine = new CommandLine(new ValidateCommand(envLookup));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            LOG.error("Validation failed unexpectedly: {}", ex.getMessage(), ex);
            cl.getErr().println("Error: " + ex.getMessage());
            return ExitCodes.INPUT_ERROR;
        });
        return commandLine;
    }
}
