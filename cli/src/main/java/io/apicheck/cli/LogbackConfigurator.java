package io.apicheck.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for the CLI.
 *
 * <p>
 * Logs always go to standard error so that the report on standard output can be piped. JSON mode
 * uses Logback's built-in {@link JsonEncoder} (MDC included); text mode a short pattern carrying
 * the {@code document} MDC key.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%X{document}] %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Maps a level name to Logback. Accepts Logback names plus {@code WARNING} (as WARN) and
     * {@code CRITICAL} (as ERROR), case-insensitively.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static Level toLevel(String name) {
        String upper = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "TRACE" -> Level.TRACE;
            case "DEBUG" -> Level.DEBUG;
            case "INFO" -> Level.INFO;
            case "WARN", "WARNING" -> Level.WARN;
            case "ERROR", "CRITICAL" -> Level.ERROR;
            case "OFF" -> Level.OFF;
            default -> throw new IllegalArgumentException(
                    "Unknown log level '" + name + "'; expected DEBUG, INFO, WARNING, ERROR or CRITICAL");
        };
    }

    /**
     * Reconfigures the root logger.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  root level
     */
    public static void configure(String format, Level level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(level);
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
        appender.setTarget("System.err");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);
    }
}
