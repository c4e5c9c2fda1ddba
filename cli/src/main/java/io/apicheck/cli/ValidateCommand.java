package io.apicheck.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.apicheck.cli.config.CliConfig;
import io.apicheck.cli.config.ConfigLoadException;
import io.apicheck.cli.config.ConfigLoader;
import io.apicheck.core.engine.BatchEntry;
import io.apicheck.core.engine.BatchValidator;
import io.apicheck.core.engine.SchemaValidator;
import io.apicheck.core.error.DocumentParseException;
import io.apicheck.core.error.LimitExceededException;
import io.apicheck.core.model.ContentType;
import io.apicheck.core.model.Dialect;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Instance;
import io.apicheck.core.model.MessageDirection;
import io.apicheck.core.report.DiagnosticReporter;
import io.apicheck.core.schema.DocumentParser;
import io.apicheck.core.schema.SchemaDocument;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * {@code apicheck}: validates one or more request/response bodies against a schema document.
 *
 * <p>
 * Settings come from flags, then environment variables, then the optional YAML config file, then
 * defaults. The report goes to standard output; errors and logs go to standard error.
 */
@CommandLine.Command(
        name = "apicheck",
        mixinStandardHelpOptions = true,
        version = "apicheck 0.1.0",
        sortOptions = false,
        description = "Validates API request/response structures against JSON Schema or OpenAPI 3.0 definitions.",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
            "0:all data files are valid",
            "1:at least one data file is invalid",
            "2:malformed or unreadable input, unsupported file type, or usage error",
            "3:validation aborted by the step limit"
        })
final class ValidateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    static final String MDC_DOCUMENT = BatchValidator.MDC_DOCUMENT;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "data_file",
            description = "API request/response data file (JSON or YAML).")
    Path dataFile;

    @CommandLine.Parameters(
            index = "1",
            paramLabel = "schema_file",
            description = "OpenAPI or JSON Schema definition file (JSON or YAML).")
    Path schemaFile;

    @CommandLine.Parameters(
            index = "2..*",
            arity = "0..*",
            paramLabel = "data_file",
            description = "Further data files to validate against the same schema.")
    List<Path> moreDataFiles = new ArrayList<>();

    @CommandLine.Option(
            names = {"--data_type"},
            paramLabel = "json|yaml",
            description = "Data file type. Inferred from the extension if omitted.")
    ContentType dataType;

    @CommandLine.Option(
            names = {"--schema_type"},
            paramLabel = "json|yaml",
            description = "Schema file type. Inferred from the extension if omitted.")
    ContentType schemaType;

    @CommandLine.Option(
            names = {"--dialect"},
            paramLabel = "json-schema|openapi-3.0|auto",
            description = "Keyword interpretation (default: from config, else auto-detect).")
    String dialect;

    @CommandLine.Option(
            names = {"--schema_pointer"},
            paramLabel = "pointer",
            defaultValue = "#",
            description = "Sub-schema to validate against, e.g. '#/components/schemas/Pet' (default: #).")
    String schemaPointer;

    @CommandLine.Option(
            names = {"--direction"},
            paramLabel = "request|response",
            description = "Message direction for OpenAPI readOnly/writeOnly checks.")
    MessageDirection direction;

    @CommandLine.Option(
            names = {"--output"},
            paramLabel = "text|json",
            description = "Report format (default: from config, else text).")
    String output;

    @CommandLine.Option(
            names = {"--log_level"},
            paramLabel = "DEBUG|INFO|WARNING|ERROR|CRITICAL",
            description = "Logging level (default: from config, else INFO).")
    String logLevel;

    @CommandLine.Option(
            names = {"--config"},
            paramLabel = "path",
            description = "Optional YAML configuration file.")
    Path configFile;

    private final Function<String, String> envLookup;
    private final DocumentParser parser = new DocumentParser();
    private final DiagnosticReporter reporter = new DiagnosticReporter();

    ValidateCommand(Function<String, String> envLookup) {
        this.envLookup = envLookup;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CliConfig config;
        try {
            config = ConfigLoader.load(configFile, envLookup);
        } catch (ConfigLoadException e) {
            err.println("Error: " + e.getMessage());
            return ExitCodes.INPUT_ERROR;
        }
        LogbackConfigurator.configure(config.loggingFormat(), level(logLevel != null ? logLevel : config.loggingLevel()));
        Dialect effectiveDialect = dialect(dialect != null ? dialect : config.dialect());
        String format = outputFormat(output != null ? output : config.outputFormat());

        List<Path> dataFiles = new ArrayList<>();
        dataFiles.add(dataFile);
        dataFiles.addAll(moreDataFiles);

        SchemaDocument schema;
        List<String> labels = new ArrayList<>();
        List<Instance> instances = new ArrayList<>();
        try {
            DocumentLoader.LoadedFile schemaInput = DocumentLoader.read(schemaFile, schemaType);
            schema = parser.parseSchema(
                    schemaInput.content(), schemaInput.contentType(), schemaInput.label(), effectiveDialect);
            for (Path path : dataFiles) {
                DocumentLoader.LoadedFile dataInput = DocumentLoader.read(path, dataType);
                instances.add(parser.parseInstance(dataInput.content(), dataInput.contentType(), dataInput.label()));
                labels.add(dataInput.label());
            }
        } catch (InputFileException | DocumentParseException e) {
            LOG.debug("Input rejected", e);
            err.println("Error: " + e.getMessage());
            return ExitCodes.INPUT_ERROR;
        }
        LOG.debug("Schema '{}' loaded: {} nodes, dialect {}", schema.source(), schema.size(), schema.dialect().id());

        SchemaValidator validator = new SchemaValidator(config.toValidatorOptions(direction));
        List<BatchEntry> entries = instances.size() == 1
                ? List.of(validateOne(validator, schema, labels.get(0), instances.get(0)))
                : validateBatch(validator, schema, instances, labels);

        if ("json".equals(format)) {
            writeJson(out, labels, entries);
        } else {
            writeText(out, err, labels, entries);
        }
        out.flush();
        return exitCode(entries);
    }

    private BatchEntry validateOne(SchemaValidator validator, SchemaDocument schema, String label, Instance instance) {
        MDC.put(MDC_DOCUMENT, label);
        try {
            return BatchEntry.completed(0, validator.validate(schema, schemaPointer, instance));
        } catch (LimitExceededException e) {
            LOG.warn("Validation aborted: {}", e.getMessage());
            return BatchEntry.limitExceeded(0, e);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private List<BatchEntry> validateBatch(
            SchemaValidator validator, SchemaDocument schema, List<Instance> instances, List<String> labels) {
        int threads = Math.min(instances.size(), Math.max(1, Runtime.getRuntime().availableProcessors()));
        try (BatchValidator batch = new BatchValidator(validator, threads)) {
            return batch.validateAll(schema, schemaPointer, instances, labels);
        }
    }

    private void writeText(PrintWriter out, PrintWriter err, List<String> labels, List<BatchEntry> entries) {
        boolean several = entries.size() > 1;
        for (BatchEntry entry : entries) {
            String label = labels.get(entry.index());
            String prefix = several ? label + ": " : "";
            MDC.put(MDC_DOCUMENT, label);
            try {
                if (entry.aborted()) {
                    err.println("Error: " + prefix + entry.error().getMessage());
                } else if (entry.valid()) {
                    LOG.info("Data validation successful");
                    out.println(prefix + "Validation successful!");
                } else {
                    LOG.info("Data validation failed with {} error(s)", entry.result().failureCount());
                    out.println(prefix + "Validation failed with " + entry.result().failureCount() + " error(s):");
                    for (FailureRecord failure : entry.result().failures()) {
                        out.println("  " + reporter.line(failure));
                    }
                }
            } finally {
                MDC.remove(MDC_DOCUMENT);
            }
        }
    }

    private void writeJson(PrintWriter out, List<String> labels, List<BatchEntry> entries) {
        ArrayNode reports = JSON.createArrayNode();
        for (BatchEntry entry : entries) {
            ObjectNode report = reports.addObject();
            report.put("file", labels.get(entry.index()));
            if (entry.aborted()) {
                report.put("valid", false);
                report.put("aborted", true);
                report.put("error", entry.error().getMessage());
            } else {
                report.setAll(reporter.toJson(entry.result()));
            }
        }
        try {
            out.println(JSON.writeValueAsString(reports.size() == 1 ? reports.get(0) : reports));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize report", e);
        }
    }

    private static int exitCode(List<BatchEntry> entries) {
        int code = ExitCodes.VALID;
        for (BatchEntry entry : entries) {
            if (entry.aborted()) {
                return ExitCodes.LIMIT_EXCEEDED;
            }
            if (!entry.valid()) {
                code = ExitCodes.INVALID;
            }
        }
        return code;
    }

    private Level level(String name) {
        try {
            return LogbackConfigurator.toLevel(name);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Dialect dialect(String id) {
        if ("auto".equalsIgnoreCase(id)) {
            return null;
        }
        try {
            return Dialect.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "Invalid --dialect '" + id + "'; expected json-schema, openapi-3.0 or auto", e);
        }
    }

    private String outputFormat(String value) {
        if ("text".equalsIgnoreCase(value) || "json".equalsIgnoreCase(value)) {
            return value.toLowerCase(Locale.ROOT);
        }
        throw new CommandLine.ParameterException(
                spec.commandLine(), "Invalid --output '" + value + "'; expected text or json");
    }
}
