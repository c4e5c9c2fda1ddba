package io.apicheck.cli.config;

import io.apicheck.core.engine.ValidatorOptions;
import io.apicheck.core.model.MessageDirection;

/**
 * Effective CLI configuration after YAML and environment overlay. Command-line flags are applied
 * on top by the command itself.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param maxDepth      maximum active reference depth ({@code limits.max-depth})
 * @param maxSteps      maximum node evaluations per instance ({@code limits.max-steps})
 * @param dialect       {@code auto}, {@code json-schema} or {@code openapi-3.0}
 *                      ({@code validation.dialect})
 * @param outputFormat  {@code text} or {@code json} ({@code output.format})
 * @param loggingLevel  root log level name ({@code logging.level})
 * @param loggingFormat {@code text} or {@code json} ({@code logging.format})
 */
public record CliConfig(
        int maxDepth, long maxSteps, String dialect, String outputFormat, String loggingLevel, String loggingFormat) {

    /** All defaults, as used when no file and no environment variable is given. */
    public static final CliConfig DEFAULT = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    /** Validator options for these limits and the given message direction. */
    public ValidatorOptions toValidatorOptions(MessageDirection direction) {
        return new ValidatorOptions(maxDepth, maxSteps, direction);
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private int maxDepth = ValidatorOptions.DEFAULT.maxDepth();
        private long maxSteps = ValidatorOptions.DEFAULT.maxSteps();
        private String dialect = "auto";
        private String outputFormat = "text";
        private String loggingLevel = "INFO";
        private String loggingFormat = "text";

        Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder dialect(String dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a value is out of range or not one of its choices
         */
        public CliConfig build() {
            if (maxDepth <= 0) {
                throw new ConfigLoadException("limits.max-depth must be positive, got: " + maxDepth);
            }
            if (maxSteps <= 0) {
                throw new ConfigLoadException("limits.max-steps must be positive, got: " + maxSteps);
            }
            requireOneOf("validation.dialect", dialect, "auto", "json-schema", "openapi-3.0");
            requireOneOf("output.format", outputFormat, "text", "json");
            requireOneOf("logging.format", loggingFormat, "text", "json");
            return new CliConfig(maxDepth, maxSteps, dialect, outputFormat, loggingLevel, loggingFormat);
        }

        private static void requireOneOf(String key, String value, String... allowed) {
            for (String candidate : allowed) {
                if (candidate.equals(value)) {
                    return;
                }
            }
            throw new ConfigLoadException(
                    key + " must be one of " + String.join(", ", allowed) + ", got: '" + value + "'");
        }
    }
}
