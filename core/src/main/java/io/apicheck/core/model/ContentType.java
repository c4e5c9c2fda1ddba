package io.apicheck.core.model;

import java.util.Locale;
import java.util.Optional;

/** Serialization of a raw schema or instance document. */
public enum ContentType {
    JSON,
    YAML;

    /**
     * Infers the content type from a file name extension ({@code .json}, {@code .yaml},
     * {@code .yml}), case-insensitively.
     *
     * @return the content type, or empty for any other extension
     */
    public static Optional<ContentType> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return Optional.of(JSON);
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return Optional.of(YAML);
        }
        return Optional.empty();
    }
}
