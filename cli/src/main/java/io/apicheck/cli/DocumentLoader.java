package io.apicheck.cli;

import io.apicheck.core.model.ContentType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads schema and data files and decides their content type. */
final class DocumentLoader {

    /**
     * A file read into memory.
     *
     * @param label       name used in messages and reports
     * @param contentType JSON or YAML
     * @param content     the UTF-8 text
     */
    record LoadedFile(String label, ContentType contentType, String content) {}

    private DocumentLoader() {}

    /**
     * Reads a file.
     *
     * @param path     the file
     * @param explicit content type given on the command line, or {@code null} to infer it from the
     *                 extension
     * @throws InputFileException if the file is missing or unreadable, or its type is unsupported
     */
    static LoadedFile read(Path path, ContentType explicit) {
        String label = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new InputFileException("File not found: " + label);
        }
        ContentType contentType = explicit != null
                ? explicit
                : ContentType.fromFileName(label)
                        .orElseThrow(() -> new InputFileException("Unsupported file type: " + label
                                + ". Must be .json, .yaml or .yml, or pass --data_type/--schema_type"));
        try {
            return new LoadedFile(label, contentType, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InputFileException("Cannot read " + label + ": " + e.getMessage(), e);
        }
    }
}
