package io.apicheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/**
 * Keyword-interpretation profile for a schema document.
 *
 * <ul>
 * <li>{@link #JSON_SCHEMA}: JSON-Schema semantics: keywords next to {@code $ref} are evaluated
 * too, {@code nullable} is an unknown keyword.</li>
 * <li>{@link #OPENAPI_3_0}: OpenAPI 3.0 schema objects: keywords next to {@code $ref} are
 * ignored, {@code nullable: true} admits {@code null}, {@code readOnly}/{@code writeOnly} apply
 * per message direction.</li>
 * </ul>
 */
public enum Dialect {
    JSON_SCHEMA("json-schema"),
    OPENAPI_3_0("openapi-3.0");

    private final String id;

    Dialect(String id) {
        this.id = id;
    }

    /** The identifier used on the command line and in configuration. */
    public String id() {
        return id;
    }

    /** {@code true} if keywords next to {@code $ref} are ignored. */
    public boolean refOverridesSiblings() {
        return this == OPENAPI_3_0;
    }

    /** {@code true} if {@code nullable} and the access-mode keywords are honoured. */
    public boolean openApiKeywords() {
        return this == OPENAPI_3_0;
    }

    /**
     * Looks a dialect up by identifier, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown identifier
     */
    public static Dialect fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (Dialect dialect : values()) {
            if (dialect.id.equals(normalized)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown schema dialect: '" + id + "' (expected json-schema or openapi-3.0)");
    }

    /**
     * Picks {@link #OPENAPI_3_0} for a document with a top-level {@code openapi: 3.0.x} key, and
     * {@link #JSON_SCHEMA} otherwise.
     */
    public static Dialect detect(JsonNode root) {
        if (root != null && root.isObject()) {
            JsonNode version = root.get("openapi");
            if (version != null && version.isTextual() && version.asText().startsWith("3.0")) {
                return OPENAPI_3_0;
            }
        }
        return JSON_SCHEMA;
    }
}
