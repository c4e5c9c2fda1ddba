package io.apicheck.core.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.apicheck.core.error.InstanceParseException;
import io.apicheck.core.error.SchemaParseException;
import io.apicheck.core.model.ContentType;
import io.apicheck.core.model.Dialect;
import io.apicheck.core.model.Instance;
import java.util.Objects;

/**
 * Turns raw schema and instance text into the document model.
 *
 * <p>
 * Numbers are read as {@link java.math.BigDecimal}/{@link java.math.BigInteger} so range checks
 * and the integer test see the exact written value. Duplicate object keys and trailing content are
 * parse errors.
 *
 * <p>
 * Thread-safe: the underlying Jackson mappers are configured once and only read afterwards.
 */
public final class DocumentParser {

    /** Source label used when the caller does not name one. */
    public static final String INLINE_SOURCE = "<inline>";

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private final SchemaParser schemaParser;

    public DocumentParser() {
        this(new SchemaParser());
    }

    public DocumentParser(SchemaParser schemaParser) {
        this.schemaParser = Objects.requireNonNull(schemaParser, "schemaParser must not be null");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    /**
     * Parses a schema document, detecting the dialect from its content.
     *
     * @see #parseSchema(String, ContentType, String, Dialect)
     */
    public SchemaDocument parseSchema(String raw, ContentType contentType, String source) {
        return parseSchema(raw, contentType, source, null);
    }

    /**
     * Parses a schema document.
     *
     * @param raw         the schema text
     * @param contentType JSON or YAML
     * @param source      file name or other label for messages; {@code null} means inline
     * @param dialect     keyword profile, or {@code null} to {@link Dialect#detect detect} it
     * @return the parsed document
     * @throws SchemaParseException if the text is malformed or its root is not a schema
     */
    public SchemaDocument parseSchema(String raw, ContentType contentType, String source, Dialect dialect) {
        String label = source != null ? source : INLINE_SOURCE;
        JsonNode root;
        try {
            root = readTree(raw, contentType);
        } catch (JsonProcessingException e) {
            throw new SchemaParseException(
                    String.format("Malformed %s schema in '%s': %s", contentType, label, e.getOriginalMessage()),
                    e,
                    label);
        }
        return parseSchema(root, label, dialect);
    }

    /**
     * Builds a schema document from an already parsed tree.
     *
     * @param root    the raw root node
     * @param source  label for messages; {@code null} means inline
     * @param dialect keyword profile, or {@code null} to detect it
     */
    public SchemaDocument parseSchema(JsonNode root, String source, Dialect dialect) {
        String label = source != null ? source : INLINE_SOURCE;
        Dialect effective = dialect != null ? dialect : Dialect.detect(root);
        return schemaParser.parse(root, effective, label);
    }

    /**
     * Parses the data under validation.
     *
     * @param raw         the instance text
     * @param contentType JSON or YAML
     * @param source      file name or other label for messages; {@code null} means inline
     * @return the instance
     * @throws InstanceParseException if the text is empty or malformed
     */
    public Instance parseInstance(String raw, ContentType contentType, String source) {
        String label = source != null ? source : INLINE_SOURCE;
        JsonNode root;
        try {
            root = readTree(raw, contentType);
        } catch (JsonProcessingException e) {
            throw new InstanceParseException(
                    String.format("Malformed %s data in '%s': %s", contentType, label, e.getOriginalMessage()),
                    e,
                    label);
        }
        if (root == null || root.isMissingNode()) {
            throw new InstanceParseException("Data document '" + label + "' is empty", label);
        }
        return Instance.of(root);
    }

    private static JsonNode readTree(String raw, ContentType contentType) throws JsonProcessingException {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
        ObjectMapper mapper = contentType == ContentType.YAML ? YAML_MAPPER : JSON_MAPPER;
        return mapper.readTree(raw);
    }
}
