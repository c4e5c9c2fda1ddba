package io.apicheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.error.LimitExceededException;
import io.apicheck.core.error.UnresolvedReferenceException;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Instance;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.ValidationResult;
import io.apicheck.core.schema.JsonPointers;
import io.apicheck.core.schema.SchemaDocument;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates instances against parsed schema documents.
 *
 * <p>
 * Evaluation is depth-first: a node's keywords are evaluated in declaration order and combinator
 * branches in declared order, so equal inputs always give equal results. Every violation is
 * collected; evaluation only stops early when the step limit is exceeded.
 *
 * <p>
 * Thread-safe: all per-call state lives in a fresh {@link EvaluationContext}. One validator can
 * be shared by any number of threads and documents.
 */
public final class SchemaValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaValidator.class);

    private final ValidatorOptions options;
    private final EvaluatorRegistry evaluators;
    private final FormatRegistry formats;

    /** Creates a validator with default options, evaluators and formats. */
    public SchemaValidator() {
        this(ValidatorOptions.DEFAULT);
    }

    public SchemaValidator(ValidatorOptions options) {
        this(options, EvaluatorRegistry.defaults(), FormatRegistry.defaults());
    }

    public SchemaValidator(ValidatorOptions options, EvaluatorRegistry evaluators, FormatRegistry formats) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.evaluators = Objects.requireNonNull(evaluators, "evaluators must not be null");
        this.formats = Objects.requireNonNull(formats, "formats must not be null");
    }

    /**
     * Validates an instance against the document root.
     *
     * @throws LimitExceededException if the step limit is exceeded
     */
    public ValidationResult validate(SchemaDocument document, Instance instance) {
        return validate(document, JsonPointers.ROOT, instance);
    }

    /**
     * Validates an instance against the sub-schema at {@code pointer}, e.g.
     * {@code #/components/schemas/Pet}. A pointer that does not resolve gives a single
     * {@code UNRESOLVED_REFERENCE} record.
     *
     * @param document the schema document
     * @param pointer  a local pointer into the document
     * @param instance the instance to validate
     * @return the result; valid iff no record was produced
     * @throws LimitExceededException if the step limit is exceeded
     */
    public ValidationResult validate(SchemaDocument document, String pointer, Instance instance) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(pointer, "pointer must not be null");
        Objects.requireNonNull(instance, "instance must not be null");

        ReferenceResolver resolver = new ReferenceResolver(document);
        EvaluationContext context = new EvaluationContext(document, options, evaluators, formats, resolver);

        List<FailureRecord> failures;
        try {
            ResolvedReference start = resolver.resolve(pointer, context.resolution());
            Location schemaPath = schemaLocation(document.rawRoot(), start.pointer());
            failures = context.evaluate(start.target(), instance.node(), Location.ROOT, schemaPath);
        } catch (UnresolvedReferenceException e) {
            failures = List.of(new FailureRecord(
                    Location.ROOT,
                    Location.ROOT,
                    FailureKind.UNRESOLVED_REFERENCE,
                    e.getMessage(),
                    Map.of("reference", pointer)));
        }

        ValidationResult result = ValidationResult.of(failures);
        LOG.debug(
                "Validated against '{}' ({}): {} failure(s), {} step(s)",
                document.source(),
                pointer,
                result.failureCount(),
                context.steps());
        return result;
    }

    /** Array indices in the pointer become {@link Integer} segments, as evaluators write them. */
    static Location schemaLocation(JsonNode root, String pointer) {
        Location location = Location.ROOT;
        JsonNode current = root;
        for (String segment : JsonPointers.decode(pointer)) {
            if (current != null && current.isArray() && !segment.isEmpty() && segment.length() < 10
                    && segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                location = location.child(index);
                current = current.get(index);
            } else {
                location = location.child(segment);
                current = current == null ? null : current.get(segment);
            }
        }
        return location;
    }

    public ValidatorOptions options() {
        return options;
    }
}
