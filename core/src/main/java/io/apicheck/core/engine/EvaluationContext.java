package io.apicheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.error.LimitExceededException;
import io.apicheck.core.model.Dialect;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.MessageDirection;
import io.apicheck.core.schema.SchemaDocument;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State of one validation call: the document, the options, the evaluator and format registries,
 * the reference chain and the step counter.
 *
 * <p>
 * Evaluators recurse into sub-schemas through {@link #evaluate}, which is also where every node
 * evaluation is counted against {@link ValidatorOptions#maxSteps()}.
 *
 * <p>
 * Not thread-safe. {@link SchemaValidator} creates a fresh context per call.
 */
public final class EvaluationContext {

    private final SchemaDocument document;
    private final ValidatorOptions options;
    private final EvaluatorRegistry evaluators;
    private final FormatRegistry formats;
    private final ReferenceResolver resolver;
    private final ResolutionContext resolution = new ResolutionContext();
    private long steps;

    EvaluationContext(
            SchemaDocument document,
            ValidatorOptions options,
            EvaluatorRegistry evaluators,
            FormatRegistry formats,
            ReferenceResolver resolver) {
        this.document = document;
        this.options = options;
        this.evaluators = evaluators;
        this.formats = formats;
        this.resolver = resolver;
    }

    /**
     * Evaluates a schema node against an instance value and returns every violation found.
     *
     * @param node         the schema node
     * @param instance     the instance value
     * @param instancePath where the value sits in the instance
     * @param schemaPath   where the node sits in the schema, references included
     * @return the violations in keyword declaration order; empty if the value conforms
     * @throws LimitExceededException if the step limit is exceeded
     */
    public List<FailureRecord> evaluate(
            SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath) {
        step(node);
        if (node.kind() == SchemaKind.BOOLEAN_LITERAL) {
            if (node.booleanValue()) {
                return List.of();
            }
            return List.of(FailureRecord.of(
                    instancePath, schemaPath, FailureKind.FALSE_SCHEMA, "No value is allowed here (schema is false)"));
        }

        if (node.kind() == SchemaKind.REFERENCE && dialect().refOverridesSiblings()) {
            return dispatch("$ref", node, instance, instancePath, schemaPath);
        }
        List<FailureRecord> failures = new ArrayList<>();
        for (String keyword : node.keywordNames()) {
            failures.addAll(dispatch(keyword, node, instance, instancePath, schemaPath));
        }
        return failures;
    }

    /**
     * The {@link FailureKind.Category#STRUCTURAL structural} records among {@code failures}, as a new
     * mutable list.
     *
     * <p>
     * Callers that only use a sub-schema's verdict ({@code not}, {@code if}, the losing branches of
     * {@code anyOf}/{@code oneOf}, {@code contains}) still report these: a broken reference inside
     * such a branch must never turn into a silent pass.
     */
    public static List<FailureRecord> structural(List<FailureRecord> failures) {
        List<FailureRecord> structural = new ArrayList<>();
        for (FailureRecord failure : failures) {
            if (failure.category() == FailureKind.Category.STRUCTURAL) {
                structural.add(failure);
            }
        }
        return structural;
    }

    private List<FailureRecord> dispatch(
            String keyword, SchemaNode node, JsonNode instance, Location instancePath, Location schemaPath) {
        Optional<ConstraintEvaluator> evaluator = evaluators.lookup(keyword);
        if (evaluator.isEmpty()) {
            return List.of();
        }
        return evaluator.get().evaluate(keyword, node, instance, instancePath, schemaPath, this);
    }

    private void step(SchemaNode node) {
        if (++steps > options.maxSteps()) {
            throw new LimitExceededException(options.maxSteps(), node.pointer());
        }
    }

    public SchemaDocument document() {
        return document;
    }

    public Dialect dialect() {
        return document.dialect();
    }

    public ValidatorOptions options() {
        return options;
    }

    /** The message direction, or {@code null} when access modes are not checked. */
    public MessageDirection direction() {
        return options.direction();
    }

    public FormatRegistry formats() {
        return formats;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    public ResolutionContext resolution() {
        return resolution;
    }

    /** Node evaluations performed so far in this call. */
    public long steps() {
        return steps;
    }
}
