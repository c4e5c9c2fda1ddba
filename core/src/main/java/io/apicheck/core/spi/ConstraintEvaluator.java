package io.apicheck.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import java.util.List;
import java.util.Set;

/**
 * SPI for one family of schema keywords (type, range, object shape, ...).
 *
 * <p>
 * The engine walks a schema node's keywords in declaration order and hands each keyword to the
 * evaluator registered for it in {@link io.apicheck.core.engine.EvaluatorRegistry}. Registering a
 * new evaluator adds keywords without touching the engine.
 *
 * <p>
 * Implementations MUST be thread-safe and MUST NOT throw for an instance that violates the
 * constraint: violations are returned as records. Sub-schemas are evaluated through
 * {@link EvaluationContext#evaluate} so step and depth limits apply.
 */
public interface ConstraintEvaluator {

    /** The schema kind this family belongs to. */
    SchemaKind kind();

    /** Keywords handled by this evaluator. */
    Set<String> keywords();

    /**
     * Evaluates one keyword of {@code node} against an instance value.
     *
     * @param keyword      the keyword being evaluated (one of {@link #keywords()})
     * @param node         the schema node declaring the keyword
     * @param instance     the instance value at {@code instancePath}
     * @param instancePath path from the instance root to {@code instance}
     * @param schemaPath   path from the schema root to {@code node}, including traversed
     *                     references; implementations append the keyword themselves
     * @param context      the per-call evaluation context
     * @return the violations found, in a deterministic order; empty if the keyword passes
     */
    List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context);
}
