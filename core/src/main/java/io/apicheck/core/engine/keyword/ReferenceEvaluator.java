package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.engine.ResolutionContext;
import io.apicheck.core.engine.ResolvedReference;
import io.apicheck.core.error.UnresolvedReferenceException;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.List;
import java.util.Set;

/**
 * {@code $ref}: resolves the target and evaluates the instance against it, with the schema path
 * extended by {@code $ref} and the target pointer.
 *
 * <p>
 * The target pointer is pushed on the reference chain while it is evaluated. Once the chain holds
 * {@code maxDepth} entries a further reference yields {@code DEPTH_EXCEEDED} instead of being
 * followed, which is what ends self-referencing schemas on very deep instances. A reference that
 * cannot be resolved yields {@code UNRESOLVED_REFERENCE}; sibling keywords are still evaluated.
 */
public final class ReferenceEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.REFERENCE;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("$ref");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        String ref = node.refTarget();
        if (ref == null) {
            return List.of(); // non-string $ref is an unknown keyword value
        }
        Location refPath = schemaPath.child("$ref");
        ResolutionContext resolution = context.resolution();

        ResolvedReference resolved;
        try {
            resolved = context.resolver().resolve(ref, resolution);
        } catch (UnresolvedReferenceException e) {
            return List.of(new FailureRecord(
                    instancePath,
                    refPath,
                    FailureKind.UNRESOLVED_REFERENCE,
                    e.getMessage(),
                    details("reference", ref)));
        }

        int maxDepth = context.options().maxDepth();
        if (resolution.depth() >= maxDepth) {
            return List.of(new FailureRecord(
                    instancePath,
                    refPath,
                    FailureKind.DEPTH_EXCEEDED,
                    "Reference '" + ref + "' exceeds the maximum reference depth of " + maxDepth,
                    details("reference", ref, "maxDepth", maxDepth, "recursive", resolved.recursive())));
        }

        resolution.enter(resolved.pointer());
        try {
            return context.evaluate(resolved.target(), instance, instancePath, refPath.child(resolved.pointer()));
        } finally {
            resolution.exit();
        }
    }
}
