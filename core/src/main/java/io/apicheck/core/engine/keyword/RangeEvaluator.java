package io.apicheck.core.engine.keyword;

import static io.apicheck.core.engine.keyword.KeywordSupport.details;
import static io.apicheck.core.engine.keyword.KeywordSupport.invalidKeyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.EvaluationContext;
import io.apicheck.core.engine.JsonValues;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import io.apicheck.core.schema.SchemaKind;
import io.apicheck.core.schema.SchemaNode;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Numeric bounds and {@code multipleOf}, compared as {@link BigDecimal}.
 *
 * <p>
 * {@code exclusiveMinimum}/{@code exclusiveMaximum} are accepted in both styles: as a number
 * (a bound of its own) or as a boolean that makes the sibling {@code minimum}/{@code maximum}
 * exclusive. Non-numeric instances pass.
 */
public final class RangeEvaluator implements ConstraintEvaluator {

    @Override
    public SchemaKind kind() {
        return SchemaKind.TYPE_CONSTRAINT;
    }

    @Override
    public Set<String> keywords() {
        return Set.of("minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf");
    }

    @Override
    public List<FailureRecord> evaluate(
            String keyword,
            SchemaNode node,
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            EvaluationContext context) {
        BigDecimal actual = JsonValues.decimal(instance);
        if (actual == null) {
            return List.of();
        }
        JsonNode raw = node.keyword(keyword);
        if (raw != null && raw.isBoolean() && keyword.startsWith("exclusive")) {
            return List.of(); // modifier of minimum/maximum
        }
        BigDecimal bound = JsonValues.decimal(raw);
        if (bound == null) {
            return invalidKeyword(instancePath, schemaPath, keyword, "expected a number");
        }

        return switch (keyword) {
            case "minimum" -> {
                boolean exclusive = booleanModifier(node, "exclusiveMinimum");
                int cmp = actual.compareTo(bound);
                yield cmp < 0 || (exclusive && cmp == 0)
                        ? below(instance, instancePath, schemaPath, keyword, bound, exclusive)
                        : List.of();
            }
            case "exclusiveMinimum" -> actual.compareTo(bound) <= 0
                    ? below(instance, instancePath, schemaPath, keyword, bound, true)
                    : List.of();
            case "maximum" -> {
                boolean exclusive = booleanModifier(node, "exclusiveMaximum");
                int cmp = actual.compareTo(bound);
                yield cmp > 0 || (exclusive && cmp == 0)
                        ? above(instance, instancePath, schemaPath, keyword, bound, exclusive)
                        : List.of();
            }
            case "exclusiveMaximum" -> actual.compareTo(bound) >= 0
                    ? above(instance, instancePath, schemaPath, keyword, bound, true)
                    : List.of();
            case "multipleOf" -> multipleOf(instance, actual, bound, instancePath, schemaPath);
            default -> List.of();
        };
    }

    private static List<FailureRecord> multipleOf(
            JsonNode instance, BigDecimal actual, BigDecimal divisor, Location instancePath, Location schemaPath) {
        if (divisor.signum() <= 0) {
            return invalidKeyword(instancePath, schemaPath, "multipleOf", "expected a number greater than 0");
        }
        if (isMultiple(actual, divisor)) {
            return List.of();
        }
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child("multipleOf"),
                FailureKind.NOT_MULTIPLE_OF,
                "Value " + JsonValues.describe(instance) + " is not a multiple of " + render(divisor),
                details("multipleOf", divisor, "actual", actual)));
    }

    /**
     * Exact divisibility without dividing. With {@code a = ua * 10^-sa} and {@code d = ud * 10^-sd}
     * (trailing zeros stripped), {@code a / d} is an integer iff {@code ua * 10^(sd - sa)} is a
     * multiple of {@code ud}. When the exponent is negative, {@code ua} would need a factor of ten it
     * cannot have. Cost depends on the digit counts, not on the exponents.
     */
    static boolean isMultiple(BigDecimal actual, BigDecimal divisor) {
        if (actual.signum() == 0) {
            return true;
        }
        BigDecimal a = actual.stripTrailingZeros();
        BigDecimal d = divisor.stripTrailingZeros();
        long exponent = (long) d.scale() - a.scale();
        if (exponent < 0) {
            return false;
        }
        BigInteger modulus = d.unscaledValue().abs();
        BigInteger shift = BigInteger.TEN.modPow(BigInteger.valueOf(exponent), modulus);
        return a.unscaledValue().abs().mod(modulus).multiply(shift).mod(modulus).signum() == 0;
    }

    // plain notation only while it stays short; 1e999999999 would expand to a billion digits
    private static String render(BigDecimal value) {
        return Math.abs((long) value.stripTrailingZeros().scale()) <= 64 ? value.toPlainString() : value.toString();
    }

    private static boolean booleanModifier(SchemaNode node, String keyword) {
        JsonNode value = node.keyword(keyword);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    private static List<FailureRecord> below(
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            String keyword,
            BigDecimal bound,
            boolean exclusive) {
        String relation = exclusive ? "greater than " : "at least ";
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child(keyword),
                FailureKind.BELOW_MINIMUM,
                "Value " + JsonValues.describe(instance) + " must be " + relation + render(bound),
                details("minimum", bound, "exclusive", exclusive, "actual", JsonValues.decimal(instance))));
    }

    private static List<FailureRecord> above(
            JsonNode instance,
            Location instancePath,
            Location schemaPath,
            String keyword,
            BigDecimal bound,
            boolean exclusive) {
        String relation = exclusive ? "less than " : "at most ";
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child(keyword),
                FailureKind.ABOVE_MAXIMUM,
                "Value " + JsonValues.describe(instance) + " must be " + relation + render(bound),
                details("maximum", bound, "exclusive", exclusive, "actual", JsonValues.decimal(instance))));
    }
}
