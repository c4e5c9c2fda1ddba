package io.apicheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/**
 * Runtime category of an instance value, using JSON-Schema type names.
 *
 * <p>
 * {@link #INTEGER} means "no fractional component", independent of how the number was written or
 * stored: {@code 1}, {@code 1.0} and {@code 1e2} are integers, {@code 1.5} is not.
 */
public enum InstanceType {
    NULL("null"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    NUMBER("number"),
    STRING("string"),
    ARRAY("array"),
    OBJECT("object");

    private final String typeName;

    InstanceType(String typeName) {
        this.typeName = typeName;
    }

    /** The JSON-Schema type name, e.g. {@code "integer"}. */
    public String typeName() {
        return typeName;
    }

    /**
     * Classifies a JSON node.
     *
     * @param node the node to classify; {@code null} and missing nodes are treated as JSON null
     * @return the instance type
     */
    public static InstanceType of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        if (node.isNumber()) {
            return isIntegral(node) ? INTEGER : NUMBER;
        }
        if (node.isTextual()) {
            return STRING;
        }
        if (node.isArray()) {
            return ARRAY;
        }
        if (node.isObject()) {
            return OBJECT;
        }
        // binary/POJO nodes never come out of the parsers; report them as strings
        return STRING;
    }

    /**
     * Returns {@code true} if the declared JSON-Schema type name accepts a value of this type.
     * {@code "number"} accepts integers; unknown type names accept nothing.
     */
    public boolean satisfies(String declaredType) {
        if (typeName.equals(declaredType)) {
            return true;
        }
        return this == INTEGER && NUMBER.typeName.equals(declaredType);
    }

    private static boolean isIntegral(JsonNode node) {
        if (node.isIntegralNumber()) {
            return true;
        }
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d);
        }
        BigDecimal value = node.decimalValue();
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
