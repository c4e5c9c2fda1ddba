package io.apicheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Value helpers shared by the keyword evaluators.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    private static final int DESCRIBE_LIMIT = 60;

    private JsonValues() {}

    /**
     * Returns the exact decimal value of a numeric node, or {@code null} for non-numbers and
     * non-finite doubles.
     */
    public static BigDecimal decimal(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        return node.decimalValue();
    }

    /**
     * Structural equality: numbers compare by value ({@code 1} equals {@code 1.0}), objects
     * ignore key order, arrays compare element-wise in order.
     */
    public static boolean equal(JsonNode a, JsonNode b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a.isNumber() && b.isNumber()) {
            BigDecimal x = decimal(a);
            BigDecimal y = decimal(b);
            if (x == null || y == null) {
                return a.equals(b);
            }
            return x.compareTo(y) == 0;
        }
        if (a.getNodeType() != b.getNodeType()) {
            return false;
        }
        if (a.isArray()) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a.isObject()) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode other = b.get(field.getKey());
                if (other == null || !equal(field.getValue(), other)) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /** Compact JSON rendering for messages, truncated to a readable length. */
    public static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "(missing)";
        }
        String text = node.toString();
        return text.length() <= DESCRIBE_LIMIT ? text : text.substring(0, DESCRIBE_LIMIT - 3) + "...";
    }
}
