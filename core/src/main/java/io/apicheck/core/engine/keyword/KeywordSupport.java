package io.apicheck.core.engine.keyword;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.FailureRecord;
import io.apicheck.core.model.Location;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Record-building helpers shared by the built-in evaluators. */
final class KeywordSupport {

    private KeywordSupport() {}

    /** Builds an ordered details map from alternating keys and values. */
    static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details need key/value pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            details.put((String) keyValues[i], keyValues[i + 1]);
        }
        return details;
    }

    /** A single {@code INVALID_KEYWORD} record for a keyword whose value is unusable. */
    static List<FailureRecord> invalidKeyword(
            Location instancePath, Location schemaPath, String keyword, String reason) {
        return List.of(new FailureRecord(
                instancePath,
                schemaPath.child(keyword),
                FailureKind.INVALID_KEYWORD,
                "Keyword '" + keyword + "' is invalid: " + reason,
                details("keyword", keyword)));
    }

    /** Returns the value as a non-negative int, or -1 if it is not one. */
    static int nonNegativeInt(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return -1;
        }
        BigDecimal decimal = value.decimalValue();
        if (decimal.signum() < 0 || decimal.stripTrailingZeros().scale() > 0) {
            return -1;
        }
        return decimal.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0 ? Integer.MAX_VALUE : decimal.intValue();
    }
}
