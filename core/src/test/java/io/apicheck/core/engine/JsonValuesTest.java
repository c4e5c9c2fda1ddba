package io.apicheck.core.engine;

import static io.apicheck.core.testkit.TestDocuments.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("JsonValues")
class JsonValuesTest {

    @ParameterizedTest(name = "{0} equals {1}: {2}")
    @CsvSource(
            delimiter = '|',
            value = {
                "1                    | 1.0                  | true",
                "1e2                  | 100                  | true",
                "1                    | \"1\"                | false",
                "{\"a\": 1, \"b\": [1]} | {\"b\": [1.0], \"a\": 1} | true",
                "{\"a\": 1}           | {\"a\": 1, \"b\": 2} | false",
                "[1, 2]               | [2, 1]               | false",
                "null                 | null                 | true",
                "true                 | 1                    | false",
            })
    void structuralEquality(String left, String right, boolean expected) {
        assertThat(JsonValues.equal(json(left), json(right))).isEqualTo(expected);
        assertThat(JsonValues.equal(json(right), json(left))).isEqualTo(expected);
    }

    @Test
    @DisplayName("decimal is exact and null for non-numbers")
    void decimal() {
        assertThat(JsonValues.decimal(json("0.1"))).isEqualByComparingTo(new BigDecimal("0.1"));
        assertThat(JsonValues.decimal(json("12345678901234567890"))).isEqualByComparingTo("12345678901234567890");
        assertThat(JsonValues.decimal(json("\"3\""))).isNull();
        assertThat(JsonValues.decimal(DoubleNode.valueOf(Double.NaN))).isNull();
        assertThat(JsonValues.decimal(null)).isNull();
    }

    @Test
    @DisplayName("describe truncates long values")
    void describe() {
        assertThat(JsonValues.describe(json("\"abc\""))).isEqualTo("\"abc\"");
        assertThat(JsonValues.describe(MissingNode.getInstance())).isEqualTo("(missing)");
        String longValue = JsonValues.describe(json("\"" + "x".repeat(100) + "\""));
        assertThat(longValue).hasSize(60).endsWith("...");
    }
}
