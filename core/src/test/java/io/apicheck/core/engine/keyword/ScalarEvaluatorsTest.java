package io.apicheck.core.engine.keyword;

import static io.apicheck.core.testkit.TestDocuments.instance;
import static io.apicheck.core.testkit.TestDocuments.kinds;
import static io.apicheck.core.testkit.TestDocuments.schema;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.apicheck.core.engine.SchemaValidator;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.ValidationResult;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Type, enum, range, length and pattern keywords. */
@DisplayName("Scalar keyword evaluators")
class ScalarEvaluatorsTest {

    private final SchemaValidator validator = new SchemaValidator();

    private ValidationResult check(String schemaJson, String instanceJson) {
        return validator.validate(schema(schemaJson), instance(instanceJson));
    }

    @Nested
    @DisplayName("type")
    class Type {

        @ParameterizedTest(name = "{0} against {1} → valid={2}")
        @CsvSource(delimiter = '|', value = {
            "\"integer\"            | 5        | true",
            "\"integer\"            | 5.0      | true",
            "\"integer\"            | 5.5      | false",
            "\"number\"             | 5        | true",
            "\"string\"             | 5        | false",
            "[\"string\", \"null\"] | null     | true",
            "[\"string\", \"null\"] | true     | false",
            "\"object\"             | []       | false",
            "\"array\"              | []       | true",
            "\"uuid\"               | \"x\"    | false"
        })
        void typeMatching(String type, String value, boolean valid) {
            assertThat(check("{\"type\": " + type + "}", value).valid()).isEqualTo(valid);
        }

        @Test
        @DisplayName("union mismatch lists every expected type")
        void unionDetails() {
            ValidationResult result = check("{\"type\": [\"string\", \"null\"]}", "true");

            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.message()).isEqualTo("Expected one of [string, null] but found boolean");
                assertThat(f.details().get("expected")).isEqualTo(List.of("string", "null"));
            });
        }

        @Test
        @DisplayName("malformed type value → INVALID_KEYWORD")
        void malformedType() {
            assertThat(kinds(check("{\"type\": 7}", "1"))).containsExactly(FailureKind.INVALID_KEYWORD);
        }

        @Test
        @DisplayName("nullable only counts in OpenAPI documents")
        void nullableIgnoredInJsonSchema() {
            assertThat(kinds(check("{\"type\": \"string\", \"nullable\": true}", "null")))
                    .containsExactly(FailureKind.TYPE_MISMATCH);
        }
    }

    @Nested
    @DisplayName("enum / const")
    class Enums {

        @Test
        @DisplayName("numbers compare by value, objects ignore key order")
        void structuralEquality() {
            assertThat(check("{\"enum\": [1, \"a\"]}", "1.0").valid()).isTrue();
            assertThat(check("{\"enum\": [{\"a\": 1, \"b\": [1, 2]}]}", "{\"b\": [1, 2], \"a\": 1}").valid())
                    .isTrue();
            assertThat(check("{\"enum\": [[1, 2]]}", "[2, 1]").valid()).isFalse();
        }

        @Test
        @DisplayName("mismatch carries the allowed values")
        void enumMismatch() {
            ValidationResult result = check("{\"enum\": [\"a\", \"b\"]}", "\"c\"");

            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.kind()).isEqualTo(FailureKind.ENUM_MISMATCH);
                assertThat(f.schemaPath()).isEqualTo(Location.of("enum"));
                assertThat(f.message()).isEqualTo("Value \"c\" is not one of [\"a\",\"b\"]");
            });
        }

        @Test
        void constMismatch() {
            assertThat(kinds(check("{\"const\": {\"v\": 1}}", "{\"v\": 2}")))
                    .containsExactly(FailureKind.CONST_MISMATCH);
            assertThat(check("{\"const\": null}", "null").valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("numeric range")
    class Range {

        @ParameterizedTest(name = "{0} against {1} → valid={2}")
        @CsvSource(delimiter = '|', value = {
            "{\"minimum\": 3}                             | 3      | true",
            "{\"minimum\": 3}                             | 2.99   | false",
            "{\"minimum\": 3, \"exclusiveMinimum\": true} | 3      | false",
            "{\"exclusiveMinimum\": 3}                    | 3      | false",
            "{\"exclusiveMinimum\": 3}                    | 3.0001 | true",
            "{\"maximum\": 10}                            | 10     | true",
            "{\"maximum\": 10, \"exclusiveMaximum\": true}| 10     | false",
            "{\"exclusiveMaximum\": 10}                   | 9.999  | true",
            "{\"multipleOf\": 0.1}                        | 0.3    | true",
            "{\"multipleOf\": 0.1}                        | 0.35   | false",
            "{\"multipleOf\": 2}                          | 7      | false",
            "{\"minimum\": 100}                           | \"5\"  | true"
        })
        void bounds(String schemaJson, String value, boolean valid) {
            assertThat(check(schemaJson, value).valid()).isEqualTo(valid);
        }

        @Test
        @DisplayName("boolean exclusive modifier is reported through its minimum")
        void booleanModifierDetails() {
            ValidationResult result = check("{\"minimum\": 3, \"exclusiveMinimum\": true}", "3");

            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.kind()).isEqualTo(FailureKind.BELOW_MINIMUM);
                assertThat(f.schemaPath()).isEqualTo(Location.of("minimum"));
                assertThat(f.details()).containsEntry("exclusive", true);
                assertThat((BigDecimal) f.details().get("minimum")).isEqualByComparingTo("3");
            });
        }

        @ParameterizedTest(name = "{0} multiple of {1} → {2}")
        @CsvSource({
            "0.6, 0.3, true",
            "10, 0.5, true",
            "7.5, 2.5, true",
            "0.05, 0.1, false",
            "-9, 3, true",
            "0, 0.7, true",
            "1E+999999999, 0.3, false",
            "1E+999999999, 0.5, true",
            "3E+40, 3E+41, false",
            "1.5E-999999999, 5E-1000000000, true"
        })
        void divisibilityWithoutDivision(BigDecimal actual, BigDecimal divisor, boolean expected) {
            assertThat(RangeEvaluator.isMultiple(actual, divisor)).isEqualTo(expected);
        }

        @Test
        @DisplayName("multipleOf on a huge exponent is answered promptly")
        void hugeExponentMultipleOf() {
            ValidationResult result = assertTimeoutPreemptively(
                    Duration.ofSeconds(2), () -> check("{\"multipleOf\": 0.3}", "1e999999999"));

            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.kind()).isEqualTo(FailureKind.NOT_MULTIPLE_OF);
                assertThat(f.message()).endsWith("is not a multiple of 0.3");
            });
            assertThat(assertTimeoutPreemptively(
                            Duration.ofSeconds(2), () -> check("{\"multipleOf\": 0.3}", "1e3000000"))
                    .valid())
                    .isFalse();
            assertThat(check("{\"multipleOf\": 2}", "1e3000000").valid()).isTrue();
        }

        @Test
        void nonPositiveMultipleOfIsInvalidKeyword() {
            assertThat(kinds(check("{\"multipleOf\": 0}", "4"))).containsExactly(FailureKind.INVALID_KEYWORD);
        }
    }

    @Nested
    @DisplayName("length")
    class Length {

        @Test
        @DisplayName("string length counts code points")
        void codePoints() {
            // two emoji: four UTF-16 units, two code points
            assertThat(check("{\"maxLength\": 2}", "\"\\uD83D\\uDE00\\uD83D\\uDE01\"").valid()).isTrue();
            assertThat(kinds(check("{\"minLength\": 3}", "\"\\uD83D\\uDE00\\uD83D\\uDE01\"")))
                    .containsExactly(FailureKind.TOO_SHORT);
        }

        @Test
        void propertyCounts() {
            assertThat(kinds(check("{\"minProperties\": 2}", "{\"a\": 1}")))
                    .containsExactly(FailureKind.TOO_FEW_PROPERTIES);
            assertThat(kinds(check("{\"maxProperties\": 1}", "{\"a\": 1, \"b\": 2}")))
                    .containsExactly(FailureKind.TOO_MANY_PROPERTIES);
        }

        @Test
        void negativeBoundIsInvalidKeyword() {
            assertThat(kinds(check("{\"minLength\": -1}", "\"x\""))).containsExactly(FailureKind.INVALID_KEYWORD);
        }
    }

    @Nested
    @DisplayName("pattern")
    class PatternKeyword {

        @Test
        @DisplayName("patterns are unanchored")
        void unanchored() {
            assertThat(check("{\"pattern\": \"b+\"}", "\"abbbc\"").valid()).isTrue();
            assertThat(kinds(check("{\"pattern\": \"^b+$\"}", "\"abbbc\"")))
                    .containsExactly(FailureKind.PATTERN_MISMATCH);
        }

        @Test
        @DisplayName("malformed regex → INVALID_KEYWORD, siblings still evaluated")
        void malformedRegex() {
            ValidationResult result = check("{\"pattern\": \"(unclosed\", \"maxLength\": 1}", "\"abc\"");

            assertThat(kinds(result)).containsExactly(FailureKind.INVALID_KEYWORD, FailureKind.TOO_LONG);
            assertThat(result.failures().get(0).category()).isEqualTo(FailureKind.Category.STRUCTURAL);
        }
    }
}
