package io.apicheck.core.engine;

import static io.apicheck.core.testkit.TestDocuments.instance;
import static io.apicheck.core.testkit.TestDocuments.schema;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.format.BuiltinFormat;
import io.apicheck.core.engine.keyword.FormatEvaluator;
import io.apicheck.core.model.FailureKind;
import io.apicheck.core.model.Location;
import io.apicheck.core.model.ValidationResult;
import io.apicheck.core.schema.SchemaDocument;
import io.apicheck.core.spi.FormatPredicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("FormatRegistry and the format keyword")
class FormatRegistryTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger formatLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        formatLogger = (Logger) LoggerFactory.getLogger(FormatEvaluator.class);
        previousLevel = formatLogger.getLevel();
        formatLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        formatLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        formatLogger.detachAppender(logAppender);
        logAppender.stop();
        formatLogger.setLevel(previousLevel);
    }

    @Test
    @DisplayName("defaults hold every built-in format")
    void defaults() {
        FormatRegistry registry = FormatRegistry.defaults();

        assertThat(registry.size()).isEqualTo(BuiltinFormat.values().length);
        assertThat(registry.lookup("date-time")).contains(BuiltinFormat.DATE_TIME);
        assertThat(registry.lookup("phone")).isEmpty();
    }

    @Test
    @DisplayName("a registered predicate is used by the format keyword")
    void customPredicate() {
        FormatPredicate sku = mock(FormatPredicate.class);
        when(sku.id()).thenReturn("sku");
        when(sku.test(any(JsonNode.class))).thenAnswer(inv -> inv.<JsonNode>getArgument(0)
                .asText()
                .startsWith("SKU-"));
        FormatRegistry formats = FormatRegistry.defaults();
        formats.register(sku);
        SchemaValidator validator =
                new SchemaValidator(ValidatorOptions.DEFAULT, EvaluatorRegistry.defaults(), formats);
        SchemaDocument doc = schema("{\"properties\": {\"code\": {\"format\": \"sku\"}}}");

        assertThat(validator.validate(doc, instance("{\"code\": \"SKU-1\"}")).valid()).isTrue();
        ValidationResult result = validator.validate(doc, instance("{\"code\": \"X-1\"}"));

        assertThat(result.failures()).singleElement().satisfies(f -> {
            assertThat(f.kind()).isEqualTo(FailureKind.FORMAT_MISMATCH);
            assertThat(f.schemaPath()).isEqualTo(Location.of("properties", "code", "format"));
            assertThat(f.details()).containsEntry("format", "sku");
        });
    }

    @Test
    @DisplayName("an unknown format passes and is logged at DEBUG")
    void unknownFormat() {
        SchemaDocument doc = schema("{\"format\": \"phone\"}");

        assertThat(new SchemaValidator().validate(doc, instance("\"anything\"")).valid())
                .isTrue();
        assertThat(logAppender.list)
                .anySatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.DEBUG);
                    assertThat(e.getFormattedMessage()).contains("phone");
                });
    }

    @Test
    @DisplayName("built-in format failure is reported at the format keyword")
    void builtinFailure() {
        SchemaDocument doc = schema("{\"format\": \"email\"}");

        assertThat(new SchemaValidator().validate(doc, instance("\"nobody\"")).failures())
                .singleElement()
                .satisfies(f -> assertThat(f.kind()).isEqualTo(FailureKind.FORMAT_MISMATCH));
    }

    @Test
    @DisplayName("register rejects null and nameless predicates")
    void registerRejectsBadInput() {
        FormatRegistry registry = new FormatRegistry();
        FormatPredicate nameless = mock(FormatPredicate.class);
        when(nameless.id()).thenReturn("");

        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(nameless)).isInstanceOf(IllegalArgumentException.class);
    }
}
