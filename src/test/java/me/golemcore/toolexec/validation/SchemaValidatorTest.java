package me.golemcore.toolexec.validation;

import me.golemcore.toolexec.domain.model.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static final Map<String, Object> SEARCH_SCHEMA = Map.of(
            "type", "object",
            "required", List.of("query"),
            "additionalProperties", false,
            "properties", Map.of(
                    "query", Map.of("type", "string", "minLength", 1, "maxLength", 20),
                    "limit", Map.of("type", "integer", "minimum", 1, "maximum", 100),
                    "mode", Map.of("type", "string", "enum", List.of("fast", "exact")),
                    "tags", Map.of("type", "array", "maxItems", 2, "items", Map.of("type", "string")),
                    "since", Map.of("type", "string", "format", "date-time"),
                    "code", Map.of("type", "string", "pattern", "^[A-Z]{3}$")));

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void shouldAcceptValidValue() {
        Map<String, Object> value = Map.of(
                "query", "weather",
                "limit", 10,
                "mode", "fast",
                "tags", List.of("a"),
                "since", "2026-03-01T10:00:00Z",
                "code", "ABC");

        assertTrue(validator.validate(value, SEARCH_SCHEMA).isEmpty());
    }

    @Test
    void shouldReportMissingRequiredProperty() {
        List<ValidationError> errors = validator.validate(Map.of("limit", 5), SEARCH_SCHEMA);

        assertEquals(List.of(new ValidationError("$.query", "is required")), errors);
    }

    @Test
    void shouldReportEveryViolationWithPath() {
        Map<String, Object> value = Map.of(
                "query", "",
                "limit", 500,
                "mode", "slow",
                "tags", List.of("a", 2, "c"),
                "since", "yesterday",
                "code", "abc",
                "extra", true);

        List<String> paths = validator.validate(value, SEARCH_SCHEMA).stream().map(ValidationError::path).toList();

        assertTrue(paths.contains("$.query"));
        assertTrue(paths.contains("$.limit"));
        assertTrue(paths.contains("$.mode"));
        assertTrue(paths.contains("$.tags"));
        assertTrue(paths.contains("$.tags[1]"));
        assertTrue(paths.contains("$.since"));
        assertTrue(paths.contains("$.code"));
        assertTrue(paths.contains("$.extra"));
    }

    @Test
    void shouldRejectWrongRootType() {
        List<ValidationError> errors = validator.validate(List.of(), SEARCH_SCHEMA);

        assertEquals(1, errors.size());
        assertEquals("expected object but got array", errors.get(0).message());
    }

    @Test
    void shouldTreatWholeDoublesAsIntegers() {
        Map<String, Object> schema = Map.of("type", "integer");

        assertTrue(validator.validate(3.0, schema).isEmpty());
        assertFalse(validator.validate(3.5, schema).isEmpty());
    }

    @Test
    void shouldAcceptUnionTypes() {
        Map<String, Object> schema = Map.of("type", List.of("string", "null"));

        assertTrue(validator.validate(null, schema).isEmpty());
        assertTrue(validator.validate("x", schema).isEmpty());
        assertFalse(validator.validate(1, schema).isEmpty());
    }

    @Test
    void shouldAcceptAnythingForEmptySchema() {
        assertTrue(validator.validate(Map.of("any", "thing"), Map.of()).isEmpty());
        assertTrue(validator.validate("x", null).isEmpty());
    }

    @Test
    void shouldReportInvalidSchemaPattern() {
        List<ValidationError> errors = validator.validate("x", Map.of("type", "string", "pattern", "(unclosed"));

        assertEquals("schema pattern is not a valid regular expression", errors.get(0).message());
    }
}
