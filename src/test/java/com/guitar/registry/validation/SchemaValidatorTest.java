package com.guitar.registry.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaValidator Tests")
class SchemaValidatorTest {

    private SchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
    }

    private List<String> violationsOf(Object submission) {
        SchemaViolationException e = assertThrows(SchemaViolationException.class,
                () -> validator.validateSubmission(submission));
        return e.getViolations().stream().map(SchemaViolation::toString).toList();
    }

    @Nested
    @DisplayName("Submission shape")
    class ShapeTests {

        @Test
        @DisplayName("Should reject a submission that is not an object")
        void testNotAnObject() {
            assertEquals(List.of("$: submission must be an object"), violationsOf(List.of("Gibson")));
            assertEquals(List.of("$: submission must be an object"), violationsOf(null));
        }

        @Test
        @DisplayName("Should reject a submission without any section")
        void testNoSection() {
            List<String> violations = violationsOf(Map.of("source", "dealer-feed"));

            assertEquals(1, violations.size());
            assertTrue(violations.get(0).contains("at least one of manufacturer, model, individual_guitar"));
        }

        @Test
        @DisplayName("Should ignore top-level keys that are not sections")
        void testExtraTopLevelKey() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of(
                    "source", "dealer-feed",
                    "manufacturer", Map.of("name", "Gibson"))));
        }

        @Test
        @DisplayName("Should treat a null section as absent")
        void testNullSection() {
            Map<String, Object> submission = new LinkedHashMap<>();
            submission.put("manufacturer", Map.of("name", "Gibson"));
            submission.put("model", null);

            assertDoesNotThrow(() -> validator.validateSubmission(submission));
        }
    }

    @Nested
    @DisplayName("Manufacturer section")
    class ManufacturerTests {

        @Test
        @DisplayName("Should accept a complete manufacturer")
        void testValid() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("manufacturer", Map.of(
                    "name", "Gibson Guitar Corporation",
                    "display_name", "Gibson",
                    "country", "USA",
                    "founded_year", 1902,
                    "website", "https://www.gibson.com",
                    "status", "active"))));
        }

        @Test
        @DisplayName("Should require name")
        void testMissingName() {
            assertEquals(List.of("manufacturer.name: is required"),
                    violationsOf(Map.of("manufacturer", Map.of("country", "USA"))));
        }

        @Test
        @DisplayName("Should collect every violation before failing")
        void testCollectsAll() {
            List<String> violations = violationsOf(Map.of("manufacturer", Map.of(
                    "name", "",
                    "founded_year", 1700,
                    "website", "www.gibson.com",
                    "status", "bankrupt")));

            assertEquals(4, violations.size());
            assertTrue(violations.contains("manufacturer.name: must be at least 1 characters"));
            assertTrue(violations.contains("manufacturer.founded_year: must be >= 1800"));
            assertTrue(violations.contains("manufacturer.website: must be an absolute URI"));
            assertTrue(violations.stream().anyMatch(v -> v.startsWith("manufacturer.status: must be one of")));
        }

        @Test
        @DisplayName("Should reject unknown fields inside a section")
        void testUnknownField() {
            assertEquals(List.of("manufacturer.ceo: is not an allowed field"),
                    violationsOf(Map.of("manufacturer", Map.of("name", "Gibson", "ceo", "someone"))));
        }

        @Test
        @DisplayName("Should accept a whole-valued double as an integer")
        void testIntegralDouble() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("manufacturer", Map.of(
                    "name", "Gibson", "founded_year", 1902.0))));
        }

        @Test
        @DisplayName("Should reject a numeric string for an integer field")
        void testNumericString() {
            assertEquals(List.of("manufacturer.founded_year: must be an integer"),
                    violationsOf(Map.of("manufacturer", Map.of("name", "Gibson", "founded_year", "1902"))));
        }

        @Test
        @DisplayName("Should tolerate explicit nulls for optional fields")
        void testExplicitNull() {
            Map<String, Object> manufacturer = new LinkedHashMap<>();
            manufacturer.put("name", "Fender");
            manufacturer.put("website", null);

            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("manufacturer", manufacturer)));
        }
    }

    @Nested
    @DisplayName("Model section")
    class ModelTests {

        @Test
        @DisplayName("Should require manufacturer_name, name and year")
        void testRequired() {
            List<String> violations = violationsOf(Map.of("model", Map.of("description", "A model")));

            assertEquals(3, violations.size());
            assertTrue(violations.contains("model.manufacturer_name: is required"));
            assertTrue(violations.contains("model.name: is required"));
            assertTrue(violations.contains("model.year: is required"));
        }

        @Test
        @DisplayName("Should validate nested specifications with indexed paths")
        void testSpecificationPaths() {
            List<String> violations = violationsOf(Map.of("model", Map.of(
                    "manufacturer_name", "Gibson",
                    "name", "Les Paul Standard",
                    "year", 1959,
                    "specifications", List.of(
                            Map.of("num_frets", 22),
                            Map.of("num_frets", 40, "weight_lbs", 0.5)))));

            assertEquals(2, violations.size());
            assertTrue(violations.contains("model.specifications[1].num_frets: must be <= 36"));
            assertTrue(violations.contains("model.specifications[1].weight_lbs: must be >= 1"));
        }

        @Test
        @DisplayName("Should accept a single specification object")
        void testSingleSpecification() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("model", Map.of(
                    "manufacturer_name", "Gibson",
                    "name", "Les Paul Standard",
                    "year", 1959,
                    "specifications", Map.of("body_wood", "Mahogany")))));
        }

        @Test
        @DisplayName("Should reject an empty specifications array")
        void testEmptySpecifications() {
            assertEquals(List.of("model.specifications: must not be an empty array"),
                    violationsOf(Map.of("model", Map.of(
                            "manufacturer_name", "Gibson",
                            "name", "Les Paul Standard",
                            "year", 1959,
                            "specifications", List.of()))));
        }

        @Test
        @DisplayName("Should reject malformed dates")
        void testDate() {
            assertEquals(List.of("model.production_start_date: must be a date (yyyy-MM-dd)"),
                    violationsOf(Map.of("model", Map.of(
                            "manufacturer_name", "Gibson",
                            "name", "Les Paul Standard",
                            "year", 1959,
                            "production_start_date", "1959-13-01"))));
        }
    }

    @Nested
    @DisplayName("Individual guitar section")
    class IndividualGuitarTests {

        @Test
        @DisplayName("Should accept a guitar with a model reference")
        void testModelReference() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("individual_guitar", Map.of(
                    "model_reference", Map.of("manufacturer_name", "Gibson",
                            "model_name", "Les Paul Standard", "year", 1959),
                    "serial_number", "9-0824"))));
        }

        @Test
        @DisplayName("Should accept fallback manufacturer with description")
        void testFallbackWithDescription() {
            assertDoesNotThrow(() -> validator.validateSubmission(Map.of("individual_guitar", Map.of(
                    "manufacturer_name_fallback", "Unknown Luthier",
                    "description", "Hand-built archtop"))));
        }

        @Test
        @DisplayName("Should require a model reference or fallback text")
        void testMissingIdentity() {
            List<String> violations = violationsOf(Map.of("individual_guitar", Map.of(
                    "manufacturer_name_fallback", "Unknown Luthier")));

            assertEquals(1, violations.size());
            assertTrue(violations.get(0).startsWith("individual_guitar: requires model_reference"));
        }

        @Test
        @DisplayName("Should validate the nested model reference")
        void testNestedReference() {
            assertEquals(List.of("individual_guitar.model_reference.year: is required"),
                    violationsOf(Map.of("individual_guitar", Map.of(
                            "model_reference", Map.of("manufacturer_name", "Gibson",
                                    "model_name", "Les Paul Standard")))));
        }

        @Test
        @DisplayName("Should reject an unknown condition rating")
        void testConditionRating() {
            List<String> violations = violationsOf(Map.of("individual_guitar", Map.of(
                    "manufacturer_name_fallback", "Gibson",
                    "model_name_fallback", "Les Paul",
                    "condition_rating", "battered")));

            assertEquals(1, violations.size());
            assertTrue(violations.get(0).startsWith("individual_guitar.condition_rating: must be one of"));
        }
    }
}
