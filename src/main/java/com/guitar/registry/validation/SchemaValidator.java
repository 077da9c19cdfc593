package com.guitar.registry.validation;

import com.guitar.registry.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validates raw submissions against {@link PayloadSchema}s.
 *
 * <p>A submission is a map with up to three sections ({@code manufacturer}, {@code model},
 * {@code individual_guitar}). Every present section is validated and all violations are
 * collected before failing, so callers see the full list at once. Top-level keys that are
 * not sections are ignored. Optional fields may be {@code null}.</p>
 */
public class SchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final Map<EntityKind, PayloadSchema> sectionSchemas;

    public SchemaValidator() {
        this(CatalogSchemas.sections());
    }

    public SchemaValidator(Map<EntityKind, PayloadSchema> sectionSchemas) {
        this.sectionSchemas = new EnumMap<>(sectionSchemas);
    }

    /**
     * Validates a whole submission.
     *
     * @param submission the raw submission, normally a {@code Map} parsed from JSON
     * @throws SchemaViolationException if any section violates its schema
     */
    public void validateSubmission(Object submission) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (!(submission instanceof Map<?, ?> sections)) {
            violations.add(new SchemaViolation("$", "submission must be an object"));
            throw new SchemaViolationException(violations);
        }

        boolean anySection = false;
        for (EntityKind kind : EntityKind.values()) {
            Object section = sections.get(kind.sectionName());
            if (section == null) {
                continue;
            }
            anySection = true;
            PayloadSchema schema = sectionSchemas.get(kind);
            violations.addAll(validate(schema, section, kind.sectionName()));
        }
        if (!anySection) {
            violations.add(new SchemaViolation("$",
                    "submission must contain at least one of manufacturer, model, individual_guitar"));
        }

        if (!violations.isEmpty()) {
            log.debug("schema.rejected violations={}", violations.size());
            throw new SchemaViolationException(violations);
        }
    }

    /**
     * Validates one object against a schema and returns every violation found.
     */
    public List<SchemaViolation> validate(PayloadSchema schema, Object value, String path) {
        List<SchemaViolation> violations = new ArrayList<>();
        validateObject(schema, value, path, violations);
        return violations;
    }

    private void validateObject(PayloadSchema schema, Object value, String path,
                                List<SchemaViolation> violations) {
        if (!(value instanceof Map<?, ?> object)) {
            violations.add(new SchemaViolation(path, "must be an object"));
            return;
        }

        for (Object key : object.keySet()) {
            if (!(key instanceof String name) || schema.getField(name) == null) {
                violations.add(new SchemaViolation(path + "." + key, "is not an allowed field"));
            }
        }

        for (FieldRule rule : schema.getFields().values()) {
            String fieldPath = path + "." + rule.name();
            Object fieldValue = object.get(rule.name());
            if (fieldValue == null) {
                if (rule.required()) {
                    violations.add(new SchemaViolation(fieldPath, "is required"));
                }
                continue;
            }
            validateField(rule, fieldValue, fieldPath, violations);
        }

        for (PayloadSchema.FieldGroupRequirement requirement : schema.getGroupRequirements()) {
            if (!requirement.isSatisfiedBy(object)) {
                violations.add(new SchemaViolation(path, requirement.message()));
            }
        }
    }

    private void validateField(FieldRule rule, Object value, String path, List<SchemaViolation> violations) {
        switch (rule.type()) {
            case STRING -> validateString(rule, value, path, violations);
            case INTEGER -> {
                if (!isIntegral(value)) {
                    violations.add(new SchemaViolation(path, "must be an integer"));
                } else {
                    validateRange(rule, toBigDecimal((Number) value), path, violations);
                }
            }
            case NUMBER -> {
                BigDecimal number = isNumeric(value) ? toBigDecimal((Number) value) : null;
                if (number == null) {
                    violations.add(new SchemaViolation(path, "must be a number"));
                } else {
                    validateRange(rule, number, path, violations);
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    violations.add(new SchemaViolation(path, "must be a boolean"));
                }
            }
            case DATE -> {
                if (!isDate(value)) {
                    violations.add(new SchemaViolation(path, "must be a date (yyyy-MM-dd)"));
                }
            }
            case URI -> {
                if (!isAbsoluteUri(value)) {
                    violations.add(new SchemaViolation(path, "must be an absolute URI"));
                }
            }
            case OBJECT -> validateObject(rule.nestedSchema(), value, path, violations);
            case OBJECT_LIST -> {
                if (value instanceof List<?> items) {
                    if (items.isEmpty()) {
                        violations.add(new SchemaViolation(path, "must not be an empty array"));
                    }
                    for (int i = 0; i < items.size(); i++) {
                        validateObject(rule.nestedSchema(), items.get(i), path + "[" + i + "]", violations);
                    }
                } else {
                    validateObject(rule.nestedSchema(), value, path, violations);
                }
            }
            case ARRAY -> {
                if (!(value instanceof List<?>)) {
                    violations.add(new SchemaViolation(path, "must be an array"));
                }
            }
        }
    }

    private void validateString(FieldRule rule, Object value, String path, List<SchemaViolation> violations) {
        if (!(value instanceof String text)) {
            violations.add(new SchemaViolation(path, "must be a string"));
            return;
        }
        int length = text.codePointCount(0, text.length());
        if (rule.minLength() != null && length < rule.minLength()) {
            violations.add(new SchemaViolation(path, "must be at least " + rule.minLength() + " characters"));
        }
        if (rule.maxLength() != null && length > rule.maxLength()) {
            violations.add(new SchemaViolation(path, "must be at most " + rule.maxLength() + " characters"));
        }
        if (!rule.allowedValues().isEmpty() && !rule.allowedValues().contains(text)) {
            violations.add(new SchemaViolation(path, "must be one of " + rule.allowedValues()));
        }
    }

    private void validateRange(FieldRule rule, BigDecimal value, String path, List<SchemaViolation> violations) {
        if (rule.minimum() != null && value.compareTo(rule.minimum()) < 0) {
            violations.add(new SchemaViolation(path, "must be >= " + rule.minimum().stripTrailingZeros().toPlainString()));
        }
        if (rule.maximum() != null && value.compareTo(rule.maximum()) > 0) {
            violations.add(new SchemaViolation(path, "must be <= " + rule.maximum().stripTrailingZeros().toPlainString()));
        }
    }

    private static boolean isNumeric(Object value) {
        if (!(value instanceof Number number)) {
            return false;
        }
        if (number instanceof Double d) {
            return Double.isFinite(d);
        }
        if (number instanceof Float f) {
            return Float.isFinite(f);
        }
        return true;
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (!isNumeric(value)) {
            return false;
        }
        BigDecimal decimal = toBigDecimal((Number) value);
        return decimal.stripTrailingZeros().scale() <= 0;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static boolean isDate(Object value) {
        if (value instanceof LocalDate) {
            return true;
        }
        if (!(value instanceof String text)) {
            return false;
        }
        try {
            LocalDate.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isAbsoluteUri(Object value) {
        if (!(value instanceof String text)) {
            return false;
        }
        try {
            return new URI(text).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
