package com.guitar.registry.validation;

import com.guitar.registry.core.IngestionException;
import com.guitar.registry.core.model.FailureKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a submission does not conform to its schema. Carries every violation found,
 * not just the first.
 */
public class SchemaViolationException extends IngestionException {

    private final List<SchemaViolation> violations;

    public SchemaViolationException(List<SchemaViolation> violations) {
        super("Schema validation failed: " + violations.stream()
                .map(SchemaViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SCHEMA_VIOLATION;
    }
}
