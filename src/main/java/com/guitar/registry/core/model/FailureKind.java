package com.guitar.registry.core.model;

/**
 * Category of a failed submission.
 */
public enum FailureKind {
    SCHEMA_VIOLATION,
    MISSING_DEPENDENCY,
    MANUAL_REVIEW_REQUIRED,
    PROCESSING_ERROR
}
