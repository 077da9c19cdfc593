package com.guitar.registry.validation;

/**
 * Value types a {@link FieldRule} can require.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    /** ISO-8601 calendar date, {@code yyyy-MM-dd}. */
    DATE,
    /** Absolute URI. */
    URI,
    OBJECT,
    /** A single object, or a non-empty array of objects. */
    OBJECT_LIST,
    ARRAY
}
