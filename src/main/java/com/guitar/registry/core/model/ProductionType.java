package com.guitar.registry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * How a model was produced.
 */
public enum ProductionType {
    MASS("mass"),
    LIMITED("limited"),
    CUSTOM("custom"),
    PROTOTYPE("prototype"),
    ONE_OFF("one-off");

    private final String value;

    ProductionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ProductionType fromValue(String value) {
        for (ProductionType candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ProductionType value: " + value);
    }

    /**
     * Returns every accepted wire value.
     */
    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(ProductionType::value).toList();
    }
}
