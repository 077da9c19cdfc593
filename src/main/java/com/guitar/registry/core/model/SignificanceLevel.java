package com.guitar.registry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Collector significance of an individual guitar.
 */
public enum SignificanceLevel {
    HISTORIC("historic"),
    NOTABLE("notable"),
    RARE("rare"),
    CUSTOM("custom");

    private final String value;

    SignificanceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SignificanceLevel fromValue(String value) {
        for (SignificanceLevel candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SignificanceLevel value: " + value);
    }

    /**
     * Returns every accepted wire value.
     */
    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(SignificanceLevel::value).toList();
    }
}
