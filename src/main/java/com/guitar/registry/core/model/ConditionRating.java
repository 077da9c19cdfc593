package com.guitar.registry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Physical condition grade of an individual guitar.
 */
public enum ConditionRating {
    MINT("mint"),
    EXCELLENT("excellent"),
    VERY_GOOD("very_good"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    RELIC("relic");

    private final String value;

    ConditionRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConditionRating fromValue(String value) {
        for (ConditionRating candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConditionRating value: " + value);
    }

    /**
     * Returns every accepted wire value.
     */
    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(ConditionRating::value).toList();
    }
}
