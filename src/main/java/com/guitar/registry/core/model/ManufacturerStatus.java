package com.guitar.registry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Operating status of a manufacturer. Defunct manufacturers are never offered as match candidates.
 */
public enum ManufacturerStatus {
    ACTIVE("active"),
    DEFUNCT("defunct"),
    ACQUIRED("acquired");

    private final String value;

    ManufacturerStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ManufacturerStatus fromValue(String value) {
        for (ManufacturerStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ManufacturerStatus value: " + value);
    }

    /**
     * Returns every accepted wire value.
     */
    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(ManufacturerStatus::value).toList();
    }
}
