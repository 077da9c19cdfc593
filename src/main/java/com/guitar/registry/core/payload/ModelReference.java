package com.guitar.registry.core.payload;

/**
 * Names the catalog model an individual guitar belongs to.
 */
public record ModelReference(String manufacturerName, String modelName, Integer year) {
}
