package com.guitar.registry.core.payload;

/**
 * A typed submission: up to three sections, each optional.
 */
public record Submission(
        ManufacturerPayload manufacturer,
        ModelPayload model,
        IndividualGuitarPayload individualGuitar
) {
    public boolean isEmpty() {
        return manufacturer == null && model == null && individualGuitar == null;
    }
}
