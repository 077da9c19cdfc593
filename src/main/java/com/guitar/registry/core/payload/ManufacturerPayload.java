package com.guitar.registry.core.payload;

import com.guitar.registry.core.model.ManufacturerStatus;

/**
 * The {@code manufacturer} section of a submission, after schema validation.
 */
public record ManufacturerPayload(
        String name,
        String displayName,
        String country,
        Integer foundedYear,
        String website,
        ManufacturerStatus status,
        String notes
) {
}
