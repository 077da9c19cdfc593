package com.guitar.registry.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A specification row. Belongs to exactly one of a model or an individual guitar.
 */
public record Specification(
        UUID id,
        UUID modelId,
        UUID individualGuitarId,
        SpecificationDetails details,
        String createdBy,
        Instant createdAt
) {
    public Specification {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(details, "details is required");
        if ((modelId == null) == (individualGuitarId == null)) {
            throw new IllegalArgumentException(
                    "specification must reference exactly one of modelId or individualGuitarId");
        }
    }

    public static Specification forModel(UUID id, UUID modelId, SpecificationDetails details,
                                         String createdBy, Instant createdAt) {
        return new Specification(id, modelId, null, details, createdBy, createdAt);
    }

    public static Specification forGuitar(UUID id, UUID individualGuitarId, SpecificationDetails details,
                                          String createdBy, Instant createdAt) {
        return new Specification(id, null, individualGuitarId, details, createdBy, createdAt);
    }
}
