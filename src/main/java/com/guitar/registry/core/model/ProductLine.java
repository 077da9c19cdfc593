package com.guitar.registry.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A named product line scoped to one manufacturer ("Les Paul", "Stratocaster").
 * Created lazily the first time a model references it.
 */
public record ProductLine(
        UUID id,
        UUID manufacturerId,
        String name,
        String createdBy,
        Instant createdAt
) {
    public ProductLine {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(manufacturerId, "manufacturerId is required");
        Objects.requireNonNull(name, "name is required");
    }
}
