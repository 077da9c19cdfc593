package com.guitar.registry.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A guitar manufacturer row. {@code name} is the business key, compared case-insensitively.
 */
public record Manufacturer(
        UUID id,
        String name,
        String displayName,
        String country,
        Integer foundedYear,
        String website,
        ManufacturerStatus status,
        String notes,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public Manufacturer {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(status, "status is required");
    }

    public boolean isDefunct() {
        return status == ManufacturerStatus.DEFUNCT;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .displayName(displayName)
                .country(country)
                .foundedYear(foundedYear)
                .website(website)
                .status(status)
                .notes(notes)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id;
        private String name;
        private String displayName;
        private String country;
        private Integer foundedYear;
        private String website;
        private ManufacturerStatus status = ManufacturerStatus.ACTIVE;
        private String notes;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder foundedYear(Integer foundedYear) {
            this.foundedYear = foundedYear;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder status(ManufacturerStatus status) {
            this.status = status;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Manufacturer build() {
            return new Manufacturer(id, name, displayName, country, foundedYear, website,
                    status, notes, createdBy, createdAt, updatedAt);
        }
    }
}
