package com.guitar.registry.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A product model row. Identity within a manufacturer is the pair (name, year).
 */
public record GuitarModel(
        UUID id,
        UUID manufacturerId,
        UUID productLineId,
        String name,
        int year,
        ProductionType productionType,
        LocalDate productionStartDate,
        LocalDate productionEndDate,
        Integer estimatedProductionQuantity,
        BigDecimal msrpOriginal,
        String currency,
        String description,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public GuitarModel {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(manufacturerId, "manufacturerId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(productionType, "productionType is required");
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .manufacturerId(manufacturerId)
                .productLineId(productLineId)
                .name(name)
                .year(year)
                .productionType(productionType)
                .productionStartDate(productionStartDate)
                .productionEndDate(productionEndDate)
                .estimatedProductionQuantity(estimatedProductionQuantity)
                .msrpOriginal(msrpOriginal)
                .currency(currency)
                .description(description)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id;
        private UUID manufacturerId;
        private UUID productLineId;
        private String name;
        private int year;
        private ProductionType productionType = ProductionType.MASS;
        private LocalDate productionStartDate;
        private LocalDate productionEndDate;
        private Integer estimatedProductionQuantity;
        private BigDecimal msrpOriginal;
        private String currency;
        private String description;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder manufacturerId(UUID manufacturerId) {
            this.manufacturerId = manufacturerId;
            return this;
        }

        public Builder productLineId(UUID productLineId) {
            this.productLineId = productLineId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder year(int year) {
            this.year = year;
            return this;
        }

        public Builder productionType(ProductionType productionType) {
            this.productionType = productionType;
            return this;
        }

        public Builder productionStartDate(LocalDate productionStartDate) {
            this.productionStartDate = productionStartDate;
            return this;
        }

        public Builder productionEndDate(LocalDate productionEndDate) {
            this.productionEndDate = productionEndDate;
            return this;
        }

        public Builder estimatedProductionQuantity(Integer estimatedProductionQuantity) {
            this.estimatedProductionQuantity = estimatedProductionQuantity;
            return this;
        }

        public Builder msrpOriginal(BigDecimal msrpOriginal) {
            this.msrpOriginal = msrpOriginal;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public GuitarModel build() {
            return new GuitarModel(id, manufacturerId, productLineId, name, year, productionType,
                    productionStartDate, productionEndDate, estimatedProductionQuantity,
                    msrpOriginal, currency, description, createdBy, createdAt, updatedAt);
        }
    }
}
