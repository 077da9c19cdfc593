package com.guitar.registry.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * One physical instrument. Linked to a catalog model through {@code modelId}, or described by
 * the fallback text fields when the model is not in the catalog.
 */
public record IndividualGuitar(
        UUID id,
        UUID modelId,
        String manufacturerNameFallback,
        String modelNameFallback,
        String yearEstimate,
        String description,
        String nickname,
        String serialNumber,
        LocalDate productionDate,
        Integer productionNumber,
        SignificanceLevel significanceLevel,
        String significanceNotes,
        BigDecimal currentEstimatedValue,
        LocalDate lastValuationDate,
        ConditionRating conditionRating,
        String modifications,
        String provenanceNotes,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public IndividualGuitar {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(significanceLevel, "significanceLevel is required");
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .modelId(modelId)
                .manufacturerNameFallback(manufacturerNameFallback)
                .modelNameFallback(modelNameFallback)
                .yearEstimate(yearEstimate)
                .description(description)
                .nickname(nickname)
                .serialNumber(serialNumber)
                .productionDate(productionDate)
                .productionNumber(productionNumber)
                .significanceLevel(significanceLevel)
                .significanceNotes(significanceNotes)
                .currentEstimatedValue(currentEstimatedValue)
                .lastValuationDate(lastValuationDate)
                .conditionRating(conditionRating)
                .modifications(modifications)
                .provenanceNotes(provenanceNotes)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id;
        private UUID modelId;
        private String manufacturerNameFallback;
        private String modelNameFallback;
        private String yearEstimate;
        private String description;
        private String nickname;
        private String serialNumber;
        private LocalDate productionDate;
        private Integer productionNumber;
        private SignificanceLevel significanceLevel = SignificanceLevel.NOTABLE;
        private String significanceNotes;
        private BigDecimal currentEstimatedValue;
        private LocalDate lastValuationDate;
        private ConditionRating conditionRating;
        private String modifications;
        private String provenanceNotes;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder modelId(UUID modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder manufacturerNameFallback(String manufacturerNameFallback) {
            this.manufacturerNameFallback = manufacturerNameFallback;
            return this;
        }

        public Builder modelNameFallback(String modelNameFallback) {
            this.modelNameFallback = modelNameFallback;
            return this;
        }

        public Builder yearEstimate(String yearEstimate) {
            this.yearEstimate = yearEstimate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder nickname(String nickname) {
            this.nickname = nickname;
            return this;
        }

        public Builder serialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public Builder productionDate(LocalDate productionDate) {
            this.productionDate = productionDate;
            return this;
        }

        public Builder productionNumber(Integer productionNumber) {
            this.productionNumber = productionNumber;
            return this;
        }

        public Builder significanceLevel(SignificanceLevel significanceLevel) {
            this.significanceLevel = significanceLevel;
            return this;
        }

        public Builder significanceNotes(String significanceNotes) {
            this.significanceNotes = significanceNotes;
            return this;
        }

        public Builder currentEstimatedValue(BigDecimal currentEstimatedValue) {
            this.currentEstimatedValue = currentEstimatedValue;
            return this;
        }

        public Builder lastValuationDate(LocalDate lastValuationDate) {
            this.lastValuationDate = lastValuationDate;
            return this;
        }

        public Builder conditionRating(ConditionRating conditionRating) {
            this.conditionRating = conditionRating;
            return this;
        }

        public Builder modifications(String modifications) {
            this.modifications = modifications;
            return this;
        }

        public Builder provenanceNotes(String provenanceNotes) {
            this.provenanceNotes = provenanceNotes;
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

        public IndividualGuitar build() {
            return new IndividualGuitar(id, modelId, manufacturerNameFallback, modelNameFallback,
                    yearEstimate, description, nickname, serialNumber, productionDate,
                    productionNumber, significanceLevel, significanceNotes, currentEstimatedValue,
                    lastValuationDate, conditionRating, modifications, provenanceNotes,
                    createdBy, createdAt, updatedAt);
        }
    }
}
