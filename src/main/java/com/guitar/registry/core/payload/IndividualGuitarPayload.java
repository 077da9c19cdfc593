package com.guitar.registry.core.payload;

import com.guitar.registry.core.model.ConditionRating;
import com.guitar.registry.core.model.SignificanceLevel;
import com.guitar.registry.core.model.SpecificationDetails;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The {@code individual_guitar} section of a submission.
 */
public record IndividualGuitarPayload(
        ModelReference modelReference,
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
        List<SpecificationDetails> specifications
) {
    public IndividualGuitarPayload {
        specifications = specifications != null ? List.copyOf(specifications) : List.of();
    }

    public boolean hasFallbackManufacturer() {
        return manufacturerNameFallback != null && !manufacturerNameFallback.isBlank();
    }
}
