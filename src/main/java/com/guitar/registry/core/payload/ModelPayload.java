package com.guitar.registry.core.payload;

import com.guitar.registry.core.model.ProductionType;
import com.guitar.registry.core.model.SpecificationDetails;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The {@code model} section of a submission. The owning manufacturer is referenced by name.
 */
public record ModelPayload(
        String manufacturerName,
        String productLineName,
        String name,
        Integer year,
        ProductionType productionType,
        LocalDate productionStartDate,
        LocalDate productionEndDate,
        Integer estimatedProductionQuantity,
        BigDecimal msrpOriginal,
        String currency,
        String description,
        List<SpecificationDetails> specifications
) {
    public ModelPayload {
        specifications = specifications != null ? List.copyOf(specifications) : List.of();
    }
}
