package com.guitar.registry.core.model;

import java.math.BigDecimal;

/**
 * Physical and electronic attributes of a model or of one individual guitar.
 * Every attribute is optional.
 */
public record SpecificationDetails(
        String bodyWood,
        String neckWood,
        String fingerboardWood,
        BigDecimal scaleLengthInches,
        Integer numFrets,
        BigDecimal nutWidthInches,
        String neckProfile,
        String bridgeType,
        String pickupConfiguration,
        String electronicsDescription,
        String hardwareFinish,
        String bodyFinish,
        BigDecimal weightLbs,
        Boolean caseIncluded,
        String caseType
) {
}
