package com.guitar.registry.validation;

import com.guitar.registry.core.model.ConditionRating;
import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.model.ProductionType;
import com.guitar.registry.core.model.SignificanceLevel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Schemas for the three submission sections.
 */
public final class CatalogSchemas {

    public static final PayloadSchema SPECIFICATION = PayloadSchema.builder("specification")
            .field(FieldRule.string("body_wood").maxLength(50))
            .field(FieldRule.string("neck_wood").maxLength(50))
            .field(FieldRule.string("fingerboard_wood").maxLength(50))
            .field(FieldRule.number("scale_length_inches").range(20, 30))
            .field(FieldRule.integer("num_frets").range(12, 36))
            .field(FieldRule.number("nut_width_inches").range(1.0, 2.5))
            .field(FieldRule.string("neck_profile").maxLength(50))
            .field(FieldRule.string("bridge_type").maxLength(50))
            .field(FieldRule.string("pickup_configuration").maxLength(150))
            .field(FieldRule.string("electronics_description"))
            .field(FieldRule.string("hardware_finish").maxLength(50))
            .field(FieldRule.string("body_finish"))
            .field(FieldRule.number("weight_lbs").range(1, 20))
            .field(FieldRule.bool("case_included"))
            .field(FieldRule.string("case_type").maxLength(50))
            .build();

    public static final PayloadSchema MANUFACTURER = PayloadSchema.builder("manufacturer")
            .field(FieldRule.string("name").required().length(1, 100))
            .field(FieldRule.string("display_name").maxLength(50))
            .field(FieldRule.string("country").maxLength(50))
            .field(FieldRule.integer("founded_year").range(1800, 2030))
            .field(FieldRule.uri("website"))
            .field(FieldRule.string("status").oneOf(ManufacturerStatus.allowedValues()))
            .field(FieldRule.string("notes"))
            .field(FieldRule.string("logo_source"))
            .build();

    public static final PayloadSchema MODEL = PayloadSchema.builder("model")
            .field(FieldRule.string("manufacturer_name").required().length(1, 100))
            .field(FieldRule.string("product_line_name").length(1, 100))
            .field(FieldRule.string("name").required().length(1, 150))
            .field(FieldRule.integer("year").required().range(1900, 2030))
            .field(FieldRule.string("production_type").oneOf(ProductionType.allowedValues()))
            .field(FieldRule.date("production_start_date"))
            .field(FieldRule.date("production_end_date"))
            .field(FieldRule.integer("estimated_production_quantity").minimum(1))
            .field(FieldRule.number("msrp_original").minimum(0))
            .field(FieldRule.string("currency").maxLength(3))
            .field(FieldRule.string("description"))
            .field(FieldRule.objectList("specifications", SPECIFICATION))
            .build();

    public static final PayloadSchema MODEL_REFERENCE = PayloadSchema.builder("model_reference")
            .field(FieldRule.string("manufacturer_name").required().length(1, 100))
            .field(FieldRule.string("model_name").required().length(1, 150))
            .field(FieldRule.integer("year").required().range(1900, 2030))
            .build();

    public static final PayloadSchema INDIVIDUAL_GUITAR = PayloadSchema.builder("individual_guitar")
            .field(FieldRule.object("model_reference", MODEL_REFERENCE))
            .field(FieldRule.string("manufacturer_name_fallback").maxLength(100))
            .field(FieldRule.string("model_name_fallback").maxLength(150))
            .field(FieldRule.string("year_estimate").maxLength(50))
            .field(FieldRule.string("description"))
            .field(FieldRule.string("nickname").maxLength(50))
            .field(FieldRule.string("serial_number").maxLength(50))
            .field(FieldRule.date("production_date"))
            .field(FieldRule.integer("production_number"))
            .field(FieldRule.string("significance_level").oneOf(SignificanceLevel.allowedValues()))
            .field(FieldRule.string("significance_notes"))
            .field(FieldRule.number("current_estimated_value").minimum(0))
            .field(FieldRule.date("last_valuation_date"))
            .field(FieldRule.string("condition_rating").oneOf(ConditionRating.allowedValues()))
            .field(FieldRule.string("modifications"))
            .field(FieldRule.string("provenance_notes"))
            .field(FieldRule.objectList("specifications", SPECIFICATION))
            .field(FieldRule.array("photos"))
            .requireAnyOf("requires model_reference, or manufacturer_name_fallback with "
                            + "model_name_fallback or description",
                    List.of("model_reference"),
                    List.of("manufacturer_name_fallback", "model_name_fallback"),
                    List.of("manufacturer_name_fallback", "description"))
            .build();

    private CatalogSchemas() {
    }

    /**
     * Returns the section schema for every entity kind.
     */
    public static Map<EntityKind, PayloadSchema> sections() {
        Map<EntityKind, PayloadSchema> sections = new EnumMap<>(EntityKind.class);
        sections.put(EntityKind.MANUFACTURER, MANUFACTURER);
        sections.put(EntityKind.MODEL, MODEL);
        sections.put(EntityKind.INDIVIDUAL_GUITAR, INDIVIDUAL_GUITAR);
        return sections;
    }
}
