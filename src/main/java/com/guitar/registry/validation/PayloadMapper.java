package com.guitar.registry.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guitar.registry.core.CatalogJson;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.core.payload.Submission;

import java.util.List;
import java.util.Map;

/**
 * Binds a validated raw submission to the typed {@link Submission} records.
 * Only call after {@link SchemaValidator#validateSubmission(Object)} succeeded.
 */
public class PayloadMapper {

    private final ObjectMapper objectMapper;

    public PayloadMapper() {
        this(CatalogJson.newObjectMapper());
    }

    public PayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Submission toSubmission(Map<?, ?> raw) {
        return new Submission(
                convert(raw, "manufacturer", ManufacturerPayload.class),
                convert(raw, "model", ModelPayload.class),
                convert(raw, "individual_guitar", IndividualGuitarPayload.class));
    }

    private <T> T convert(Map<?, ?> raw, String section, Class<T> type) {
        Object value = raw.get(section);
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException(List.of(new SchemaViolation(section, e.getMessage())));
        }
    }
}
