package com.guitar.registry.validation;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Constraints on one field of a {@link PayloadSchema}.
 */
public record FieldRule(
        String name,
        FieldType type,
        boolean required,
        Integer minLength,
        Integer maxLength,
        BigDecimal minimum,
        BigDecimal maximum,
        List<String> allowedValues,
        PayloadSchema nestedSchema
) {
    public FieldRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
        if ((type == FieldType.OBJECT || type == FieldType.OBJECT_LIST) && nestedSchema == null) {
            throw new IllegalArgumentException("Field '" + name + "' of type " + type + " needs a nested schema");
        }
    }

    public static Builder string(String name) {
        return new Builder(name, FieldType.STRING);
    }

    public static Builder integer(String name) {
        return new Builder(name, FieldType.INTEGER);
    }

    public static Builder number(String name) {
        return new Builder(name, FieldType.NUMBER);
    }

    public static Builder bool(String name) {
        return new Builder(name, FieldType.BOOLEAN);
    }

    public static Builder date(String name) {
        return new Builder(name, FieldType.DATE);
    }

    public static Builder uri(String name) {
        return new Builder(name, FieldType.URI);
    }

    public static Builder object(String name, PayloadSchema schema) {
        return new Builder(name, FieldType.OBJECT).schema(schema);
    }

    public static Builder objectList(String name, PayloadSchema schema) {
        return new Builder(name, FieldType.OBJECT_LIST).schema(schema);
    }

    public static Builder array(String name) {
        return new Builder(name, FieldType.ARRAY);
    }

    public static class Builder {
        private final String name;
        private final FieldType type;
        private boolean required;
        private Integer minLength;
        private Integer maxLength;
        private BigDecimal minimum;
        private BigDecimal maximum;
        private List<String> allowedValues;
        private PayloadSchema nestedSchema;

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder length(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("invalid length bounds [" + min + ", " + max + "]");
            }
            this.minLength = min;
            this.maxLength = max;
            return this;
        }

        public Builder maxLength(int max) {
            return length(0, max);
        }

        public Builder range(double min, double max) {
            if (max < min) {
                throw new IllegalArgumentException("invalid range [" + min + ", " + max + "]");
            }
            this.minimum = BigDecimal.valueOf(min);
            this.maximum = BigDecimal.valueOf(max);
            return this;
        }

        public Builder minimum(double min) {
            this.minimum = BigDecimal.valueOf(min);
            return this;
        }

        public Builder oneOf(List<String> values) {
            this.allowedValues = values;
            return this;
        }

        private Builder schema(PayloadSchema schema) {
            this.nestedSchema = schema;
            return this;
        }

        public FieldRule build() {
            return new FieldRule(name, type, required, minLength, maxLength, minimum, maximum,
                    allowedValues, nestedSchema);
        }
    }
}
