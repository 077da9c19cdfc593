package com.guitar.registry.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative schema for one object in a submission: the allowed fields, their rules and
 * optional "at least one of these field groups must be present" constraints.
 * Fields not declared in the schema are rejected.
 */
public final class PayloadSchema {

    private final String name;
    private final Map<String, FieldRule> fields;
    private final List<FieldGroupRequirement> groupRequirements;

    private PayloadSchema(Builder builder) {
        this.name = builder.name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.groupRequirements = List.copyOf(builder.groupRequirements);
    }

    public String getName() {
        return name;
    }

    public Map<String, FieldRule> getFields() {
        return fields;
    }

    public FieldRule getField(String fieldName) {
        return fields.get(fieldName);
    }

    public List<FieldGroupRequirement> getGroupRequirements() {
        return groupRequirements;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Satisfied when every field of at least one group is present and non-null.
     */
    public record FieldGroupRequirement(String message, List<List<String>> groups) {
        public FieldGroupRequirement {
            Objects.requireNonNull(message, "message is required");
            groups = groups.stream().map(List::copyOf).toList();
            if (groups.isEmpty()) {
                throw new IllegalArgumentException("at least one field group is required");
            }
        }

        public boolean isSatisfiedBy(Map<?, ?> values) {
            return groups.stream().anyMatch(group ->
                    group.stream().allMatch(field -> values.get(field) != null));
        }
    }

    public static class Builder {
        private final String name;
        private final Map<String, FieldRule> fields = new LinkedHashMap<>();
        private final List<FieldGroupRequirement> groupRequirements = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public Builder field(FieldRule.Builder rule) {
            return field(rule.build());
        }

        public Builder field(FieldRule rule) {
            if (fields.putIfAbsent(rule.name(), rule) != null) {
                throw new IllegalArgumentException("Duplicate field '" + rule.name() + "' in schema " + name);
            }
            return this;
        }

        @SafeVarargs
        public final Builder requireAnyOf(String message, List<String>... groups) {
            for (List<String> group : groups) {
                for (String field : group) {
                    if (!fields.containsKey(field)) {
                        throw new IllegalArgumentException("Unknown field '" + field + "' in schema " + name);
                    }
                }
            }
            groupRequirements.add(new FieldGroupRequirement(message, Arrays.asList(groups)));
            return this;
        }

        public PayloadSchema build() {
            return new PayloadSchema(this);
        }
    }
}
