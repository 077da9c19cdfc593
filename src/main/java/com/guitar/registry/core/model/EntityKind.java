package com.guitar.registry.core.model;

/**
 * The three catalog entity kinds a submission may carry, in processing order.
 */
public enum EntityKind {
    MANUFACTURER("manufacturer", "Manufacturer"),
    MODEL("model", "Model"),
    INDIVIDUAL_GUITAR("individual_guitar", "Guitar");

    private final String sectionName;
    private final String label;

    EntityKind(String sectionName, String label) {
        this.sectionName = sectionName;
        this.label = label;
    }

    /**
     * Returns the key of this kind's section in a submission record.
     */
    public String sectionName() {
        return sectionName;
    }

    /**
     * Returns the human-readable label used in action strings ("Guitar insert").
     */
    public String label() {
        return label;
    }

    public static EntityKind fromSectionName(String sectionName) {
        for (EntityKind kind : values()) {
            if (kind.sectionName.equals(sectionName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown section: " + sectionName);
    }
}
