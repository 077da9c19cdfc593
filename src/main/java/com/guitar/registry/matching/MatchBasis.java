package com.guitar.registry.matching;

/**
 * What a match candidate's score is grounded on.
 */
public enum MatchBasis {
    /** Fuzzy name similarity (manufacturers, models). */
    NAME,
    /** Normalized serial number equality. The only basis that identifies a physical guitar. */
    SERIAL_NUMBER,
    /** Guitars sharing the same catalog model. */
    MODEL_REFERENCE,
    /** Guitars described by the same fallback manufacturer/model text. */
    FALLBACK_TEXT,
    /** Chosen by a reviewer while resolving a manual review item. */
    REVIEWER
}
