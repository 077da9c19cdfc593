package com.guitar.registry.decision;

import java.util.Locale;

/**
 * What to do with an incoming entity.
 */
public enum ResolutionAction {
    /** Create a new row. */
    INSERT,
    /** Merge into the matched row. */
    UPDATE,
    /** Plausible but unconfident match; stop and wait for a human decision. */
    MANUAL_REVIEW;

    /**
     * Lower-case form used in action strings, e.g. {@code "Model update"}.
     */
    public String verb() {
        return name().toLowerCase(Locale.ROOT);
    }
}
