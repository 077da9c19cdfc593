package com.guitar.registry.writer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field-by-field merge that never loses data: a non-null incoming value replaces the stored one,
 * a null incoming value leaves it untouched. Records which fields actually changed.
 *
 * <pre>
 * MonotonicMerge merge = new MonotonicMerge();
 * builder.country(merge.merge("country", stored.country(), incoming.country()));
 * if (merge.hasChanges()) { ... }
 * </pre>
 */
public class MonotonicMerge {

    private final List<String> changedFields = new ArrayList<>();

    /**
     * Returns {@code incoming} when it is non-null, otherwise {@code stored}.
     */
    public <T> T merge(String field, T stored, T incoming) {
        if (incoming == null || sameValue(stored, incoming)) {
            return stored;
        }
        changedFields.add(field);
        return incoming;
    }

    /**
     * Returns {@code incoming} only when nothing is stored yet.
     */
    public <T> T fillIfAbsent(String field, T stored, T incoming) {
        if (stored != null || incoming == null) {
            return stored;
        }
        changedFields.add(field);
        return incoming;
    }

    public boolean hasChanges() {
        return !changedFields.isEmpty();
    }

    public List<String> changedFields() {
        return List.copyOf(changedFields);
    }

    private static boolean sameValue(Object stored, Object incoming) {
        if (stored instanceof BigDecimal a && incoming instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(stored, incoming);
    }
}
