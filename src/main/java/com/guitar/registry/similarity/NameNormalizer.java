package com.guitar.registry.similarity;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes names before comparison: trimmed, lower-cased, internal whitespace collapsed.
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {
    }

    /**
     * Returns the normalized form of {@code name}, or an empty string for {@code null}.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Case- and whitespace-insensitive equality. Two nulls are not equal.
     */
    public static boolean sameName(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return normalize(a).equals(normalize(b));
    }
}
