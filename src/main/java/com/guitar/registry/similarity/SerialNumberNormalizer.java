package com.guitar.registry.similarity;

import java.util.Locale;

/**
 * Canonical form of a serial number, so that "9-0824", "90824" and "090824" compare equal.
 * Trims, case-folds, drops every dash character and strips leading zeros.
 */
public final class SerialNumberNormalizer {

    private SerialNumberNormalizer() {
    }

    /**
     * Returns the canonical serial, or {@code null} when the input is null or blank.
     * A serial made only of zeros and dashes normalizes to {@code "0"}.
     */
    public static String normalize(String serialNumber) {
        if (serialNumber == null || serialNumber.isBlank()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(serialNumber.length());
        serialNumber.trim().codePoints()
                .filter(cp -> Character.getType(cp) != Character.DASH_PUNCTUATION)
                .forEach(sb::appendCodePoint);

        String folded = sb.toString().toLowerCase(Locale.ROOT);
        if (folded.isEmpty()) {
            return null;
        }
        int start = 0;
        while (start < folded.length() && folded.charAt(start) == '0') {
            start++;
        }
        return start == folded.length() ? "0" : folded.substring(start);
    }

    public static boolean sameSerial(String a, String b) {
        String left = normalize(a);
        return left != null && left.equals(normalize(b));
    }
}
