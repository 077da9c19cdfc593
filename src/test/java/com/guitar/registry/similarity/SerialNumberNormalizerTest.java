package com.guitar.registry.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SerialNumberNormalizerTest {

    @Test
    @DisplayName("Dashed, plain and zero-padded serials should share one key")
    void testEquivalentForms() {
        String expected = SerialNumberNormalizer.normalize("90824");

        assertEquals("90824", expected);
        assertEquals(expected, SerialNumberNormalizer.normalize("9-0824"));
        assertEquals(expected, SerialNumberNormalizer.normalize("090824"));
        assertEquals(expected, SerialNumberNormalizer.normalize("  0-9-0824 "));
    }

    @Test
    @DisplayName("Should fold case")
    void testCaseFolding() {
        assertEquals(SerialNumberNormalizer.normalize("ab1234"), SerialNumberNormalizer.normalize("AB-1234"));
    }

    @Test
    @DisplayName("Should drop unicode dash characters")
    void testUnicodeDashes() {
        assertEquals("90824", SerialNumberNormalizer.normalize("9–0824"));
    }

    @Test
    @DisplayName("Null or blank serial should normalize to null")
    void testBlank() {
        assertNull(SerialNumberNormalizer.normalize(null));
        assertNull(SerialNumberNormalizer.normalize("   "));
        assertNull(SerialNumberNormalizer.normalize("--"));
    }

    @Test
    @DisplayName("All-zero serial should normalize to 0")
    void testAllZeros() {
        assertEquals("0", SerialNumberNormalizer.normalize("000"));
        assertEquals("0", SerialNumberNormalizer.normalize("0-0"));
    }

    @Test
    @DisplayName("sameSerial should compare normalized forms")
    void testSameSerial() {
        assertTrue(SerialNumberNormalizer.sameSerial("9-0824", "090824"));
        assertFalse(SerialNumberNormalizer.sameSerial("9-0824", "9-0825"));
        assertFalse(SerialNumberNormalizer.sameSerial(null, null));
    }
}
