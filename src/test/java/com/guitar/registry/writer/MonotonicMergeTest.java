package com.guitar.registry.writer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonotonicMergeTest {

    private MonotonicMerge merge;

    @BeforeEach
    void setUp() {
        merge = new MonotonicMerge();
    }

    @Test
    @DisplayName("Null incoming value should keep the stored one")
    void testNullKeepsStored() {
        assertEquals("USA", merge.merge("country", "USA", null));
        assertFalse(merge.hasChanges());
    }

    @Test
    @DisplayName("Non-null incoming value should replace the stored one")
    void testIncomingWins() {
        assertEquals("https://www.fender.com", merge.merge("website", null, "https://www.fender.com"));
        assertEquals("Japan", merge.merge("country", "USA", "Japan"));
        assertEquals(List.of("website", "country"), merge.changedFields());
    }

    @Test
    @DisplayName("Equal values should not count as a change")
    void testEqualValues() {
        merge.merge("country", "USA", "USA");
        merge.merge("msrp_original", new BigDecimal("249.00"), new BigDecimal("249"));

        assertFalse(merge.hasChanges());
    }

    @Test
    @DisplayName("fillIfAbsent should never overwrite a stored value")
    void testFillIfAbsent() {
        assertEquals("9-0824", merge.fillIfAbsent("serial_number", "9-0824", "090824"));
        assertFalse(merge.hasChanges());

        assertEquals("090824", merge.fillIfAbsent("serial_number", null, "090824"));
        assertEquals(List.of("serial_number"), merge.changedFields());
    }

    @Test
    @DisplayName("changedFields should be a snapshot")
    void testChangedFieldsSnapshot() {
        merge.merge("notes", null, "first");
        List<String> snapshot = merge.changedFields();
        merge.merge("country", null, "USA");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("x"));
    }
}
