package com.guitar.registry.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityTest {

    private final NameSimilarity nameSimilarity = new NameSimilarity();

    @Test
    @DisplayName("Should ignore case and surrounding whitespace")
    void testNormalizedComparison() {
        assertEquals(1.0, nameSimilarity.score("  GIBSON  Guitar ", "gibson guitar"), 0.0001);
    }

    @Test
    @DisplayName("Should use sequence matching by default")
    void testDefaultAlgorithm() {
        assertInstanceOf(SequenceMatcherSimilarity.class, nameSimilarity.getAlgorithm());
    }

    @Test
    @DisplayName("Should delegate to a supplied algorithm with normalized input")
    void testCustomAlgorithm() {
        NameSimilarity custom = new NameSimilarity(new SimilarityAlgorithm() {
            @Override
            public double compute(String s1, String s2) {
                return s1.equals("fender") && s2.equals("fender") ? 0.42 : 0.0;
            }

            @Override
            public String getName() {
                return "fixed";
            }
        });

        assertEquals(0.42, custom.score("Fender ", " FENDER"), 0.0001);
    }

    @Test
    @DisplayName("NameNormalizer should collapse internal whitespace")
    void testNormalize() {
        assertEquals("les paul standard", NameNormalizer.normalize(" Les   Paul\tStandard "));
        assertEquals("", NameNormalizer.normalize(null));
    }

    @Test
    @DisplayName("sameName should treat nulls as different")
    void testSameName() {
        assertTrue(NameNormalizer.sameName("Gibson", " gibson"));
        assertFalse(NameNormalizer.sameName(null, null));
        assertFalse(NameNormalizer.sameName("Gibson", "Epiphone"));
    }
}
