package com.guitar.registry.similarity;

/**
 * Interface for string similarity algorithms used when ranking match candidates.
 * Implementations return a score between 0.0 (nothing in common) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two already-normalized strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
