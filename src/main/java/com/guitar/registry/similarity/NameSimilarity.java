package com.guitar.registry.similarity;

/**
 * Scores two names with a {@link SimilarityAlgorithm} after {@link NameNormalizer normalization}.
 */
public class NameSimilarity {

    private final SimilarityAlgorithm algorithm;

    public NameSimilarity() {
        this(new SequenceMatcherSimilarity());
    }

    public NameSimilarity(SimilarityAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public double score(String a, String b) {
        return algorithm.compute(NameNormalizer.normalize(a), NameNormalizer.normalize(b));
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }
}
