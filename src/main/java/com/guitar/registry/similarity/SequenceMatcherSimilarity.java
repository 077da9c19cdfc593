package com.guitar.registry.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp pattern matching.
 * Finds the longest common substring, then recurses on the unmatched text to its left and right.
 * The score is {@code 2 * M / (|s1| + |s2|)} where M is the total number of matched characters.
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "RatcliffObershelp";
    }

    private int matchingCharacters(String a, String b) {
        int matches = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];
            if (aLow >= aHigh || bLow >= bHigh) {
                continue;
            }

            int[] match = longestMatch(a, aLow, aHigh, b, bLow, bHigh);
            int size = match[2];
            if (size == 0) {
                continue;
            }
            matches += size;
            pending.push(new int[]{aLow, match[0], bLow, match[1]});
            pending.push(new int[]{match[0] + size, aHigh, match[1] + size, bHigh});
        }
        return matches;
    }

    /**
     * Longest common substring of a[aLow, aHigh) and b[bLow, bHigh).
     * Ties resolve to the earliest start in {@code a}, then in {@code b}.
     *
     * @return {start in a, start in b, length}
     */
    private int[] longestMatch(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        int width = bHigh - bLow;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        int bestA = aLow;
        int bestB = bLow;
        int bestSize = 0;

        for (int i = aLow; i < aHigh; i++) {
            for (int j = bLow; j < bHigh; j++) {
                int column = j - bLow + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    int length = previous[column - 1] + 1;
                    current[column] = length;
                    if (length > bestSize) {
                        bestA = i - length + 1;
                        bestB = j - length + 1;
                        bestSize = length;
                    }
                } else {
                    current[column] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new int[]{bestA, bestB, bestSize};
    }
}
