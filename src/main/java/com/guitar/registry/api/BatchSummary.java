package com.guitar.registry.api;

import java.util.List;

/**
 * Aggregate counts for a batch.
 */
public record BatchSummary(int successful, int failed, int manualReviewNeeded, ActionCounts actionsTaken) {

    public static BatchSummary from(List<SubmissionResult> results) {
        int successful = 0;
        int manualReview = 0;
        for (SubmissionResult result : results) {
            if (result.success()) {
                successful++;
            }
            if (result.manualReviewNeeded()) {
                manualReview++;
            }
        }
        return new BatchSummary(successful, results.size() - successful, manualReview, ActionCounts.from(results));
    }
}
