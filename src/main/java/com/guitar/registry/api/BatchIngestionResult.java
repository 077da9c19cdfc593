package com.guitar.registry.api;

import java.util.List;

/**
 * Outcome of a batch call.
 *
 * <p>When {@code rolledBack} is set nothing from the batch was persisted, even though individual
 * results may list the ids their writes had before the rollback.</p>
 *
 * @param success        {@code true} when every submission succeeded and the batch committed
 * @param processedCount submissions that reached a result
 * @param totalCount     submissions in the batch
 * @param rollbackReason why the batch was rolled back for its failure rate, or {@code null}
 * @param partialSuccess some submissions failed but the rest were committed
 * @param error          batch-level failure message, or {@code null}
 */
public record BatchIngestionResult(
        boolean success,
        int processedCount,
        int totalCount,
        List<SubmissionResult> results,
        BatchSummary summary,
        boolean rolledBack,
        String rollbackReason,
        boolean partialSuccess,
        String error
) implements IngestionReport {

    public BatchIngestionResult {
        results = results != null ? List.copyOf(results) : List.of();
    }
}
