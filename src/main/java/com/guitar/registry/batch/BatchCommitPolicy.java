package com.guitar.registry.batch;

/**
 * Decides once per call whether its transaction commits.
 *
 * <ul>
 *   <li>No failures: commit.</li>
 *   <li>A single submission (not a batch) that failed: roll back; it has nothing to keep.</li>
 *   <li>A batch whose failure rate exceeds {@code maxFailureRate}: roll back everything.</li>
 *   <li>Otherwise: commit the successes and flag the batch as a partial success.</li>
 * </ul>
 */
public class BatchCommitPolicy {

    private final double maxFailureRate;

    public BatchCommitPolicy(double maxFailureRate) {
        if (maxFailureRate < 0.0 || maxFailureRate > 1.0) {
            throw new IllegalArgumentException("maxFailureRate must be between 0.0 and 1.0");
        }
        this.maxFailureRate = maxFailureRate;
    }

    public CommitDecision decide(boolean batchMode, int failed, int total) {
        if (failed < 0 || failed > total) {
            throw new IllegalArgumentException("failed must be between 0 and " + total + ", got " + failed);
        }
        if (failed == 0) {
            return CommitDecision.commitAll();
        }
        if (!batchMode) {
            return CommitDecision.rollback(null);
        }
        double failureRate = (double) failed / total;
        if (failureRate > maxFailureRate) {
            return CommitDecision.rollback("High failure rate: " + failed + "/" + total + " submissions failed");
        }
        return CommitDecision.commitPartial();
    }

    public double getMaxFailureRate() {
        return maxFailureRate;
    }
}
