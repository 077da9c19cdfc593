package com.guitar.registry.batch;

/**
 * How a call's transaction ends.
 *
 * @param commit         whether to commit
 * @param partialSuccess committed although some submissions failed
 * @param rollbackReason reported reason for discarding a whole batch, or {@code null}
 */
public record CommitDecision(boolean commit, boolean partialSuccess, String rollbackReason) {

    static CommitDecision commitAll() {
        return new CommitDecision(true, false, null);
    }

    static CommitDecision commitPartial() {
        return new CommitDecision(true, true, null);
    }

    static CommitDecision rollback(String reason) {
        return new CommitDecision(false, false, reason);
    }

    /**
     * A batch-level rollback that callers are told about, as opposed to the silent rollback of a
     * single failed submission.
     */
    public boolean reportedRollback() {
        return !commit && rollbackReason != null;
    }
}
