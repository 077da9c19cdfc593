package com.guitar.registry.audit;

/**
 * Kinds of audit entries written by the ingestion engine.
 */
public enum AuditAction {
    ENTITY_INSERTED,
    ENTITY_UPDATED,
    MANUAL_REVIEW_REQUESTED,
    MANUAL_REVIEW_COMPLETED,
    BATCH_COMMITTED,
    BATCH_ROLLED_BACK
}
