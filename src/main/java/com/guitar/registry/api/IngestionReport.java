package com.guitar.registry.api;

/**
 * What an ingestion call returns: a {@link SubmissionResult} for a single submission,
 * a {@link BatchIngestionResult} for a list.
 */
public interface IngestionReport {

    /**
     * Whether every submission in the call was ingested.
     */
    boolean success();
}
