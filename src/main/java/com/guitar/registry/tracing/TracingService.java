package com.guitar.registry.tracing;

import java.util.Map;

/**
 * Opens spans around ingestion calls and submissions. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    String BATCH_SPAN = "catalog.ingest.batch";
    String SUBMISSION_SPAN = "catalog.ingest.submission";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
