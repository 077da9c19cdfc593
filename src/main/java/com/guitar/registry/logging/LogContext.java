package com.guitar.registry.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts ingestion identifiers into the SLF4J MDC and removes them again on close.
 * A key that an enclosing context had already set gets its previous value back.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSubmission(batchId, index)) {
 *     log.info("submission.succeeded index={} actions={}", index, actions);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", Integer.toString(size));
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forSubmission(String batchId, int index) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("submissionIndex", Integer.toString(index));
        ctx.put("operation", "submission");
        return ctx;
    }

    public static LogContext forReview(String reviewItemId) {
        LogContext ctx = new LogContext();
        ctx.put("reviewItemId", reviewItemId);
        ctx.put("operation", "review");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another entry; it is removed with the rest on close.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
