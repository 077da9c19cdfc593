package com.guitar.registry.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guitar.registry.api.ActionCounts;
import com.guitar.registry.api.BatchIngestionResult;
import com.guitar.registry.api.BatchSummary;
import com.guitar.registry.api.IngestionReport;
import com.guitar.registry.api.SubmissionResult;
import com.guitar.registry.core.CatalogJson;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders ingestion results in their wire shape. Optional members ({@code failure_kind},
 * {@code error}, {@code rolled_back}, {@code rollback_reason}, {@code partial_success}) are
 * written only when set.
 */
public class IngestionReportWriter {

    private final ObjectMapper objectMapper;

    public IngestionReportWriter() {
        this(CatalogJson.newObjectMapper());
    }

    public IngestionReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(IngestionReport report) {
        try {
            return objectMapper.writeValueAsString(toMap(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize ingestion report", e);
        }
    }

    public Map<String, Object> toMap(IngestionReport report) {
        if (report instanceof SubmissionResult result) {
            return submission(result);
        }
        if (report instanceof BatchIngestionResult batch) {
            return batch(batch);
        }
        throw new IllegalArgumentException("Unsupported report type: " + report);
    }

    private Map<String, Object> submission(SubmissionResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("index", result.index());
        out.put("success", result.success());
        out.put("actions_taken", result.actionsTaken());
        out.put("conflicts", result.conflicts());
        out.put("ids_created", result.idsCreated());
        out.put("manual_review_needed", result.manualReviewNeeded());
        if (result.failureKind() != null) {
            out.put("failure_kind", result.failureKind().name());
        }
        if (result.error() != null) {
            out.put("error", result.error());
        }
        out.put("resolved_ids", result.resolvedIds());
        return out;
    }

    private Map<String, Object> batch(BatchIngestionResult batch) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", batch.success());
        out.put("processed_count", batch.processedCount());
        out.put("total_count", batch.totalCount());
        List<Map<String, Object>> results = batch.results().stream().map(this::submission).toList();
        out.put("results", results);
        out.put("summary", summary(batch.summary()));
        if (batch.rolledBack()) {
            out.put("rolled_back", true);
        }
        if (batch.rollbackReason() != null) {
            out.put("rollback_reason", batch.rollbackReason());
        }
        if (batch.partialSuccess()) {
            out.put("partial_success", true);
        }
        if (batch.error() != null) {
            out.put("error", batch.error());
        }
        return out;
    }

    private Map<String, Object> summary(BatchSummary summary) {
        ActionCounts counts = summary.actionsTaken();
        Map<String, Object> actions = new LinkedHashMap<>();
        actions.put("manufacturers_inserted", counts.manufacturersInserted());
        actions.put("manufacturers_updated", counts.manufacturersUpdated());
        actions.put("models_inserted", counts.modelsInserted());
        actions.put("models_updated", counts.modelsUpdated());
        actions.put("guitars_inserted", counts.guitarsInserted());
        actions.put("guitars_updated", counts.guitarsUpdated());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("successful", summary.successful());
        out.put("failed", summary.failed());
        out.put("manual_review_needed", summary.manualReviewNeeded());
        out.put("actions_taken", actions);
        return out;
    }
}
