package com.guitar.registry.writer;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.SignificanceLevel;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inserts and merges individual guitars. A stored serial number keeps its original formatting;
 * an incoming serial only fills an empty one. Significance level is only set on insert.
 */
public class IndividualGuitarWriter {
    private static final Logger log = LoggerFactory.getLogger(IndividualGuitarWriter.class);

    private final WriteStamp stamp;
    private final SpecificationWriter specifications;

    public IndividualGuitarWriter(WriteStamp stamp, SpecificationWriter specifications) {
        this.stamp = stamp;
        this.specifications = specifications;
    }

    /**
     * @param modelId resolved catalog model, or {@code null} to rely on the fallback fields
     */
    public WriteOutcome insert(CatalogTransaction tx, IndividualGuitarPayload payload, UUID modelId) {
        Instant now = stamp.now();
        IndividualGuitar row = IndividualGuitar.builder()
                .id(stamp.newId())
                .modelId(modelId)
                .manufacturerNameFallback(payload.manufacturerNameFallback())
                .modelNameFallback(payload.modelNameFallback())
                .yearEstimate(payload.yearEstimate())
                .description(payload.description())
                .nickname(payload.nickname())
                .serialNumber(payload.serialNumber())
                .productionDate(payload.productionDate())
                .productionNumber(payload.productionNumber())
                .significanceLevel(payload.significanceLevel() != null
                        ? payload.significanceLevel() : SignificanceLevel.NOTABLE)
                .significanceNotes(payload.significanceNotes())
                .currentEstimatedValue(payload.currentEstimatedValue())
                .lastValuationDate(payload.lastValuationDate())
                .conditionRating(payload.conditionRating())
                .modifications(payload.modifications())
                .provenanceNotes(payload.provenanceNotes())
                .createdBy(stamp.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .build();
        tx.insertGuitar(row);
        List<UUID> specIds = specifications.insertForGuitar(tx, row.id(), payload.specifications());
        log.debug("guitar.inserted id={} modelId={} serial={}", row.id(), modelId, row.serialNumber());
        return WriteOutcome.inserted(EntityKind.INDIVIDUAL_GUITAR, row.id(), specIds);
    }

    public WriteOutcome update(CatalogTransaction tx, UUID guitarId, IndividualGuitarPayload payload, UUID modelId) {
        IndividualGuitar stored = tx.findGuitarById(guitarId)
                .orElseThrow(() -> new StorageException("No individual guitar with id: " + guitarId));

        MonotonicMerge merge = new MonotonicMerge();
        IndividualGuitar.Builder builder = stored.toBuilder()
                .modelId(merge.merge("model_id", stored.modelId(), modelId))
                .manufacturerNameFallback(merge.merge("manufacturer_name_fallback",
                        stored.manufacturerNameFallback(), payload.manufacturerNameFallback()))
                .modelNameFallback(merge.merge("model_name_fallback",
                        stored.modelNameFallback(), payload.modelNameFallback()))
                .yearEstimate(merge.merge("year_estimate", stored.yearEstimate(), payload.yearEstimate()))
                .description(merge.merge("description", stored.description(), payload.description()))
                .nickname(merge.merge("nickname", stored.nickname(), payload.nickname()))
                .serialNumber(merge.fillIfAbsent("serial_number", stored.serialNumber(), payload.serialNumber()))
                .productionDate(merge.merge("production_date", stored.productionDate(), payload.productionDate()))
                .productionNumber(merge.merge("production_number",
                        stored.productionNumber(), payload.productionNumber()))
                .significanceNotes(merge.merge("significance_notes",
                        stored.significanceNotes(), payload.significanceNotes()))
                .currentEstimatedValue(merge.merge("current_estimated_value",
                        stored.currentEstimatedValue(), payload.currentEstimatedValue()))
                .lastValuationDate(merge.merge("last_valuation_date",
                        stored.lastValuationDate(), payload.lastValuationDate()))
                .conditionRating(merge.merge("condition_rating", stored.conditionRating(), payload.conditionRating()))
                .modifications(merge.merge("modifications", stored.modifications(), payload.modifications()))
                .provenanceNotes(merge.merge("provenance_notes", stored.provenanceNotes(), payload.provenanceNotes()));

        if (merge.hasChanges()) {
            tx.updateGuitar(builder.updatedAt(stamp.now()).build());
            log.debug("guitar.updated id={} fields={}", guitarId, merge.changedFields());
        }
        return WriteOutcome.updated(EntityKind.INDIVIDUAL_GUITAR, guitarId, merge.changedFields());
    }
}
