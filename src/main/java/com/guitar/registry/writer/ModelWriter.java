package com.guitar.registry.writer;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.ProductionType;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inserts and merges model rows. Manufacturer, name and year form the model's identity and are
 * never rewritten by a merge; production type is only set on insert. Specifications are only
 * written for new models.
 */
public class ModelWriter {
    private static final Logger log = LoggerFactory.getLogger(ModelWriter.class);

    static final String DEFAULT_CURRENCY = "USD";

    private final WriteStamp stamp;
    private final ReferenceResolver references;
    private final SpecificationWriter specifications;

    public ModelWriter(WriteStamp stamp, ReferenceResolver references, SpecificationWriter specifications) {
        this.stamp = stamp;
        this.references = references;
        this.specifications = specifications;
    }

    public WriteOutcome insert(CatalogTransaction tx, UUID manufacturerId, ModelPayload payload) {
        Instant now = stamp.now();
        GuitarModel row = GuitarModel.builder()
                .id(stamp.newId())
                .manufacturerId(manufacturerId)
                .productLineId(references.productLine(tx, manufacturerId, payload.productLineName()))
                .name(payload.name().trim())
                .year(payload.year())
                .productionType(payload.productionType() != null ? payload.productionType() : ProductionType.MASS)
                .productionStartDate(payload.productionStartDate())
                .productionEndDate(payload.productionEndDate())
                .estimatedProductionQuantity(payload.estimatedProductionQuantity())
                .msrpOriginal(payload.msrpOriginal())
                .currency(payload.currency() != null ? payload.currency() : DEFAULT_CURRENCY)
                .description(payload.description())
                .createdBy(stamp.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .build();
        tx.insertModel(row);
        List<UUID> specIds = specifications.insertForModel(tx, row.id(), payload.specifications());
        log.debug("model.inserted id={} name={} year={} specifications={}",
                row.id(), row.name(), row.year(), specIds.size());
        return WriteOutcome.inserted(EntityKind.MODEL, row.id(), specIds);
    }

    public WriteOutcome update(CatalogTransaction tx, UUID modelId, ModelPayload payload) {
        GuitarModel stored = tx.findModelById(modelId)
                .orElseThrow(() -> new StorageException("No model with id: " + modelId));

        MonotonicMerge merge = new MonotonicMerge();
        UUID productLineId = stored.productLineId();
        if (productLineId == null && payload.productLineName() != null) {
            productLineId = merge.fillIfAbsent("product_line_id", null,
                    references.productLine(tx, stored.manufacturerId(), payload.productLineName()));
        }
        GuitarModel.Builder builder = stored.toBuilder()
                .productLineId(productLineId)
                .productionStartDate(merge.merge("production_start_date",
                        stored.productionStartDate(), payload.productionStartDate()))
                .productionEndDate(merge.merge("production_end_date",
                        stored.productionEndDate(), payload.productionEndDate()))
                .estimatedProductionQuantity(merge.merge("estimated_production_quantity",
                        stored.estimatedProductionQuantity(), payload.estimatedProductionQuantity()))
                .msrpOriginal(merge.merge("msrp_original", stored.msrpOriginal(), payload.msrpOriginal()))
                .currency(merge.merge("currency", stored.currency(), payload.currency()))
                .description(merge.merge("description", stored.description(), payload.description()));

        if (merge.hasChanges()) {
            tx.updateModel(builder.updatedAt(stamp.now()).build());
            log.debug("model.updated id={} fields={}", modelId, merge.changedFields());
        }
        return WriteOutcome.updated(EntityKind.MODEL, modelId, merge.changedFields());
    }
}
