package com.guitar.registry.writer;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Inserts and merges manufacturer rows. The name is never rewritten by a merge.
 */
public class ManufacturerWriter {
    private static final Logger log = LoggerFactory.getLogger(ManufacturerWriter.class);

    private final WriteStamp stamp;

    public ManufacturerWriter(WriteStamp stamp) {
        this.stamp = stamp;
    }

    public WriteOutcome insert(CatalogTransaction tx, ManufacturerPayload payload) {
        Instant now = stamp.now();
        Manufacturer row = Manufacturer.builder()
                .id(stamp.newId())
                .name(payload.name().trim())
                .displayName(payload.displayName())
                .country(payload.country())
                .foundedYear(payload.foundedYear())
                .website(payload.website())
                .status(payload.status() != null ? payload.status() : ManufacturerStatus.ACTIVE)
                .notes(payload.notes())
                .createdBy(stamp.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .build();
        tx.insertManufacturer(row);
        log.debug("manufacturer.inserted id={} name={}", row.id(), row.name());
        return WriteOutcome.inserted(EntityKind.MANUFACTURER, row.id(), null);
    }

    public WriteOutcome update(CatalogTransaction tx, UUID manufacturerId, ManufacturerPayload payload) {
        Manufacturer stored = tx.findManufacturerById(manufacturerId)
                .orElseThrow(() -> new StorageException("No manufacturer with id: " + manufacturerId));

        MonotonicMerge merge = new MonotonicMerge();
        Manufacturer.Builder builder = stored.toBuilder()
                .displayName(merge.merge("display_name", stored.displayName(), payload.displayName()))
                .country(merge.merge("country", stored.country(), payload.country()))
                .foundedYear(merge.merge("founded_year", stored.foundedYear(), payload.foundedYear()))
                .website(merge.merge("website", stored.website(), payload.website()))
                .status(merge.merge("status", stored.status(), payload.status()))
                .notes(merge.merge("notes", stored.notes(), payload.notes()));

        if (merge.hasChanges()) {
            tx.updateManufacturer(builder.updatedAt(stamp.now()).build());
            log.debug("manufacturer.updated id={} fields={}", manufacturerId, merge.changedFields());
        }
        return WriteOutcome.updated(EntityKind.MANUFACTURER, manufacturerId, merge.changedFields());
    }
}
