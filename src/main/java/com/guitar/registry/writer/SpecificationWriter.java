package com.guitar.registry.writer;

import com.guitar.registry.core.model.Specification;
import com.guitar.registry.core.model.SpecificationDetails;
import com.guitar.registry.store.CatalogTransaction;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Inserts specification rows for a newly created model or guitar.
 */
public class SpecificationWriter {

    private final WriteStamp stamp;

    public SpecificationWriter(WriteStamp stamp) {
        this.stamp = stamp;
    }

    public List<UUID> insertForModel(CatalogTransaction tx, UUID modelId, List<SpecificationDetails> specifications) {
        List<UUID> ids = new ArrayList<>(specifications.size());
        for (SpecificationDetails details : specifications) {
            Specification row = Specification.forModel(stamp.newId(), modelId, details, stamp.createdBy(), stamp.now());
            tx.insertSpecification(row);
            ids.add(row.id());
        }
        return ids;
    }

    public List<UUID> insertForGuitar(CatalogTransaction tx, UUID guitarId, List<SpecificationDetails> specifications) {
        List<UUID> ids = new ArrayList<>(specifications.size());
        for (SpecificationDetails details : specifications) {
            Specification row = Specification.forGuitar(stamp.newId(), guitarId, details, stamp.createdBy(), stamp.now());
            tx.insertSpecification(row);
            ids.add(row.id());
        }
        return ids;
    }
}
