package com.guitar.registry.writer;

import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ProductLine;
import com.guitar.registry.core.payload.ModelReference;
import com.guitar.registry.store.CatalogTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Turns named references in payloads into catalog ids. Name lookups are exact and
 * case-insensitive; no fuzzy matching happens here.
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final WriteStamp stamp;

    public ReferenceResolver(WriteStamp stamp) {
        this.stamp = stamp;
    }

    /**
     * @throws MissingDependencyException if no manufacturer has this name
     */
    public UUID requireManufacturer(CatalogTransaction tx, String manufacturerName) {
        return tx.findManufacturerByName(manufacturerName)
                .map(Manufacturer::id)
                .orElseThrow(() -> MissingDependencyException.manufacturer(manufacturerName));
    }

    /**
     * Returns the id of the manufacturer's product line with this name, creating it when absent.
     * Returns {@code null} for a null or blank name.
     */
    public UUID productLine(CatalogTransaction tx, UUID manufacturerId, String productLineName) {
        if (productLineName == null || productLineName.isBlank()) {
            return null;
        }
        Optional<ProductLine> existing = tx.findProductLine(manufacturerId, productLineName);
        if (existing.isPresent()) {
            return existing.get().id();
        }
        ProductLine created = new ProductLine(stamp.newId(), manufacturerId, productLineName.trim(),
                stamp.createdBy(), stamp.now());
        tx.insertProductLine(created);
        log.debug("productLine.created id={} manufacturerId={} name={}", created.id(), manufacturerId, created.name());
        return created.id();
    }

    /**
     * Resolves a model reference to a model id, or empty when the manufacturer or model is unknown.
     */
    public Optional<UUID> resolveModel(CatalogTransaction tx, ModelReference reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return tx.findManufacturerByName(reference.manufacturerName())
                .flatMap(m -> tx.findModel(m.id(), reference.modelName(), reference.year()))
                .map(model -> model.id());
    }
}
