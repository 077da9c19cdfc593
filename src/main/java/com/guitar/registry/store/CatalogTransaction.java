package com.guitar.registry.store;

import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ProductLine;
import com.guitar.registry.core.model.Specification;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work against the catalog. Every finder sees the writes made earlier in the same
 * transaction. Name lookups are exact and case-insensitive; candidate lists come back in
 * insertion order and are scored by the caller.
 *
 * <p>Closing a transaction that was neither committed nor rolled back rolls it back.</p>
 */
public interface CatalogTransaction extends AutoCloseable {

    // ── Manufacturers ─────────────────────────────────────────

    Optional<Manufacturer> findManufacturerById(UUID id);

    Optional<Manufacturer> findManufacturerByName(String name);

    /**
     * Returns every manufacturer that is not defunct.
     */
    List<Manufacturer> findManufacturerCandidates();

    void insertManufacturer(Manufacturer manufacturer);

    void updateManufacturer(Manufacturer manufacturer);

    // ── Product lines ─────────────────────────────────────────

    Optional<ProductLine> findProductLine(UUID manufacturerId, String name);

    void insertProductLine(ProductLine productLine);

    // ── Models ────────────────────────────────────────────────

    Optional<GuitarModel> findModelById(UUID id);

    Optional<GuitarModel> findModel(UUID manufacturerId, String name, int year);

    List<GuitarModel> findModelsByManufacturer(UUID manufacturerId);

    void insertModel(GuitarModel model);

    void updateModel(GuitarModel model);

    // ── Specifications ────────────────────────────────────────

    void insertSpecification(Specification specification);

    List<Specification> findSpecificationsForModel(UUID modelId);

    List<Specification> findSpecificationsForGuitar(UUID individualGuitarId);

    // ── Individual guitars ────────────────────────────────────

    Optional<IndividualGuitar> findGuitarById(UUID id);

    /**
     * Returns guitars whose serial number normalizes to {@code normalizedSerial}.
     *
     * @see com.guitar.registry.similarity.SerialNumberNormalizer
     */
    List<IndividualGuitar> findGuitarsBySerialNumber(String normalizedSerial);

    List<IndividualGuitar> findGuitarsByModel(UUID modelId);

    /**
     * Returns guitars whose fallback manufacturer name equals {@code manufacturerName}, ignoring case,
     * whether or not they are also linked to a catalog model.
     */
    List<IndividualGuitar> findGuitarsByFallbackManufacturer(String manufacturerName);

    void insertGuitar(IndividualGuitar guitar);

    void updateGuitar(IndividualGuitar guitar);

    // ── Transaction control ───────────────────────────────────

    long count(CatalogTable table);

    /**
     * Marks the current state so it can be restored with {@link #rollbackToSavepoint(String)}.
     *
     * @return the savepoint name
     */
    String setSavepoint();

    void rollbackToSavepoint(String savepoint);

    void releaseSavepoint(String savepoint);

    void commit();

    void rollback();

    boolean isActive();

    @Override
    void close();
}
