package com.guitar.registry.store;

import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ProductLine;
import com.guitar.registry.core.model.Specification;
import com.guitar.registry.similarity.SerialNumberNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link CatalogStore}.
 * Suitable for testing and single-JVM embedding.
 *
 * <p>A transaction works on a private copy of the committed snapshot and publishes it on
 * commit. Only one transaction is open at a time; {@link #begin()} blocks until the previous
 * one finishes.</p>
 */
public class InMemoryCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogStore.class);

    private final Semaphore writePermit = new Semaphore(1);
    private volatile CatalogSnapshot committed;

    public InMemoryCatalogStore() {
        this(CatalogSnapshot.empty());
    }

    public InMemoryCatalogStore(CatalogSnapshot initial) {
        this.committed = Objects.requireNonNull(initial, "initial snapshot is required");
    }

    @Override
    public CatalogTransaction begin() {
        try {
            writePermit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for catalog transaction", e);
        }
        return new InMemoryTransaction(committed);
    }

    /**
     * Returns the last committed state.
     */
    public CatalogSnapshot snapshot() {
        return committed;
    }

    private final class InMemoryTransaction implements CatalogTransaction {

        private State state;
        private final Map<String, State> savepoints = new HashMap<>();
        private int savepointCounter;
        private boolean active = true;

        InMemoryTransaction(CatalogSnapshot base) {
            this.state = State.of(base);
        }

        @Override
        public Optional<Manufacturer> findManufacturerById(UUID id) {
            ensureActive();
            return Optional.ofNullable(state.manufacturers.get(id));
        }

        @Override
        public Optional<Manufacturer> findManufacturerByName(String name) {
            ensureActive();
            return state.manufacturers.values().stream()
                    .filter(m -> m.name().equalsIgnoreCase(name))
                    .findFirst();
        }

        @Override
        public List<Manufacturer> findManufacturerCandidates() {
            ensureActive();
            return select(state.manufacturers, m -> !m.isDefunct());
        }

        @Override
        public void insertManufacturer(Manufacturer manufacturer) {
            insert(state.manufacturers, manufacturer.id(), manufacturer);
        }

        @Override
        public void updateManufacturer(Manufacturer manufacturer) {
            update(state.manufacturers, manufacturer.id(), manufacturer);
        }

        @Override
        public Optional<ProductLine> findProductLine(UUID manufacturerId, String name) {
            ensureActive();
            return state.productLines.values().stream()
                    .filter(pl -> pl.manufacturerId().equals(manufacturerId) && pl.name().equalsIgnoreCase(name))
                    .findFirst();
        }

        @Override
        public void insertProductLine(ProductLine productLine) {
            insert(state.productLines, productLine.id(), productLine);
        }

        @Override
        public Optional<GuitarModel> findModelById(UUID id) {
            ensureActive();
            return Optional.ofNullable(state.models.get(id));
        }

        @Override
        public Optional<GuitarModel> findModel(UUID manufacturerId, String name, int year) {
            ensureActive();
            return state.models.values().stream()
                    .filter(m -> m.manufacturerId().equals(manufacturerId)
                            && m.year() == year
                            && m.name().equalsIgnoreCase(name))
                    .findFirst();
        }

        @Override
        public List<GuitarModel> findModelsByManufacturer(UUID manufacturerId) {
            ensureActive();
            return select(state.models, m -> m.manufacturerId().equals(manufacturerId));
        }

        @Override
        public void insertModel(GuitarModel model) {
            insert(state.models, model.id(), model);
        }

        @Override
        public void updateModel(GuitarModel model) {
            update(state.models, model.id(), model);
        }

        @Override
        public void insertSpecification(Specification specification) {
            insert(state.specifications, specification.id(), specification);
        }

        @Override
        public List<Specification> findSpecificationsForModel(UUID modelId) {
            ensureActive();
            return select(state.specifications, s -> modelId.equals(s.modelId()));
        }

        @Override
        public List<Specification> findSpecificationsForGuitar(UUID individualGuitarId) {
            ensureActive();
            return select(state.specifications, s -> individualGuitarId.equals(s.individualGuitarId()));
        }

        @Override
        public Optional<IndividualGuitar> findGuitarById(UUID id) {
            ensureActive();
            return Optional.ofNullable(state.guitars.get(id));
        }

        @Override
        public List<IndividualGuitar> findGuitarsBySerialNumber(String normalizedSerial) {
            ensureActive();
            return select(state.guitars,
                    g -> normalizedSerial.equals(SerialNumberNormalizer.normalize(g.serialNumber())));
        }

        @Override
        public List<IndividualGuitar> findGuitarsByModel(UUID modelId) {
            ensureActive();
            return select(state.guitars, g -> modelId.equals(g.modelId()));
        }

        @Override
        public List<IndividualGuitar> findGuitarsByFallbackManufacturer(String manufacturerName) {
            ensureActive();
            return select(state.guitars, g -> g.manufacturerNameFallback() != null
                    && g.manufacturerNameFallback().equalsIgnoreCase(manufacturerName));
        }

        @Override
        public void insertGuitar(IndividualGuitar guitar) {
            insert(state.guitars, guitar.id(), guitar);
        }

        @Override
        public void updateGuitar(IndividualGuitar guitar) {
            update(state.guitars, guitar.id(), guitar);
        }

        @Override
        public long count(CatalogTable table) {
            ensureActive();
            return state.toSnapshot().count(table);
        }

        @Override
        public String setSavepoint() {
            ensureActive();
            String name = "sp_" + (++savepointCounter);
            savepoints.put(name, state.copy());
            return name;
        }

        @Override
        public void rollbackToSavepoint(String savepoint) {
            ensureActive();
            State saved = savepoints.get(savepoint);
            if (saved == null) {
                throw new StorageException("Unknown savepoint: " + savepoint);
            }
            state = saved.copy();
        }

        @Override
        public void releaseSavepoint(String savepoint) {
            ensureActive();
            savepoints.remove(savepoint);
        }

        @Override
        public void commit() {
            ensureActive();
            committed = state.toSnapshot();
            finish();
            log.debug("catalog.committed rows={}", committed.totalRows());
        }

        @Override
        public void rollback() {
            ensureActive();
            finish();
            log.debug("catalog.rolledBack");
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (active) {
                rollback();
            }
        }

        private void finish() {
            active = false;
            savepoints.clear();
            writePermit.release();
        }

        private void ensureActive() {
            if (!active) {
                throw new IllegalStateException("Transaction is no longer active");
            }
        }

        private <V> void insert(Map<UUID, V> table, UUID id, V row) {
            ensureActive();
            if (table.putIfAbsent(id, row) != null) {
                throw new StorageException("Duplicate id: " + id);
            }
        }

        private <V> void update(Map<UUID, V> table, UUID id, V row) {
            ensureActive();
            if (table.replace(id, row) == null) {
                throw new StorageException("No row with id: " + id);
            }
        }

        private <V> List<V> select(Map<UUID, V> table, Predicate<V> filter) {
            return table.values().stream().filter(filter).toList();
        }
    }

    private static final class State {
        final Map<UUID, Manufacturer> manufacturers;
        final Map<UUID, ProductLine> productLines;
        final Map<UUID, GuitarModel> models;
        final Map<UUID, Specification> specifications;
        final Map<UUID, IndividualGuitar> guitars;

        private State(Map<UUID, Manufacturer> manufacturers, Map<UUID, ProductLine> productLines,
                      Map<UUID, GuitarModel> models, Map<UUID, Specification> specifications,
                      Map<UUID, IndividualGuitar> guitars) {
            this.manufacturers = new LinkedHashMap<>(manufacturers);
            this.productLines = new LinkedHashMap<>(productLines);
            this.models = new LinkedHashMap<>(models);
            this.specifications = new LinkedHashMap<>(specifications);
            this.guitars = new LinkedHashMap<>(guitars);
        }

        static State of(CatalogSnapshot snapshot) {
            return new State(snapshot.manufacturers(), snapshot.productLines(), snapshot.models(),
                    snapshot.specifications(), snapshot.guitars());
        }

        State copy() {
            return new State(manufacturers, productLines, models, specifications, guitars);
        }

        CatalogSnapshot toSnapshot() {
            return new CatalogSnapshot(manufacturers, productLines, models, specifications, guitars);
        }
    }
}
