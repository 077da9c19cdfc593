package com.guitar.registry.store;

import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.model.SignificanceLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCatalogStore Tests")
class InMemoryCatalogStoreTest {

    private InMemoryCatalogStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
    }

    private static Manufacturer manufacturer(String name) {
        return Manufacturer.builder()
                .id(UUID.randomUUID())
                .name(name)
                .status(ManufacturerStatus.ACTIVE)
                .build();
    }

    @Nested
    @DisplayName("Transaction lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Commit should publish writes")
        void testCommit() {
            try (CatalogTransaction tx = store.begin()) {
                tx.insertManufacturer(manufacturer("Gibson"));
                tx.commit();
                assertFalse(tx.isActive());
            }

            assertEquals(1, store.snapshot().count(CatalogTable.MANUFACTURERS));
        }

        @Test
        @DisplayName("Rollback should discard writes")
        void testRollback() {
            try (CatalogTransaction tx = store.begin()) {
                tx.insertManufacturer(manufacturer("Gibson"));
                tx.rollback();
            }

            assertEquals(0, store.snapshot().totalRows());
        }

        @Test
        @DisplayName("Closing an open transaction should roll it back")
        void testCloseRollsBack() {
            try (CatalogTransaction tx = store.begin()) {
                tx.insertManufacturer(manufacturer("Gibson"));
            }

            assertEquals(0, store.snapshot().totalRows());
        }

        @Test
        @DisplayName("A finished transaction should refuse further work")
        void testFinishedTransaction() {
            CatalogTransaction tx = store.begin();
            tx.commit();

            assertThrows(IllegalStateException.class, () -> tx.findManufacturerByName("Gibson"));
            assertThrows(IllegalStateException.class, tx::commit);
        }

        @Test
        @DisplayName("begin should wait for the open transaction to finish")
        void testSingleWriter() throws Exception {
            CatalogTransaction first = store.begin();
            CompletableFuture<CatalogTransaction> second = CompletableFuture.supplyAsync(store::begin);

            assertThrows(TimeoutException.class, () -> second.get(100, TimeUnit.MILLISECONDS));

            first.rollback();
            CatalogTransaction next = second.get(5, TimeUnit.SECONDS);
            assertTrue(next.isActive());
            next.close();
        }

        @Test
        @DisplayName("Should start from a seeded snapshot")
        void testSeeded() {
            Manufacturer gibson = manufacturer("Gibson");
            try (CatalogTransaction tx = store.begin()) {
                tx.insertManufacturer(gibson);
                tx.commit();
            }

            InMemoryCatalogStore copy = new InMemoryCatalogStore(store.snapshot());
            try (CatalogTransaction tx = copy.begin()) {
                assertTrue(tx.findManufacturerById(gibson.id()).isPresent());
            }
        }
    }

    @Nested
    @DisplayName("Savepoints")
    class SavepointTests {

        @Test
        @DisplayName("Rolling back to a savepoint should undo only later writes")
        void testRollbackToSavepoint() {
            try (CatalogTransaction tx = store.begin()) {
                tx.insertManufacturer(manufacturer("Gibson"));
                String savepoint = tx.setSavepoint();
                tx.insertManufacturer(manufacturer("Fender"));

                tx.rollbackToSavepoint(savepoint);
                tx.commit();
            }

            assertEquals(1, store.snapshot().count(CatalogTable.MANUFACTURERS));
            assertEquals("Gibson", store.snapshot().manufacturers().values().iterator().next().name());
        }

        @Test
        @DisplayName("Released savepoint should keep the writes made after it")
        void testRelease() {
            try (CatalogTransaction tx = store.begin()) {
                String savepoint = tx.setSavepoint();
                tx.insertManufacturer(manufacturer("Gibson"));
                tx.releaseSavepoint(savepoint);
                tx.commit();
            }

            assertEquals(1, store.snapshot().count(CatalogTable.MANUFACTURERS));
        }

        @Test
        @DisplayName("Released savepoint should no longer be available for rollback")
        void testReleaseAfterRollback() {
            try (CatalogTransaction tx = store.begin()) {
                String savepoint = tx.setSavepoint();
                tx.insertManufacturer(manufacturer("Gibson"));
                tx.rollbackToSavepoint(savepoint);
                tx.releaseSavepoint(savepoint);

                assertThrows(StorageException.class, () -> tx.rollbackToSavepoint(savepoint));
                tx.commit();
            }

            assertEquals(0, store.snapshot().count(CatalogTable.MANUFACTURERS));
        }

        @Test
        @DisplayName("Unknown savepoint should be a storage error")
        void testUnknownSavepoint() {
            try (CatalogTransaction tx = store.begin()) {
                assertThrows(StorageException.class, () -> tx.rollbackToSavepoint("sp_missing"));
            }
        }
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Name lookup should ignore case and see uncommitted writes")
        void testFindByName() {
            try (CatalogTransaction tx = store.begin()) {
                Manufacturer gibson = manufacturer("Gibson Guitar Corporation");
                tx.insertManufacturer(gibson);

                assertEquals(gibson.id(), tx.findManufacturerByName("GIBSON GUITAR CORPORATION").orElseThrow().id());
                assertTrue(tx.findManufacturerByName("Gibson").isEmpty());
            }
        }

        @Test
        @DisplayName("Serial lookup should compare normalized serial numbers")
        void testFindBySerial() {
            try (CatalogTransaction tx = store.begin()) {
                IndividualGuitar lucy = IndividualGuitar.builder()
                        .id(UUID.randomUUID())
                        .serialNumber("9-0824")
                        .significanceLevel(SignificanceLevel.HISTORIC)
                        .build();
                tx.insertGuitar(lucy);

                assertEquals(1, tx.findGuitarsBySerialNumber("90824").size());
                assertTrue(tx.findGuitarsBySerialNumber("90825").isEmpty());
            }
        }

        @Test
        @DisplayName("Duplicate ids and updates of missing rows should fail")
        void testIntegrity() {
            try (CatalogTransaction tx = store.begin()) {
                Manufacturer gibson = manufacturer("Gibson");
                tx.insertManufacturer(gibson);

                assertThrows(StorageException.class, () -> tx.insertManufacturer(gibson));
                assertThrows(StorageException.class, () -> tx.updateManufacturer(manufacturer("Fender")));
            }
        }
    }
}
