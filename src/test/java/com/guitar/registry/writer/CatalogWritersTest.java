package com.guitar.registry.writer;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.model.ProductionType;
import com.guitar.registry.core.model.SignificanceLevel;
import com.guitar.registry.core.model.SpecificationDetails;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.core.payload.ModelPayload;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.store.CatalogTable;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.InMemoryCatalogStore;
import com.guitar.registry.store.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Catalog writer Tests")
class CatalogWritersTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String CREATED_BY = "writer-test";

    private CatalogTransaction tx;
    private WriteStamp stamp;

    @BeforeEach
    void setUp() {
        tx = new InMemoryCatalogStore().begin();
        stamp = new WriteStamp(CREATED_BY, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        tx.close();
    }

    private static SpecificationDetails spec(String bodyWood, int frets) {
        return new SpecificationDetails(bodyWood, null, null, null, frets, null, null, null, null, null, null,
                null, null, null, null);
    }

    @Nested
    @DisplayName("ManufacturerWriter")
    class ManufacturerWriterTests {

        private ManufacturerWriter writer;

        @BeforeEach
        void setUp() {
            writer = new ManufacturerWriter(stamp);
        }

        @Test
        @DisplayName("Should insert with provenance and default status")
        void testInsert() {
            WriteOutcome outcome = writer.insert(tx, new ManufacturerPayload(" Fender ", null, "USA", 1946,
                    null, null, null));

            Manufacturer row = tx.findManufacturerById(outcome.entityId()).orElseThrow();
            assertEquals("Fender", row.name());
            assertEquals(ManufacturerStatus.ACTIVE, row.status());
            assertEquals(CREATED_BY, row.createdBy());
            assertEquals(NOW, row.createdAt());
            assertEquals(ResolutionAction.INSERT, outcome.action());
            assertEquals("Manufacturer insert", outcome.describe());
        }

        @Test
        @DisplayName("Should merge without losing stored values")
        void testMonotonicUpdate() {
            UUID id = writer.insert(tx, new ManufacturerPayload("Fender", null, "USA", null, null, null, null))
                    .entityId();

            WriteOutcome outcome = writer.update(tx, id, new ManufacturerPayload("FENDER", null, null, null,
                    "https://www.fender.com", null, null));

            Manufacturer row = tx.findManufacturerById(id).orElseThrow();
            assertEquals("Fender", row.name());
            assertEquals("USA", row.country());
            assertEquals("https://www.fender.com", row.website());
            assertEquals(List.of("website"), outcome.changedFields());
            assertEquals("Manufacturer update", outcome.describe());
        }

        @Test
        @DisplayName("Should fail to update a missing row")
        void testUpdateMissing() {
            assertThrows(StorageException.class, () -> writer.update(tx, UUID.randomUUID(),
                    new ManufacturerPayload("Fender", null, null, null, null, null, null)));
        }
    }

    @Nested
    @DisplayName("ModelWriter")
    class ModelWriterTests {

        private ModelWriter writer;
        private UUID gibsonId;

        @BeforeEach
        void setUp() {
            ReferenceResolver references = new ReferenceResolver(stamp);
            writer = new ModelWriter(stamp, references, new SpecificationWriter(stamp));
            gibsonId = new ManufacturerWriter(stamp).insert(tx,
                    new ManufacturerPayload("Gibson", null, null, null, null, null, null)).entityId();
        }

        private ModelPayload payload(String productLine, BigDecimal msrp, List<SpecificationDetails> specs) {
            return new ModelPayload("Gibson", productLine, "Les Paul Standard", 1959, null, null, null, null,
                    msrp, null, null, specs);
        }

        @Test
        @DisplayName("Should insert with defaults, product line and specifications")
        void testInsert() {
            WriteOutcome outcome = writer.insert(tx, gibsonId,
                    payload("Les Paul", null, List.of(spec("Mahogany", 22), spec("Maple", 22))));

            GuitarModel row = tx.findModelById(outcome.entityId()).orElseThrow();
            assertEquals(ProductionType.MASS, row.productionType());
            assertEquals("USD", row.currency());
            assertNotNull(row.productLineId());
            assertEquals(1, tx.count(CatalogTable.PRODUCT_LINES));
            assertEquals(2, outcome.specificationIds().size());
            assertEquals(2, tx.findSpecificationsForModel(row.id()).size());
        }

        @Test
        @DisplayName("Should reuse an existing product line case-insensitively")
        void testProductLineReuse() {
            writer.insert(tx, gibsonId, payload("Les Paul", null, null));
            writer.insert(tx, gibsonId, new ModelPayload("Gibson", "les paul", "Les Paul Custom", 1959,
                    null, null, null, null, null, null, null, null));

            assertEquals(1, tx.count(CatalogTable.PRODUCT_LINES));
        }

        @Test
        @DisplayName("Update should fill a missing product line and add no specifications")
        void testUpdate() {
            UUID id = writer.insert(tx, gibsonId, payload(null, null, null)).entityId();

            WriteOutcome outcome = writer.update(tx, id,
                    payload("Les Paul", new BigDecimal("247.50"), List.of(spec("Mahogany", 22))));

            GuitarModel row = tx.findModelById(id).orElseThrow();
            assertNotNull(row.productLineId());
            assertEquals(0, new BigDecimal("247.50").compareTo(row.msrpOriginal()));
            assertTrue(outcome.changedFields().contains("product_line_id"));
            assertTrue(outcome.changedFields().contains("msrp_original"));
            assertEquals(0, tx.count(CatalogTable.SPECIFICATIONS));
        }
    }

    @Nested
    @DisplayName("IndividualGuitarWriter")
    class IndividualGuitarWriterTests {

        private IndividualGuitarWriter writer;

        @BeforeEach
        void setUp() {
            writer = new IndividualGuitarWriter(stamp, new SpecificationWriter(stamp));
        }

        private IndividualGuitarPayload payload(String serial, String nickname, SignificanceLevel level) {
            return new IndividualGuitarPayload(null, "Gibson", "Les Paul", "1959", null, nickname, serial, null,
                    null, level, null, null, null, null, null, null, List.of(spec("Mahogany", 22)));
        }

        @Test
        @DisplayName("Should insert with notable significance by default")
        void testInsert() {
            WriteOutcome outcome = writer.insert(tx, payload("9-0824", null, null), null);

            IndividualGuitar row = tx.findGuitarById(outcome.entityId()).orElseThrow();
            assertEquals(SignificanceLevel.NOTABLE, row.significanceLevel());
            assertNull(row.modelId());
            assertEquals(1, tx.findSpecificationsForGuitar(row.id()).size());
            assertEquals(EntityKind.INDIVIDUAL_GUITAR, outcome.kind());
        }

        @Test
        @DisplayName("Update should keep the stored serial formatting and significance level")
        void testUpdateKeepsSerial() {
            UUID id = writer.insert(tx, payload("9-0824", null, SignificanceLevel.HISTORIC), null).entityId();

            WriteOutcome outcome = writer.update(tx, id, payload("090824", "Lucy", SignificanceLevel.RARE), null);

            IndividualGuitar row = tx.findGuitarById(id).orElseThrow();
            assertEquals("9-0824", row.serialNumber());
            assertEquals("Lucy", row.nickname());
            assertEquals(SignificanceLevel.HISTORIC, row.significanceLevel());
            assertEquals(List.of("nickname"), outcome.changedFields());
            assertEquals(1, tx.count(CatalogTable.SPECIFICATIONS));
        }

        @Test
        @DisplayName("Update should attach a newly resolved model")
        void testUpdateLinksModel() {
            UUID id = writer.insert(tx, payload("A100", null, null), null).entityId();
            UUID modelId = UUID.randomUUID();

            WriteOutcome outcome = writer.update(tx, id, payload(null, null, null), modelId);

            assertEquals(modelId, tx.findGuitarById(id).orElseThrow().modelId());
            assertEquals(List.of("model_id"), outcome.changedFields());
        }
    }
}
