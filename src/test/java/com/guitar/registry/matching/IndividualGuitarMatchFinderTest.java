package com.guitar.registry.matching;

import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.SignificanceLevel;
import com.guitar.registry.core.payload.IndividualGuitarPayload;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.InMemoryCatalogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IndividualGuitarMatchFinder Tests")
class IndividualGuitarMatchFinderTest {

    private static final LocalDate PRODUCTION_DATE = LocalDate.of(1959, 8, 24);

    private CatalogTransaction tx;
    private IndividualGuitarMatchFinder finder;

    @BeforeEach
    void setUp() {
        tx = new InMemoryCatalogStore().begin();
        finder = new IndividualGuitarMatchFinder(0.5);
    }

    @AfterEach
    void tearDown() {
        tx.close();
    }

    private IndividualGuitar stored(IndividualGuitar.Builder builder) {
        IndividualGuitar guitar = builder
                .id(UUID.randomUUID())
                .significanceLevel(SignificanceLevel.NOTABLE)
                .build();
        tx.insertGuitar(guitar);
        return guitar;
    }

    private static IndividualGuitarPayload incoming(String manufacturerFallback, String modelFallback,
                                                    String yearEstimate, String serial, LocalDate productionDate) {
        return new IndividualGuitarPayload(null, manufacturerFallback, modelFallback, yearEstimate, null, null,
                serial, productionDate, null, null, null, null, null, null, null, null, null);
    }

    @Nested
    @DisplayName("Serial number tier")
    class SerialTests {

        @Test
        @DisplayName("Should match a differently formatted serial with score 1.0")
        void testSerialVariant() {
            IndividualGuitar existing = stored(IndividualGuitar.builder().serialNumber("9-0824"));

            List<MatchCandidate> candidates = finder.findCandidates(tx,
                    incoming(null, null, null, "090824", null), null);

            assertEquals(1, candidates.size());
            assertEquals(existing.id(), candidates.get(0).entityId());
            assertEquals(1.0, candidates.get(0).score(), 0.0001);
            assertEquals(MatchBasis.SERIAL_NUMBER, candidates.get(0).basis());
            assertEquals("serial 9-0824", candidates.get(0).label());
        }

        @Test
        @DisplayName("A serial hit should end the search")
        void testSerialShortCircuits() {
            UUID modelId = UUID.randomUUID();
            IndividualGuitar bySerial = stored(IndividualGuitar.builder().serialNumber("A100"));
            stored(IndividualGuitar.builder().modelId(modelId).productionDate(PRODUCTION_DATE));

            List<MatchCandidate> candidates = finder.findCandidates(tx,
                    incoming(null, null, null, "a-100", PRODUCTION_DATE), modelId);

            assertEquals(1, candidates.size());
            assertEquals(bySerial.id(), candidates.get(0).entityId());
        }
    }

    @Nested
    @DisplayName("Model tier")
    class ModelTests {

        @Test
        @DisplayName("Should score a shared model with equal production date")
        void testProductionDate() {
            UUID modelId = UUID.randomUUID();
            IndividualGuitar existing = stored(IndividualGuitar.builder().modelId(modelId)
                    .productionDate(PRODUCTION_DATE).nickname("Lucy"));

            List<MatchCandidate> candidates = finder.findCandidates(tx,
                    incoming(null, null, null, null, PRODUCTION_DATE), modelId);

            assertEquals(1, candidates.size());
            assertEquals(existing.id(), candidates.get(0).entityId());
            assertEquals(0.5, candidates.get(0).score(), 0.0001);
            assertEquals(MatchBasis.MODEL_REFERENCE, candidates.get(0).basis());
            assertEquals("Lucy", candidates.get(0).label());
        }

        @Test
        @DisplayName("A shared model alone should not reach the minimum")
        void testModelOnly() {
            UUID modelId = UUID.randomUUID();
            stored(IndividualGuitar.builder().modelId(modelId));

            assertTrue(finder.findCandidates(tx, incoming(null, null, null, null, null), modelId).isEmpty());
        }
    }

    @Nested
    @DisplayName("Fallback tier")
    class FallbackTests {

        @Test
        @DisplayName("Should score fallback manufacturer, model name and year estimate")
        void testFullFallback() {
            stored(IndividualGuitar.builder().manufacturerNameFallback("D'Angelico")
                    .modelNameFallback("New Yorker").yearEstimate("1940s"));

            List<MatchCandidate> candidates = finder.findCandidates(tx,
                    incoming("d'angelico", "new yorker", "1940s", null, null), null);

            assertEquals(1, candidates.size());
            assertEquals(1.0, candidates.get(0).score(), 0.0001);
            assertEquals(MatchBasis.FALLBACK_TEXT, candidates.get(0).basis());
        }

        @Test
        @DisplayName("Should narrow out guitars with a different fallback model name")
        void testNarrowing() {
            stored(IndividualGuitar.builder().manufacturerNameFallback("D'Angelico")
                    .modelNameFallback("Excel").yearEstimate("1940s"));

            assertTrue(finder.findCandidates(tx,
                    incoming("D'Angelico", "New Yorker", "1940s", null, null), null).isEmpty());
        }

        @Test
        @DisplayName("Should also consider guitars linked to a catalog model")
        void testLinkedGuitarsConsidered() {
            IndividualGuitar linked = stored(IndividualGuitar.builder().modelId(UUID.randomUUID())
                    .manufacturerNameFallback("D'Angelico").modelNameFallback("New Yorker"));

            List<MatchCandidate> candidates = finder.findCandidates(tx,
                    incoming("D'Angelico", "New Yorker", null, null, null), null);

            assertEquals(1, candidates.size());
            assertEquals(linked.id(), candidates.get(0).entityId());
            assertEquals(0.7, candidates.get(0).score(), 0.0001);
        }
    }
}
