package com.guitar.registry.matching;

import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.payload.ManufacturerPayload;
import com.guitar.registry.similarity.NameSimilarity;
import com.guitar.registry.store.CatalogTransaction;
import com.guitar.registry.store.InMemoryCatalogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ManufacturerMatchFinderTest {

    private CatalogTransaction tx;
    private ManufacturerMatchFinder finder;

    @BeforeEach
    void setUp() {
        tx = new InMemoryCatalogStore().begin();
        finder = new ManufacturerMatchFinder(new NameSimilarity(), 0.7);
    }

    @AfterEach
    void tearDown() {
        tx.close();
    }

    private Manufacturer stored(String name, String country, Integer foundedYear, ManufacturerStatus status) {
        Manufacturer manufacturer = Manufacturer.builder()
                .id(UUID.randomUUID())
                .name(name)
                .country(country)
                .foundedYear(foundedYear)
                .status(status)
                .build();
        tx.insertManufacturer(manufacturer);
        return manufacturer;
    }

    private static ManufacturerPayload incoming(String name, String country, Integer foundedYear) {
        return new ManufacturerPayload(name, null, country, foundedYear, null, null, null);
    }

    @Test
    @DisplayName("Should score an exact name match at 1.0")
    void testExactName() {
        Manufacturer gibson = stored("Gibson Guitar Corporation", null, null, ManufacturerStatus.ACTIVE);

        List<MatchCandidate> candidates = finder.findCandidates(tx, incoming("gibson guitar corporation", null, null));

        assertEquals(1, candidates.size());
        assertEquals(gibson.id(), candidates.get(0).entityId());
        assertEquals(1.0, candidates.get(0).score(), 0.0001);
        assertEquals(MatchBasis.NAME, candidates.get(0).basis());
        assertEquals("Gibson Guitar Corporation", candidates.get(0).label());
    }

    @Test
    @DisplayName("Should add bonuses for matching country and founded year")
    void testBonuses() {
        stored("Gibson Guitar Corporation", "usa", 1902, ManufacturerStatus.ACTIVE);

        List<MatchCandidate> candidates = finder.findCandidates(tx, incoming("Gibson Guitar Corp", "USA", 1902));

        assertEquals(1, candidates.size());
        assertEquals(36.0 / 43.0 + 0.2, candidates.get(0).score(), 0.0001);
    }

    @Test
    @DisplayName("Should not clamp the score above 1.0")
    void testNoClamp() {
        stored("Fender", "USA", 1946, ManufacturerStatus.ACTIVE);

        List<MatchCandidate> candidates = finder.findCandidates(tx, incoming("Fender", "USA", 1946));

        assertEquals(1.2, candidates.get(0).score(), 0.0001);
    }

    @Test
    @DisplayName("Should drop candidates below the minimum score")
    void testMinimumScore() {
        stored("Rickenbacker", null, null, ManufacturerStatus.ACTIVE);

        assertTrue(finder.findCandidates(tx, incoming("Gretsch", null, null)).isEmpty());
    }

    @Test
    @DisplayName("Should never offer a defunct manufacturer")
    void testDefunctExcluded() {
        stored("Kay Musical Instrument Company", null, null, ManufacturerStatus.DEFUNCT);

        assertTrue(finder.findCandidates(tx, incoming("Kay Musical Instrument Company", null, null)).isEmpty());
    }

    @Test
    @DisplayName("Should order candidates best first")
    void testOrdering() {
        stored("Gibsons", null, null, ManufacturerStatus.ACTIVE);
        Manufacturer exact = stored("Gibson", null, null, ManufacturerStatus.ACTIVE);

        List<MatchCandidate> candidates = finder.findCandidates(tx, incoming("Gibson", null, null));

        assertEquals(2, candidates.size());
        assertEquals(exact.id(), candidates.get(0).entityId());
        assertTrue(candidates.get(0).score() > candidates.get(1).score());
    }
}
