package com.guitar.registry.store;

import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ProductLine;
import com.guitar.registry.core.model.Specification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable view of the catalog contents at one point in time, keyed by id in insertion order.
 */
public record CatalogSnapshot(
        Map<UUID, Manufacturer> manufacturers,
        Map<UUID, ProductLine> productLines,
        Map<UUID, GuitarModel> models,
        Map<UUID, Specification> specifications,
        Map<UUID, IndividualGuitar> guitars
) {
    public CatalogSnapshot {
        manufacturers = freeze(manufacturers);
        productLines = freeze(productLines);
        models = freeze(models);
        specifications = freeze(specifications);
        guitars = freeze(guitars);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public long count(CatalogTable table) {
        return switch (table) {
            case MANUFACTURERS -> manufacturers.size();
            case PRODUCT_LINES -> productLines.size();
            case MODELS -> models.size();
            case SPECIFICATIONS -> specifications.size();
            case INDIVIDUAL_GUITARS -> guitars.size();
        };
    }

    public long totalRows() {
        long total = 0;
        for (CatalogTable table : CatalogTable.values()) {
            total += count(table);
        }
        return total;
    }

    private static <V> Map<UUID, V> freeze(Map<UUID, V> rows) {
        return rows != null ? Collections.unmodifiableMap(new LinkedHashMap<>(rows)) : Map.of();
    }
}
