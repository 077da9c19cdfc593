package com.guitar.registry.store;

/**
 * The five catalog tables.
 */
public enum CatalogTable {
    MANUFACTURERS("manufacturers"),
    PRODUCT_LINES("product_lines"),
    MODELS("models"),
    SPECIFICATIONS("specifications"),
    INDIVIDUAL_GUITARS("individual_guitars");

    private final String tableName;

    CatalogTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
