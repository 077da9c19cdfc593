package com.guitar.registry.store;

/**
 * Transactional access to the catalog.
 */
public interface CatalogStore extends AutoCloseable {

    /**
     * Opens a new transaction. The caller must commit, roll back or close it.
     *
     * @throws StorageException if the transaction cannot be opened
     */
    CatalogTransaction begin();

    /**
     * Releases resources held by the store.
     */
    @Override
    default void close() {
    }
}
