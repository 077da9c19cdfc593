package com.guitar.registry.store;

/**
 * Unchecked wrapper for failures of the underlying catalog storage.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
