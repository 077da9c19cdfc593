package com.guitar.registry.core;

import com.guitar.registry.core.model.FailureKind;

/**
 * Base class for failures that stop a single submission.
 * Each subclass maps to the {@link FailureKind} reported in the submission result.
 */
public abstract class IngestionException extends RuntimeException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the failure category reported to callers.
     */
    public abstract FailureKind kind();
}
