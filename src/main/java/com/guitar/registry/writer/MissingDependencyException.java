package com.guitar.registry.writer;

import com.guitar.registry.core.IngestionException;
import com.guitar.registry.core.model.FailureKind;
import com.guitar.registry.core.payload.ModelReference;

/**
 * Thrown when a submission names an entity that does not exist, e.g. a model whose
 * manufacturer is not in the catalog.
 */
public class MissingDependencyException extends IngestionException {

    public MissingDependencyException(String message) {
        super(message);
    }

    public static MissingDependencyException manufacturer(String name) {
        return new MissingDependencyException("Manufacturer '" + name + "' not found");
    }

    public static MissingDependencyException model(ModelReference reference) {
        return new MissingDependencyException("Model '" + reference.modelName() + "' (" + reference.year()
                + ") by '" + reference.manufacturerName() + "' not found");
    }

    @Override
    public FailureKind kind() {
        return FailureKind.MISSING_DEPENDENCY;
    }
}
