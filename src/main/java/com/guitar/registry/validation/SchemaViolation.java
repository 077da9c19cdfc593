package com.guitar.registry.validation;

/**
 * A single violated constraint.
 *
 * @param path    dotted location of the offending value, e.g. {@code model.specifications[1].num_frets}
 * @param message what is wrong with it
 */
public record SchemaViolation(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
