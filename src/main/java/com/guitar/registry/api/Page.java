package com.guitar.registry.api;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param totalElements size of the whole listing
 * @param pageNumber    0-based
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int numberOfElements() {
        return content.size();
    }
}
