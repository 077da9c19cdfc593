package com.guitar.registry.writer;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Supplies provenance for written rows: the {@code created_by} tag, timestamps and new ids.
 */
public class WriteStamp {

    private final String createdBy;
    private final Clock clock;

    public WriteStamp(String createdBy, Clock clock) {
        this.createdBy = Objects.requireNonNull(createdBy, "createdBy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public String createdBy() {
        return createdBy;
    }

    public Instant now() {
        return clock.instant();
    }

    public UUID newId() {
        return UUID.randomUUID();
    }
}
