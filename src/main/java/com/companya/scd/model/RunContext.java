package com.companya.scd.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Values shared by every mutation of one pass. All rows closed or opened in the pass
 * carry {@link #asOf()} as their boundary, so a point-in-time read sees a consistent cut.
 */
public record RunContext(UUID runId, LocalDateTime asOf, TableConfiguration table) {

    public static RunContext of(LocalDateTime asOf, TableConfiguration table) {
        return new RunContext(UUID.randomUUID(), asOf, table);
    }
}
