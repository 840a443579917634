package com.companya.scd.service;

import java.time.LocalDateTime;

/**
 * Per-pass options.
 *
 * @param asOf   explicit as-of timestamp (backfills, tests); null lets the run clock decide
 * @param dryRun classify and report without writing to history
 */
public record RunOptions(LocalDateTime asOf, boolean dryRun) {

    public static RunOptions defaults() {
        return new RunOptions(null, false);
    }

    public static RunOptions at(LocalDateTime asOf) {
        return new RunOptions(asOf, false);
    }

    public static RunOptions dryRunOnly() {
        return new RunOptions(null, true);
    }
}
