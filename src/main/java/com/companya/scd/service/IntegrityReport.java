package com.companya.scd.service;

import java.util.List;

/**
 * Result of scanning a history table for temporal invariant violations.
 *
 * @param violations one human-readable line per offending key
 */
public record IntegrityReport(String table, int keysChecked, int versionsChecked, List<String> violations) {

    public IntegrityReport {
        violations = List.copyOf(violations);
    }

    public boolean isHealthy() {
        return violations.isEmpty();
    }
}
