package com.companya.scd.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hex-encoded digest of a record's monitored attributes, stored as {@code row_hash}.
 */
public record Fingerprint(String hex) {

    public Fingerprint {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Fingerprint must not be blank");
        }
    }

    @Override
    @JsonValue
    public String hex() {
        return hex;
    }

    @Override
    public String toString() {
        return hex;
    }
}
