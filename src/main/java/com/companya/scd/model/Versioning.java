package com.companya.scd.model;

import java.time.LocalDateTime;

/**
 * Column names and constants of the history table layout.
 */
public final class Versioning {

    /** Sentinel {@code valid_to} of a current version. */
    public static final LocalDateTime OPEN_END = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    public static final String ROW_HASH = "ROW_HASH";
    public static final String VALID_FROM = "VALID_FROM";
    public static final String VALID_TO = "VALID_TO";
    public static final String IS_CURRENT = "IS_CURRENT";

    private Versioning() {
    }

    public static boolean isMetadataColumn(String normalizedName) {
        return ROW_HASH.equals(normalizedName)
                || VALID_FROM.equals(normalizedName)
                || VALID_TO.equals(normalizedName)
                || IS_CURRENT.equals(normalizedName);
    }
}
