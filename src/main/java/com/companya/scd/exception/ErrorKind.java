package com.companya.scd.exception;

/**
 * Terminal failure categories a pass can end with.
 */
public enum ErrorKind {
    INVALID_CONFIGURATION,
    MISSING_ATTRIBUTE,
    DUPLICATE_KEY,
    INVARIANT_VIOLATION,
    STORAGE_UNAVAILABLE,
    TRANSACTION_CONFLICT,
    INTERNAL
}
