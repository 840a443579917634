package com.companya.scd.exception;

/**
 * Transient connectivity or locking failure reported by the storage layer.
 */
public class StorageUnavailableException extends ScdException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
