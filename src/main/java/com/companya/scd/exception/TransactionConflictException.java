package com.companya.scd.exception;

/**
 * The merge transaction could not be committed. Nothing from the pass is visible,
 * so the pass can be re-run from scratch.
 */
public class TransactionConflictException extends ScdException {

    public TransactionConflictException(String message) {
        super(ErrorKind.TRANSACTION_CONFLICT, message);
    }

    public TransactionConflictException(String message, Throwable cause) {
        super(ErrorKind.TRANSACTION_CONFLICT, message, cause);
    }
}
