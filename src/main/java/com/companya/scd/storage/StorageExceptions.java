package com.companya.scd.storage;

import com.companya.scd.exception.ScdException;
import com.companya.scd.exception.StorageUnavailableException;
import com.companya.scd.exception.TransactionConflictException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionSystemException;

/**
 * Maps Spring data-access failures onto the engine's error taxonomy.
 */
public final class StorageExceptions {

    private StorageExceptions() {
    }

    /**
     * Translation for reads: lock and connectivity problems are transient.
     */
    public static RuntimeException translateRead(String operation, RuntimeException ex) {
        if (ex instanceof ScdException) {
            return ex;
        }
        if (isTransient(ex)) {
            return new StorageUnavailableException("Storage unavailable while trying to " + operation, ex);
        }
        return ex;
    }

    /**
     * Translation for the merge transaction: anything that means another writer got
     * there first is a conflict; connectivity problems stay retryable.
     */
    public static RuntimeException translateMerge(String operation, RuntimeException ex) {
        if (ex instanceof ScdException) {
            return ex;
        }
        if (ex instanceof ConcurrencyFailureException || ex instanceof DuplicateKeyException
                || ex instanceof TransactionSystemException) {
            return new TransactionConflictException("Could not commit while trying to " + operation, ex);
        }
        if (isTransient(ex) || ex instanceof CannotCreateTransactionException) {
            return new StorageUnavailableException("Storage unavailable while trying to " + operation, ex);
        }
        return ex;
    }

    private static boolean isTransient(RuntimeException ex) {
        return ex instanceof TransientDataAccessException
                || ex instanceof DataAccessResourceFailureException
                || ex instanceof RecoverableDataAccessException;
    }
}
