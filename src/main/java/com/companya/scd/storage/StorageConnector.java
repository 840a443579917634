package com.companya.scd.storage;

import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.Fingerprint;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.VersionRow;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Synchronous access to a source table and its versioned history table.
 *
 * Write operations do not manage transactions themselves; they join whatever
 * transaction the caller has open (see {@code VersionMerger}).
 * Implementations report transient failures as
 * {@link com.companya.scd.exception.StorageUnavailableException}.
 */
public interface StorageConnector {

    /**
     * Every row of the source table, in the order the database returns them.
     */
    List<SourceRecord> fetchAll(String sourceTable);

    /**
     * Rows of the history table flagged {@code is_current}. Duplicates are returned
     * as found so the caller can detect them.
     */
    List<VersionRow> fetchCurrent(String historyTable, String businessKey);

    /**
     * Closes the current version of {@code key}.
     *
     * @return number of rows updated; exactly 1 when the single-writer assumption holds
     */
    int closeOut(String historyTable, String businessKey, BusinessKey key, LocalDateTime asOf);

    void insertVersion(String historyTable, SourceRecord record, Fingerprint fingerprint,
                       LocalDateTime validFrom, LocalDateTime validTo);

    /**
     * Latest {@code valid_from} or closed {@code valid_to} in the history table.
     */
    Optional<LocalDateTime> latestBoundary(String historyTable);

    /**
     * All versions of a key ordered by {@code valid_from}.
     */
    List<VersionRow> fetchVersions(String historyTable, String businessKey, BusinessKey key);

    /**
     * All versions in the table ordered by key and {@code valid_from}.
     */
    List<VersionRow> fetchAllVersions(String historyTable, String businessKey);

    Optional<VersionRow> fetchAsOf(String historyTable, String businessKey, BusinessKey key, LocalDateTime pointInTime);
}
