package com.companya.scd.model;

import java.time.LocalDateTime;

/**
 * One stored version of an entity in a history table.
 *
 * @param key         business key of the entity
 * @param attributes  business attributes as of this version (metadata columns excluded)
 * @param fingerprint stored {@code row_hash}
 * @param validFrom   inclusive start of validity
 * @param validTo     exclusive end of validity, {@link Versioning#OPEN_END} while current
 * @param current     the {@code is_current} flag
 */
public record VersionRow(BusinessKey key,
                         SourceRecord attributes,
                         Fingerprint fingerprint,
                         LocalDateTime validFrom,
                         LocalDateTime validTo,
                         boolean current) {

    public boolean contains(LocalDateTime pointInTime) {
        return !pointInTime.isBefore(validFrom) && pointInTime.isBefore(validTo);
    }
}
