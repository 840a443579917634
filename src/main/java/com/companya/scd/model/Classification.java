package com.companya.scd.model;

/**
 * The classifier's verdict for one business key.
 *
 * @param source      the source record; null for {@link Outcome#REMOVED}
 * @param fingerprint fingerprint of the source record; null for {@link Outcome#REMOVED}
 * @param prior       the current version it was compared against; null for {@link Outcome#NEW}
 */
public record Classification(BusinessKey key,
                             Outcome outcome,
                             SourceRecord source,
                             Fingerprint fingerprint,
                             VersionRow prior) {

    public static Classification newKey(BusinessKey key, SourceRecord source, Fingerprint fingerprint) {
        return new Classification(key, Outcome.NEW, source, fingerprint, null);
    }

    public static Classification changed(BusinessKey key, SourceRecord source, Fingerprint fingerprint, VersionRow prior) {
        return new Classification(key, Outcome.CHANGED, source, fingerprint, prior);
    }

    public static Classification unchanged(BusinessKey key, SourceRecord source, Fingerprint fingerprint, VersionRow prior) {
        return new Classification(key, Outcome.UNCHANGED, source, fingerprint, prior);
    }

    public static Classification removed(VersionRow prior) {
        return new Classification(prior.key(), Outcome.REMOVED, null, null, prior);
    }
}
