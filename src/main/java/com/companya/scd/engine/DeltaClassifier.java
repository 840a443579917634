package com.companya.scd.engine;

import com.companya.scd.exception.DuplicateKeyException;
import com.companya.scd.exception.InvariantViolationException;
import com.companya.scd.exception.MissingAttributeException;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.Classification;
import com.companya.scd.model.Delta;
import com.companya.scd.model.Fingerprint;
import com.companya.scd.model.ScalarValue;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.model.VersionRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Compares a source snapshot with the current slice of a history table.
 *
 * The classifier has no state of its own: the same snapshot and slice always produce
 * the same {@link Delta}. It only ever sees current rows, so the caller must not hand
 * it superseded versions.
 */
@Slf4j
@Component
public class DeltaClassifier {

    private final FingerprintEngine fingerprintEngine;
    private final boolean parallel;

    public DeltaClassifier(FingerprintEngine fingerprintEngine,
                           @Value("${scd.classifier.parallel:false}") boolean parallel) {
        this.fingerprintEngine = fingerprintEngine;
        this.parallel = parallel;
    }

    public Delta classify(List<SourceRecord> sourceRecords, List<VersionRow> currentSlice, TableConfiguration config) {
        Map<BusinessKey, VersionRow> current = indexCurrentSlice(currentSlice);
        List<BusinessKey> sourceKeys = extractUniqueKeys(sourceRecords, config.businessKey());

        // fingerprinting is per-record and side-effect free
        Stream<Integer> indexes = Stream.iterate(0, i -> i + 1).limit(sourceRecords.size());
        List<Classification> items = new ArrayList<>((parallel ? indexes.parallel() : indexes)
                .map(i -> classifyOne(sourceKeys.get(i), sourceRecords.get(i), current, config))
                .toList());

        if (config.detectRemoved()) {
            Set<BusinessKey> seen = new HashSet<>(sourceKeys);
            current.forEach((key, row) -> {
                if (!seen.contains(key)) {
                    log.debug("Key {} missing from source snapshot of {}", key, config.sourceTable());
                    items.add(Classification.removed(row));
                }
            });
        }
        return new Delta(items);
    }

    private Classification classifyOne(BusinessKey key,
                                       SourceRecord record,
                                       Map<BusinessKey, VersionRow> current,
                                       TableConfiguration config) {
        Fingerprint fingerprint = fingerprintEngine.fingerprint(record, config.monitoredAttributes());
        VersionRow prior = current.get(key);
        if (prior == null) {
            return Classification.newKey(key, record, fingerprint);
        }
        if (!prior.fingerprint().equals(fingerprint)) {
            return Classification.changed(key, record, fingerprint, prior);
        }
        return Classification.unchanged(key, record, fingerprint, prior);
    }

    private Map<BusinessKey, VersionRow> indexCurrentSlice(List<VersionRow> currentSlice) {
        Map<BusinessKey, VersionRow> current = new LinkedHashMap<>();
        for (VersionRow row : currentSlice) {
            if (!row.current()) {
                throw new InvariantViolationException(
                        "Current slice contains a superseded version of key " + row.key() + " valid from " + row.validFrom());
            }
            if (current.putIfAbsent(row.key(), row) != null) {
                throw new InvariantViolationException("History holds more than one current version of key " + row.key());
            }
        }
        return current;
    }

    private List<BusinessKey> extractUniqueKeys(List<SourceRecord> sourceRecords, String businessKey) {
        List<BusinessKey> keys = new ArrayList<>(sourceRecords.size());
        Set<BusinessKey> seen = new HashSet<>();
        for (SourceRecord record : sourceRecords) {
            ScalarValue value = record.get(businessKey);
            if (value.isNull()) {
                throw new MissingAttributeException(businessKey, "Source record has a null business key '" + businessKey + "'");
            }
            BusinessKey key = new BusinessKey(value);
            if (!seen.add(key)) {
                throw new DuplicateKeyException(key.toString());
            }
            keys.add(key);
        }
        return keys;
    }
}
