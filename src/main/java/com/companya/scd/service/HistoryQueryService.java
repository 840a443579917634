package com.companya.scd.service;

import com.companya.scd.config.TableConfigurationResolver;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.model.VersionRow;
import com.companya.scd.storage.StorageConnector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over history tables: lineage of one key, point-in-time lookup,
 * and a full scan for interval and current-row invariants.
 *
 * The scan cannot tell a removal gap from any other gap. A history row does not record
 * why it was closed, so a close-out without a version starting at the same instant
 * reads as a removal. Gaps are therefore never reported; only overlaps, empty
 * intervals and misplaced or duplicate current versions are.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryQueryService {

    private final TableConfigurationResolver configurationResolver;
    private final StorageConnector storage;

    public List<VersionRow> versionsOf(String tableName, BusinessKey key) {
        TableConfiguration table = configurationResolver.resolve(tableName);
        return storage.fetchVersions(table.historyTable(), table.businessKey(), key);
    }

    public Optional<VersionRow> asOf(String tableName, BusinessKey key, LocalDateTime pointInTime) {
        TableConfiguration table = configurationResolver.resolve(tableName);
        return storage.fetchAsOf(table.historyTable(), table.businessKey(), key, pointInTime);
    }

    public IntegrityReport verifyIntegrity(String tableName) {
        TableConfiguration table = configurationResolver.resolve(tableName);
        List<VersionRow> rows = storage.fetchAllVersions(table.historyTable(), table.businessKey());

        Map<BusinessKey, List<VersionRow>> byKey = new LinkedHashMap<>();
        rows.forEach(row -> byKey.computeIfAbsent(row.key(), k -> new ArrayList<>()).add(row));

        List<String> violations = new ArrayList<>();
        byKey.forEach((key, versions) -> violations.addAll(check(key, versions)));

        if (!violations.isEmpty()) {
            log.warn("⚠️ {} integrity violation(s) in {}", violations.size(), table.historyTable());
        }
        return new IntegrityReport(table.historyTable(), byKey.size(), rows.size(), violations);
    }

    /**
     * Versions arrive ordered by valid_from. A gap between a closed version and the next
     * one is the period during which the key was removed from the source; an overlap is
     * always a violation.
     */
    static List<String> check(BusinessKey key, List<VersionRow> versions) {
        List<String> violations = new ArrayList<>();
        long current = versions.stream().filter(VersionRow::current).count();
        if (current > 1) {
            violations.add("key " + key + ": " + current + " current versions");
        }
        for (int i = 0; i < versions.size(); i++) {
            VersionRow row = versions.get(i);
            if (!row.validFrom().isBefore(row.validTo())) {
                violations.add("key " + key + ": empty interval starting " + row.validFrom());
            }
            if (i + 1 < versions.size()) {
                VersionRow next = versions.get(i + 1);
                if (row.current()) {
                    violations.add("key " + key + ": current version from " + row.validFrom() + " is not the latest");
                } else if (next.validFrom().isBefore(row.validTo())) {
                    violations.add("key " + key + ": interval ending " + row.validTo()
                            + " overlaps next version starting " + next.validFrom());
                }
            }
        }
        return violations;
    }
}
