package com.companya.scd.model;

import com.companya.scd.exception.ErrorKind;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The single terminal outcome of a pass, handed to reporting sinks.
 *
 * @param keysByOutcome keys per outcome, for diagnostics; empty when the pass aborted before classifying
 * @param warnings      problems raised after commit (reporting failures); never affect {@code status}
 */
public record RunSummary(UUID runId,
                         String table,
                         LocalDateTime asOf,
                         RunState status,
                         boolean dryRun,
                         long newCount,
                         long changedCount,
                         long unchangedCount,
                         long removedCount,
                         Duration elapsed,
                         Map<Outcome, List<BusinessKey>> keysByOutcome,
                         ErrorKind errorKind,
                         String errorMessage,
                         List<String> warnings) {

    public RunSummary {
        keysByOutcome = keysByOutcome == null ? Map.of() : Map.copyOf(keysByOutcome);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RunSummary committed(RunContext context, Delta delta, boolean dryRun, Duration elapsed) {
        Map<Outcome, Long> counts = delta.counts();
        Map<Outcome, List<BusinessKey>> keys = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            keys.put(outcome, delta.byOutcome(outcome).stream().map(Classification::key).toList());
        }
        return new RunSummary(context.runId(), context.table().name(), context.asOf(), RunState.COMMITTED, dryRun,
                counts.get(Outcome.NEW), counts.get(Outcome.CHANGED), counts.get(Outcome.UNCHANGED),
                counts.get(Outcome.REMOVED), elapsed, keys, null, null, List.of());
    }

    public static RunSummary aborted(UUID runId, String table, LocalDateTime asOf, boolean dryRun, Duration elapsed,
                                     ErrorKind kind, String message) {
        return new RunSummary(runId, table, asOf, RunState.ABORTED, dryRun, 0, 0, 0, 0, elapsed,
                Map.of(), kind, message, List.of());
    }

    public boolean isSuccess() {
        return status == RunState.COMMITTED;
    }

    public long totalProcessed() {
        return newCount + changedCount + unchangedCount;
    }

    public RunSummary withWarnings(List<String> extraWarnings) {
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extraWarnings);
        return new RunSummary(runId, table, asOf, status, dryRun, newCount, changedCount, unchangedCount,
                removedCount, elapsed, keysByOutcome, errorKind, errorMessage, merged);
    }
}
