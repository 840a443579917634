package com.companya.scd.service;

import com.companya.scd.config.TableConfigurationResolver;
import com.companya.scd.engine.DeltaClassifier;
import com.companya.scd.engine.RunClock;
import com.companya.scd.engine.VersionMerger;
import com.companya.scd.exception.ErrorKind;
import com.companya.scd.exception.InvariantViolationException;
import com.companya.scd.exception.ScdException;
import com.companya.scd.model.Delta;
import com.companya.scd.model.MergeResult;
import com.companya.scd.model.Outcome;
import com.companya.scd.model.RunContext;
import com.companya.scd.model.RunState;
import com.companya.scd.model.RunSummary;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.model.VersionRow;
import com.companya.scd.report.RunReporter;
import com.companya.scd.storage.StorageConnector;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives one SCD Type 2 pass per table.
 *
 * Flow: Validate -> Extract (source snapshot, current slice) -> Classify -> Merge -> Report.
 * Every pass ends in exactly one terminal state: COMMITTED with counts, or ABORTED with an
 * error kind and no applied mutations. This class is the single place where engine
 * failures are caught and turned into a summary.
 *
 * At most one pass may merge into a given history table at a time; concurrent passes
 * must be serialized by the caller (the scheduler runs tables sequentially).
 */
@Slf4j
@Service
public class RunOrchestrator {

    private final TableConfigurationResolver configurationResolver;
    private final StorageConnector storage;
    private final DeltaClassifier classifier;
    private final VersionMerger merger;
    private final RunClock runClock;
    private final Retry storageRetry;
    private final List<RunReporter> reporters;

    public RunOrchestrator(TableConfigurationResolver configurationResolver,
                           StorageConnector storage,
                           DeltaClassifier classifier,
                           VersionMerger merger,
                           RunClock runClock,
                           Retry storageRetry,
                           List<RunReporter> reporters) {
        this.configurationResolver = configurationResolver;
        this.storage = storage;
        this.classifier = classifier;
        this.merger = merger;
        this.runClock = runClock;
        this.storageRetry = storageRetry;
        this.reporters = reporters;
    }

    /**
     * Runs every configured table in turn. A failing table does not stop the others.
     */
    public List<RunSummary> runAll() {
        List<String> names = configurationResolver.tableNames();
        log.info("🚀 Starting SCD passes for {} table(s)", names.size());
        List<RunSummary> summaries = new ArrayList<>();
        for (String name : names) {
            summaries.add(runOnce(name, RunOptions.defaults()));
        }
        long failed = summaries.stream().filter(s -> !s.isSuccess()).count();
        log.info("✅ SCD passes finished: {} committed, {} aborted", summaries.size() - failed, failed);
        return summaries;
    }

    /**
     * Resolves the named table configuration and runs one pass. Configuration errors
     * produce an ABORTED summary before any storage access.
     */
    public RunSummary runOnce(String tableName, RunOptions options) {
        TableConfiguration table;
        try {
            table = configurationResolver.resolve(tableName);
        } catch (ScdException e) {
            log.error("Configuration for '{}' rejected: {}", tableName, e.getMessage());
            return report(RunSummary.aborted(UUID.randomUUID(), tableName, options.asOf(), options.dryRun(),
                    Duration.ZERO, e.getKind(), e.getMessage()));
        }
        return runOnce(table, options);
    }

    public RunSummary runOnce(TableConfiguration table, RunOptions options) {
        long started = System.nanoTime();
        PassTracker pass = new PassTracker(UUID.randomUUID(), table.name());
        LocalDateTime asOf = options.asOf() == null ? null : RunClock.truncate(options.asOf());
        RunSummary summary;
        try {
            TableConfigurationResolver.validate(table);
            if (asOf == null) {
                asOf = withRetry(() -> runClock.nextAsOf(table.historyTable()));
            } else {
                requireNotBeforeHistory(table, asOf);
            }
            RunContext context = new RunContext(pass.runId, asOf, table);
            log.info("🔄 SCD pass {} for '{}' ({} -> {}) as of {}",
                    pass.runId, table.name(), table.sourceTable(), table.historyTable(), asOf);

            pass.moveTo(RunState.EXTRACTING);
            List<SourceRecord> source = withRetry(() -> storage.fetchAll(table.sourceTable()));
            List<VersionRow> currentSlice = withRetry(() -> storage.fetchCurrent(table.historyTable(), table.businessKey()));
            log.info("📥 {} source records, {} current versions", source.size(), currentSlice.size());

            pass.moveTo(RunState.CLASSIFYING);
            Delta delta = classifier.classify(source, currentSlice, table);
            logClassification(table, delta);

            if (options.dryRun()) {
                log.info("Dry run: skipping merge into {}", table.historyTable());
            } else {
                pass.moveTo(RunState.MERGING);
                MergeResult result = withRetry(() -> merger.apply(delta, context));
                log.info("💾 Merged into {}: {} inserted, {} closed", table.historyTable(), result.inserted(), result.closed());
            }

            summary = RunSummary.committed(context, delta, options.dryRun(), elapsedSince(started));
            pass.moveTo(RunState.COMMITTED);
        } catch (ScdException e) {
            pass.moveTo(RunState.ABORTED);
            summary = RunSummary.aborted(pass.runId, table.name(), asOf, options.dryRun(), elapsedSince(started),
                    e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("💥 Unexpected failure in SCD pass {} for '{}'", pass.runId, table.name(), e);
            pass.moveTo(RunState.ABORTED);
            summary = RunSummary.aborted(pass.runId, table.name(), asOf, options.dryRun(), elapsedSince(started),
                    ErrorKind.INTERNAL, e.getMessage());
        }
        return report(summary);
    }

    /**
     * An explicit as-of may repeat the latest stored boundary (a rerun of the same pass)
     * but must not precede it, or a key that reappears after removal would get a version
     * overlapping its closed one.
     */
    private void requireNotBeforeHistory(TableConfiguration table, LocalDateTime asOf) {
        Optional<LocalDateTime> boundary = withRetry(() -> storage.latestBoundary(table.historyTable()));
        if (boundary.isPresent() && asOf.isBefore(boundary.get())) {
            throw new InvariantViolationException("As-of " + asOf + " precedes the latest boundary "
                    + boundary.get() + " already stored in " + table.historyTable());
        }
    }

    private void logClassification(TableConfiguration table, Delta delta) {
        Map<Outcome, Long> counts = delta.counts();
        log.info("🔍 Classified: {} new, {} changed, {} unchanged, {} removed",
                counts.get(Outcome.NEW), counts.get(Outcome.CHANGED),
                counts.get(Outcome.UNCHANGED), counts.get(Outcome.REMOVED));
        delta.items().forEach(item -> {
            if (item.outcome() == Outcome.REMOVED) {
                log.warn("[REMOVED] {}={} no longer present in {}", table.businessKey(), item.key(), table.sourceTable());
            } else if (item.outcome() != Outcome.UNCHANGED) {
                log.debug("[{}] {}={}", item.outcome(), table.businessKey(), item.key());
            }
        });
    }

    /**
     * Hands the summary to every reporter. Reporter failures happen after the merge
     * committed, so they are recorded as warnings rather than changing the outcome.
     */
    private RunSummary report(RunSummary summary) {
        List<String> warnings = new ArrayList<>();
        for (RunReporter reporter : reporters) {
            try {
                reporter.report(summary);
            } catch (RuntimeException e) {
                log.warn("⚠️ Reporter {} failed for run {}: {}", reporter.getClass().getSimpleName(),
                        summary.runId(), e.getMessage(), e);
                warnings.add(reporter.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        return warnings.isEmpty() ? summary : summary.withWarnings(warnings);
    }

    private <T> T withRetry(Supplier<T> step) {
        return storageRetry.executeSupplier(step);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    /**
     * Tracks and logs the state machine of a single pass.
     */
    private static final class PassTracker {

        private final UUID runId;
        private final String table;
        private RunState state = RunState.IDLE;

        private PassTracker(UUID runId, String table) {
            this.runId = runId;
            this.table = table;
        }

        private void moveTo(RunState next) {
            if (state.isTerminal()) {
                throw new IllegalStateException("Pass " + runId + " already " + state);
            }
            if (next == RunState.ABORTED) {
                log.error("SCD pass {} for '{}' aborted while {}", runId, table, state);
            } else {
                log.debug("SCD pass {} for '{}': {} -> {}", runId, table, state, next);
            }
            state = next;
        }
    }
}
