package com.companya.scd.service;

import com.companya.scd.config.TableConfigurationResolver;
import com.companya.scd.engine.DeltaClassifier;
import com.companya.scd.engine.FingerprintEngine;
import com.companya.scd.engine.RunClock;
import com.companya.scd.engine.VersionMerger;
import com.companya.scd.exception.ErrorKind;
import com.companya.scd.exception.InvalidConfigurationException;
import com.companya.scd.exception.StorageUnavailableException;
import com.companya.scd.exception.TransactionConflictException;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.Delta;
import com.companya.scd.model.MergeResult;
import com.companya.scd.model.Outcome;
import com.companya.scd.model.RunContext;
import com.companya.scd.model.RunState;
import com.companya.scd.model.RunSummary;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.report.RunReporter;
import com.companya.scd.storage.StorageConnector;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunOrchestrator Tests")
class RunOrchestratorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 19, 9, 0, 0, 123456789);
    private static final TableConfiguration SALES = new TableConfiguration("sales", "sales_records",
            "sales_records_cdc", "id", List.of("product_name", "price"), false);

    @Mock
    private TableConfigurationResolver configurationResolver;

    @Mock
    private StorageConnector storage;

    @Mock
    private VersionMerger merger;

    @Mock
    private RunClock runClock;

    @Mock
    private RunReporter reporter;

    private RunOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(e -> e instanceof StorageUnavailableException)
                .build());
        orchestrator = new RunOrchestrator(configurationResolver, storage,
                new DeltaClassifier(new FingerprintEngine(), false), merger, runClock, retry, List.of(reporter));
    }

    @Nested
    @DisplayName("Successful passes")
    class SuccessfulPasses {

        @Test
        @DisplayName("Classifies, merges once and reports a COMMITTED summary at the truncated as-of")
        void commitsPass() {
            when(storage.fetchAll("sales_records")).thenReturn(List.of(record(1, "Laptop")));
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(new MergeResult(1, 0));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.status()).isEqualTo(RunState.COMMITTED);
            assertThat(summary.newCount()).isEqualTo(1);
            assertThat(summary.asOf()).isEqualTo(T0.withNano(123456000));
            assertThat(summary.keysByOutcome().get(Outcome.NEW)).containsExactly(BusinessKey.of(1));
            ArgumentCaptor<RunContext> context = ArgumentCaptor.forClass(RunContext.class);
            verify(merger).apply(any(Delta.class), context.capture());
            assertThat(context.getValue().asOf()).isEqualTo(summary.asOf());
            assertThat(context.getValue().runId()).isEqualTo(summary.runId());
            verify(reporter).report(summary);
            verifyNoInteractions(runClock);
        }

        @Test
        @DisplayName("Without an explicit as-of the run clock supplies it")
        void usesRunClock() {
            LocalDateTime issued = LocalDateTime.of(2026, 2, 1, 0, 0);
            when(runClock.nextAsOf("sales_records_cdc")).thenReturn(issued);
            when(storage.fetchAll("sales_records")).thenReturn(List.of());
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(MergeResult.EMPTY);

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.defaults());

            assertThat(summary.asOf()).isEqualTo(issued);
            assertThat(summary.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("An explicit as-of equal to the latest stored boundary is accepted")
        void asOfEqualToBoundaryAccepted() {
            when(storage.latestBoundary("sales_records_cdc")).thenReturn(Optional.of(T0.withNano(123456000)));
            when(storage.fetchAll("sales_records")).thenReturn(List.of());
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(MergeResult.EMPTY);

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.status()).isEqualTo(RunState.COMMITTED);
        }

        @Test
        @DisplayName("Dry run classifies but never merges")
        void dryRunSkipsMerge() {
            when(storage.fetchAll("sales_records")).thenReturn(List.of(record(1, "Laptop")));
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());

            RunSummary summary = orchestrator.runOnce(SALES, new RunOptions(T0, true));

            assertThat(summary.isSuccess()).isTrue();
            assertThat(summary.dryRun()).isTrue();
            assertThat(summary.newCount()).isEqualTo(1);
            verifyNoInteractions(merger);
        }

        @Test
        @DisplayName("Transient storage failures are retried within the bound")
        void retriesStorageUnavailable() {
            when(storage.fetchAll("sales_records"))
                    .thenThrow(new StorageUnavailableException("down", new RuntimeException()))
                    .thenReturn(List.of(record(1, "Laptop")));
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(new MergeResult(1, 0));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.isSuccess()).isTrue();
            verify(storage, times(2)).fetchAll("sales_records");
        }

        @Test
        @DisplayName("A failing reporter leaves the pass COMMITTED and adds a warning")
        void reporterFailureIsWarning() {
            when(storage.fetchAll("sales_records")).thenReturn(List.of());
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(MergeResult.EMPTY);
            doThrow(new IllegalStateException("disk full")).when(reporter).report(any());

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.status()).isEqualTo(RunState.COMMITTED);
            assertThat(summary.warnings()).singleElement().asString().contains("disk full");
        }
    }

    @Nested
    @DisplayName("Aborted passes")
    class AbortedPasses {

        @Test
        @DisplayName("Invalid configuration aborts before any storage access")
        void invalidConfiguration() {
            when(configurationResolver.resolve("broken")).thenThrow(new InvalidConfigurationException("bad key"));

            RunSummary summary = orchestrator.runOnce("broken", RunOptions.defaults());

            assertThat(summary.status()).isEqualTo(RunState.ABORTED);
            assertThat(summary.errorKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION);
            verifyNoInteractions(storage, merger, runClock);
            verify(reporter).report(summary);
        }

        @Test
        @DisplayName("A directly supplied invalid configuration is also rejected before storage access")
        void invalidDirectConfiguration() {
            TableConfiguration bad = new TableConfiguration("bad", "sales_records", "sales_records_cdc", "id",
                    List.of("id"), false);

            RunSummary summary = orchestrator.runOnce(bad, RunOptions.at(T0));

            assertThat(summary.errorKind()).isEqualTo(ErrorKind.INVALID_CONFIGURATION);
            verifyNoInteractions(storage, merger);
        }

        @Test
        @DisplayName("An explicit as-of earlier than stored history aborts before extraction")
        void backdatedAsOfAborts() {
            when(storage.latestBoundary("sales_records_cdc")).thenReturn(Optional.of(T0.plusDays(1)));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.status()).isEqualTo(RunState.ABORTED);
            assertThat(summary.errorKind()).isEqualTo(ErrorKind.INVARIANT_VIOLATION);
            verify(storage, never()).fetchAll(any());
            verifyNoInteractions(merger);
        }

        @Test
        @DisplayName("Duplicate source keys abort with DUPLICATE_KEY and never merge")
        void duplicateKeyAborts() {
            when(storage.fetchAll("sales_records")).thenReturn(List.of(record(1, "A"), record(1, "B")));
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.status()).isEqualTo(RunState.ABORTED);
            assertThat(summary.errorKind()).isEqualTo(ErrorKind.DUPLICATE_KEY);
            assertThat(summary.newCount()).isZero();
            verifyNoInteractions(merger);
        }

        @Test
        @DisplayName("Storage that stays down aborts with STORAGE_UNAVAILABLE after bounded retries")
        void storageStaysDown() {
            when(storage.fetchAll("sales_records"))
                    .thenThrow(new StorageUnavailableException("down", new RuntimeException()));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.errorKind()).isEqualTo(ErrorKind.STORAGE_UNAVAILABLE);
            verify(storage, times(3)).fetchAll("sales_records");
            verifyNoInteractions(merger);
        }

        @Test
        @DisplayName("Merge conflicts are fatal for the pass and not retried")
        void conflictNotRetried() {
            when(storage.fetchAll("sales_records")).thenReturn(List.of(record(1, "Laptop")));
            when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
            when(merger.apply(any(Delta.class), any(RunContext.class)))
                    .thenThrow(new TransactionConflictException("someone else wrote"));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.errorKind()).isEqualTo(ErrorKind.TRANSACTION_CONFLICT);
            verify(merger, times(1)).apply(any(Delta.class), any(RunContext.class));
        }

        @Test
        @DisplayName("Unexpected exceptions abort with INTERNAL")
        void unexpectedFailure() {
            when(storage.fetchAll("sales_records")).thenThrow(new IllegalStateException("boom"));

            RunSummary summary = orchestrator.runOnce(SALES, RunOptions.at(T0));

            assertThat(summary.errorKind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(summary.errorMessage()).isEqualTo("boom");
        }
    }

    @Test
    @DisplayName("runAll runs every table and keeps going after a failure")
    void runAllContinuesAfterFailure() {
        when(configurationResolver.tableNames()).thenReturn(List.of("broken", "sales"));
        when(configurationResolver.resolve("broken")).thenThrow(new InvalidConfigurationException("bad"));
        when(configurationResolver.resolve("sales")).thenReturn(SALES);
        when(runClock.nextAsOf("sales_records_cdc")).thenReturn(T0);
        when(storage.fetchAll("sales_records")).thenReturn(List.of());
        when(storage.fetchCurrent("sales_records_cdc", "id")).thenReturn(List.of());
        when(merger.apply(any(Delta.class), any(RunContext.class))).thenReturn(MergeResult.EMPTY);

        List<RunSummary> summaries = orchestrator.runAll();

        assertThat(summaries).extracting(RunSummary::status).containsExactly(RunState.ABORTED, RunState.COMMITTED);
    }

    private static SourceRecord record(int id, String name) {
        return SourceRecord.builder().put("id", id).put("product_name", name).put("price", 10).build();
    }
}
