package com.companya.scd.report;

import com.companya.scd.model.RunSummary;
import com.companya.scd.model.domain.ScdRunLog;
import com.companya.scd.repository.ScdRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Persists every pass to {@code SCD_RUN_LOG}.
 */
@Slf4j
@Order(2)
@Component
@RequiredArgsConstructor
public class RunLogReporter implements RunReporter {

    private static final int MAX_MESSAGE = 2000;

    private final ScdRunLogRepository runLogRepository;
    private final Clock clock;

    @Override
    public void report(RunSummary summary) {
        ScdRunLog entry = new ScdRunLog();
        entry.setRunId(summary.runId().toString());
        entry.setTableName(summary.table());
        entry.setAsOf(summary.asOf());
        entry.setStatus(summary.status().name());
        entry.setDryRun(summary.dryRun());
        entry.setNewCount(summary.newCount());
        entry.setChangedCount(summary.changedCount());
        entry.setUnchangedCount(summary.unchangedCount());
        entry.setRemovedCount(summary.removedCount());
        entry.setElapsedMillis(summary.elapsed().toMillis());
        if (summary.errorKind() != null) {
            entry.setErrorKind(summary.errorKind().name());
        }
        if (summary.errorMessage() != null) {
            String message = summary.errorMessage();
            entry.setErrorMessage(message.length() > MAX_MESSAGE ? message.substring(0, MAX_MESSAGE) : message);
        }
        entry.setRecordedAt(LocalDateTime.now(clock));
        runLogRepository.save(entry);
        log.debug("Recorded run log {}", entry);
    }
}
