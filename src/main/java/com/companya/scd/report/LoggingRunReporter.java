package com.companya.scd.report;

import com.companya.scd.model.Outcome;
import com.companya.scd.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes the end-of-pass report to the application log.
 */
@Slf4j
@Order(0)
@Component
public class LoggingRunReporter implements RunReporter {

    private static final String RULE = "=".repeat(60);

    @Override
    public void report(RunSummary summary) {
        if (!summary.isSuccess()) {
            log.error("❌ SCD pass {} for '{}' aborted with {}: {}",
                    summary.runId(), summary.table(), summary.errorKind(), summary.errorMessage());
            return;
        }
        log.info(RULE);
        log.info("SCD Type 2 pass complete{}: {}", summary.dryRun() ? " (dry run)" : "", summary.table());
        log.info(RULE);
        log.info("📊 Processing Summary:");
        log.info("   • New Records:       {}", summary.newCount());
        log.info("   • Changed Records:   {}", summary.changedCount());
        log.info("   • Unchanged Records: {}", summary.unchangedCount());
        log.info("   • Removed Records:   {}", summary.removedCount());
        log.info("   • Total Processed:   {}", summary.totalProcessed());
        log.info("   • As Of:             {}", summary.asOf());
        log.info("   • Elapsed:           {} ms", summary.elapsed().toMillis());
        log.info(RULE);
        if (log.isDebugEnabled()) {
            for (Outcome outcome : Outcome.values()) {
                log.debug("   {} keys: {}", outcome, summary.keysByOutcome().getOrDefault(outcome, List.of()));
            }
        }
    }
}
