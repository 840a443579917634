package com.companya.scd.report;

import com.companya.scd.model.Outcome;
import com.companya.scd.model.RunSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Publishes pass outcomes as Micrometer meters.
 */
@Order(1)
@Component
public class MetricsRunReporter implements RunReporter {

    static final String VERSIONS = "scd.versions";
    static final String RUNS = "scd.runs";
    static final String DURATION = "scd.run.duration";

    private final MeterRegistry meterRegistry;

    public MetricsRunReporter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void report(RunSummary summary) {
        meterRegistry.counter(RUNS, "table", summary.table(), "status", summary.status().name()).increment();
        Timer.builder(DURATION)
                .tag("table", summary.table())
                .register(meterRegistry)
                .record(summary.elapsed());
        if (!summary.isSuccess() || summary.dryRun()) {
            return;
        }
        Map<Outcome, Long> counts = Map.of(
                Outcome.NEW, summary.newCount(),
                Outcome.CHANGED, summary.changedCount(),
                Outcome.UNCHANGED, summary.unchangedCount(),
                Outcome.REMOVED, summary.removedCount());
        counts.forEach((outcome, count) -> meterRegistry
                .counter(VERSIONS, "table", summary.table(), "outcome", outcome.name().toLowerCase(Locale.ROOT))
                .increment(count));
    }
}
