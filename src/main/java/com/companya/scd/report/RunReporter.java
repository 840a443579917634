package com.companya.scd.report;

import com.companya.scd.model.RunSummary;

/**
 * Receives the terminal summary of every pass. Reporters have no influence on the
 * outcome: a reporter that throws is logged and recorded as a warning on the summary.
 */
public interface RunReporter {

    void report(RunSummary summary);
}
