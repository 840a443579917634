package com.companya.scd.model;

/**
 * Lifecycle of one pass. COMMITTED and ABORTED are terminal.
 */
public enum RunState {
    IDLE,
    EXTRACTING,
    CLASSIFYING,
    MERGING,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
