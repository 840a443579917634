package com.companya.scd.model;

import java.util.List;

/**
 * Validated, immutable configuration of one source/history table pair.
 * Instances are produced by {@code TableConfigurationResolver}.
 */
public record TableConfiguration(String name,
                                 String sourceTable,
                                 String historyTable,
                                 String businessKey,
                                 List<String> monitoredAttributes,
                                 boolean detectRemoved) {

    public TableConfiguration {
        monitoredAttributes = List.copyOf(monitoredAttributes);
    }
}
