package com.companya.scd.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code scd.*} section of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "scd")
public class ScdProperties {

    private List<TableProperties> tables = new ArrayList<>();

    private boolean runOnStartup = false;

    private Schedule schedule = new Schedule();

    private RetryProperties retry = new RetryProperties();

    @Data
    public static class TableProperties {
        /** Logical name used by the scheduler, the REST trigger and the run log. Defaults to the source table. */
        private String name;
        private String sourceTable;
        /** Defaults to {@code <sourceTable>_cdc}. */
        private String historyTable;
        private String businessKey;
        private List<String> monitoredAttributes = new ArrayList<>();
        private Boolean detectRemoved;
        /** Optional JSON metadata file ({@code primary_key}, {@code changing_attributes}, {@code detect_removed}). */
        private String metadataFile;

        public String resolvedName() {
            return name != null && !name.isBlank() ? name : sourceTable;
        }
    }

    @Data
    public static class Schedule {
        /** Spring cron expression; "-" disables scheduled passes. */
        private String cron = "-";
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration wait = Duration.ofSeconds(2);
    }
}
