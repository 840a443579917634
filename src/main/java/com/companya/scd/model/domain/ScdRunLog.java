package com.companya.scd.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One persisted row per pass, written after the pass reaches a terminal state.
 */
@Getter
@Setter
@Entity
@Table(name = "SCD_RUN_LOG")
public class ScdRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 36)
    private String runId;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(name = "as_of")
    private LocalDateTime asOf;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    private boolean dryRun;

    private long newCount;
    private long changedCount;
    private long unchangedCount;
    private long removedCount;

    @Column(name = "elapsed_millis")
    private long elapsedMillis;

    @Column(name = "error_kind", length = 40)
    private String errorKind;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    @Override
    public String toString() {
        return "ScdRunLog{" +
                "runId='" + runId + '\'' +
                ", tableName='" + tableName + '\'' +
                ", asOf=" + asOf +
                ", status='" + status + '\'' +
                ", new=" + newCount +
                ", changed=" + changedCount +
                ", unchanged=" + unchangedCount +
                ", removed=" + removedCount +
                ", errorKind='" + errorKind + '\'' +
                '}';
    }
}
