package com.companya.scd.controller;

import com.companya.scd.exception.InvalidConfigurationException;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.RunState;
import com.companya.scd.model.RunSummary;
import com.companya.scd.model.ScalarValue;
import com.companya.scd.model.VersionRow;
import com.companya.scd.model.domain.ScdRunLog;
import com.companya.scd.repository.ScdRunLogRepository;
import com.companya.scd.service.HistoryQueryService;
import com.companya.scd.service.IntegrityReport;
import com.companya.scd.service.RunOptions;
import com.companya.scd.service.RunOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Internal operations endpoints: trigger passes, inspect run logs and history.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/scd")
@RequiredArgsConstructor
public class ScdOperationsController {

    private static final Pattern INTEGER_KEY = Pattern.compile("-?\\d{1,18}");

    private final RunOrchestrator orchestrator;
    private final HistoryQueryService historyQueryService;
    private final ScdRunLogRepository runLogRepository;

    /**
     * Run one pass for a table. Aborted passes are reported with 409 and their error kind.
     */
    @PostMapping("/runs/{table}")
    public ResponseEntity<RunSummary> run(@PathVariable String table,
                                          @RequestParam(defaultValue = "false") boolean dryRun) {
        log.info("🔧 Manual SCD pass requested for '{}' (dryRun={})", table, dryRun);
        RunSummary summary = orchestrator.runOnce(table, new RunOptions(null, dryRun));
        return summary.isSuccess()
                ? ResponseEntity.ok(summary)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(summary);
    }

    @PostMapping("/runs")
    public List<RunSummary> runAll() {
        log.info("🔧 Manual SCD pass requested for all tables");
        return orchestrator.runAll();
    }

    @GetMapping("/runs")
    public List<ScdRunLog> recentRuns(@RequestParam(required = false) String table) {
        return table == null
                ? runLogRepository.findTop20ByOrderByIdDesc()
                : runLogRepository.findTop20ByTableNameOrderByIdDesc(table);
    }

    @GetMapping("/runs/{table}/latest-committed")
    public ResponseEntity<ScdRunLog> latestCommitted(@PathVariable String table) {
        return ResponseEntity.of(runLogRepository.findFirstByTableNameAndStatusOrderByIdDesc(table, RunState.COMMITTED.name()));
    }

    @GetMapping("/history/{table}/{key}")
    public List<VersionRow> versions(@PathVariable String table, @PathVariable String key) {
        return historyQueryService.versionsOf(table, parseKey(key));
    }

    @GetMapping("/history/{table}/{key}/as-of")
    public ResponseEntity<VersionRow> asOf(@PathVariable String table,
                                           @PathVariable String key,
                                           @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        return ResponseEntity.of(historyQueryService.asOf(table, parseKey(key), at));
    }

    @GetMapping("/integrity/{table}")
    public IntegrityReport integrity(@PathVariable String table) {
        return historyQueryService.verifyIntegrity(table);
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleInvalidConfiguration(InvalidConfigurationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getKind().name(), "message", e.getMessage()));
    }

    /**
     * Path keys are untyped; anything that looks like an integer is treated as one.
     */
    static BusinessKey parseKey(String raw) {
        if (INTEGER_KEY.matcher(raw).matches()) {
            return new BusinessKey(ScalarValue.integer(Long.parseLong(raw)));
        }
        return new BusinessKey(ScalarValue.text(raw));
    }
}
