package com.companya.scd.engine;

import com.companya.scd.storage.StorageConnector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

/**
 * Issues the as-of timestamp of each pass.
 *
 * Wall time alone is not enough: two passes inside one clock tick, or a clock that
 * stepped backwards, would reuse a boundary. Every value issued for a history table is
 * strictly later than both the previous value and the latest boundary already stored
 * in that table.
 */
@Slf4j
@Component
public class RunClock {

    static final ChronoUnit RESOLUTION = ChronoUnit.MICROS;

    private final Clock clock;
    private final StorageConnector storage;
    private final Map<String, LocalDateTime> lastIssued = new HashMap<>();

    public RunClock(Clock clock, StorageConnector storage) {
        this.clock = clock;
        this.storage = storage;
    }

    public synchronized LocalDateTime nextAsOf(String historyTable) {
        LocalDateTime candidate = truncate(LocalDateTime.now(clock));
        LocalDateTime floor = storage.latestBoundary(historyTable).orElse(null);
        LocalDateTime previous = lastIssued.get(historyTable);
        if (previous != null && (floor == null || previous.isAfter(floor))) {
            floor = previous;
        }
        if (floor != null && !candidate.isAfter(floor)) {
            LocalDateTime bumped = truncate(floor).plus(1, RESOLUTION);
            log.debug("Clock reading {} is not after {} for {}, using {}", candidate, floor, historyTable, bumped);
            candidate = bumped;
        }
        lastIssued.put(historyTable, candidate);
        return candidate;
    }

    public static LocalDateTime truncate(LocalDateTime value) {
        return value.truncatedTo(RESOLUTION);
    }
}
