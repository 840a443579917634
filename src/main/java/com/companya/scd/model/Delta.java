package com.companya.scd.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Full classification of one pass, in source order followed by removed keys.
 */
public record Delta(List<Classification> items) {

    public Delta {
        items = List.copyOf(items);
    }

    public List<Classification> byOutcome(Outcome outcome) {
        return items.stream().filter(c -> c.outcome() == outcome).collect(Collectors.toList());
    }

    public Map<Outcome, Long> counts() {
        Map<Outcome, Long> counts = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0L);
        }
        items.forEach(c -> counts.merge(c.outcome(), 1L, Long::sum));
        return counts;
    }

    /**
     * Whether applying this delta would write anything.
     */
    public boolean hasMutations() {
        return items.stream().anyMatch(c -> c.outcome() != Outcome.UNCHANGED);
    }
}
