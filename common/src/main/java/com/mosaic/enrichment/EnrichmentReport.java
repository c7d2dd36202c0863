package com.mosaic.enrichment;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Per-feature counters of one dispatcher run. Thread-safe.
 */
public class EnrichmentReport {

    private final String name;
    private final Map<EnrichmentOutcome, AtomicLong> outcomes = new EnumMap<>(EnrichmentOutcome.class);
    private final AtomicLong passedThrough = new AtomicLong();

    public EnrichmentReport(String name) {
        this.name = name;
        for (EnrichmentOutcome outcome : EnrichmentOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    public void record(EnrichmentOutcome outcome) {
        outcomes.get(outcome).incrementAndGet();
    }

    public void recordPassedThrough() {
        passedThrough.incrementAndGet();
    }

    public String getName() {
        return name;
    }

    public long getCount(EnrichmentOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    /** Number of entries the task was run for. */
    public long getDispatched() {
        return outcomes.values().stream().mapToLong(AtomicLong::get).sum();
    }

    /** Number of entries rejected by the eligibility check. */
    public long getPassedThrough() {
        return passedThrough.get();
    }

    @Override
    public String toString() {
        String counts = outcomes.entrySet().stream()
                .filter(e -> e.getValue().get() > 0)
                .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + e.getValue().get())
                .collect(Collectors.joining(", "));
        return name + " [dispatched=" + getDispatched() + ", skipped=" + getPassedThrough()
                + (counts.isEmpty() ? "" : ", " + counts) + "]";
    }
}
