package com.mosaic.enrichment;

import lombok.extern.slf4j.Slf4j;

/**
 * Failure counter that switches an enrichment feature off once its remote API keeps failing.
 *
 * <p>Every remote failure adds one error, every success removes one (never below zero).
 * While the count is above {@link #ERROR_THRESHOLD} the budget is exhausted and
 * {@link EnrichmentEligibility} rejects all entries. Tripping is immediate, recovery is
 * one step per success: there is no cached "tripped" flag, each check reads the live
 * count.</p>
 *
 * <p>Writes are serialised; {@link #isExhausted()} reads without locking, so a few tasks
 * may still be dispatched while a trip is in progress.</p>
 */
@Slf4j
public class ErrorBudget {

    public static final int ERROR_THRESHOLD = 5;

    private final String name;
    private final int threshold;
    private volatile int errors;

    public ErrorBudget(String name) {
        this(name, ERROR_THRESHOLD);
    }

    public ErrorBudget(String name, int threshold) {
        this.name = name;
        this.threshold = threshold;
    }

    /**
     * Records a remote failure. Logs a warning only when this failure exhausts the budget.
     */
    public synchronized void recordFailure() {
        errors++;
        if (errors == threshold + 1) {
            log.warn("Too many errors. Skip processing of {}", name);
        }
    }

    /** Records a remote success. */
    public synchronized void recordSuccess() {
        if (errors > 0) {
            errors--;
        }
    }

    public boolean isExhausted() {
        return errors > threshold;
    }

    public int getErrors() {
        return errors;
    }

    public int getThreshold() {
        return threshold;
    }
}
