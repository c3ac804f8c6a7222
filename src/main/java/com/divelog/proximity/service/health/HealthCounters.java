package com.divelog.proximity.service.health;

/**
 * Snapshot of the scheduler's health counters.
 *
 * @param consecutiveFailures   scheduling cycles that failed since the last healthy cycle
 * @param consecutiveSlowCycles cycles over the slow ceiling since the last healthy cycle
 * @param escalations           safe mode requests emitted since startup
 */
public record HealthCounters(int consecutiveFailures, int consecutiveSlowCycles, long escalations) {

    public static final HealthCounters ZERO = new HealthCounters(0, 0, 0);
}
