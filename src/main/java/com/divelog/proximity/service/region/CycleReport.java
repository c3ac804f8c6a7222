package com.divelog.proximity.service.region;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one scheduling cycle.
 *
 * @param startedAt      when the candidate query was issued
 * @param duration       query plus diff time
 * @param success        no query failure and no rejected install/removal
 * @param admitted       regions installed
 * @param evicted        regions removed
 * @param failures       rejected installs/removals (or 1 for a failed query)
 * @param monitoredCount live region count after the cycle
 */
public record CycleReport(
    Instant startedAt,
    Duration duration,
    boolean success,
    int admitted,
    int evicted,
    int failures,
    int monitoredCount
) {
}
