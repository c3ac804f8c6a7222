package com.divelog.proximity.dto;

import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.PermissionPhase;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.SamplingMode;
import com.divelog.proximity.service.health.HealthCounters;
import com.divelog.proximity.service.region.CycleReport;

import java.time.Instant;

/**
 * Snapshot of the engine returned by {@code GET /api/proximity/status}.
 *
 * @param permissionPhase      consent flow phase
 * @param monitoring           whether region scheduling is running
 * @param samplingMode         active location sampling mode
 * @param performancePolicy    policy derived from the last power state
 * @param monitoredRegionCount live regions (never above 20)
 * @param currentSiteId        site the user is at, or null when away
 * @param enteredAt            arrival time at the current site, or null
 * @param lastPosition         last accepted reading, or null
 * @param health               health counters
 * @param lastCycle            most recent scheduling cycle, or null before the first one
 * @param safeModeReason       active safe mode reason tag, or null
 */
public record ProximityStatusRecord(
    PermissionPhase permissionPhase,
    boolean monitoring,
    SamplingMode samplingMode,
    PerformancePolicy performancePolicy,
    int monitoredRegionCount,
    String currentSiteId,
    Instant enteredAt,
    Position lastPosition,
    HealthCounters health,
    CycleReport lastCycle,
    String safeModeReason
) {

    public boolean safeMode() {
        return safeModeReason != null;
    }
}
