package com.divelog.proximity.service.region;

import com.divelog.proximity.config.ProximityProperties;
import com.divelog.proximity.model.CandidateSite;
import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.RegionState;
import com.divelog.proximity.service.ProximityMailbox;
import com.divelog.proximity.service.health.HealthMonitor;
import com.divelog.proximity.service.location.PositionListener;
import com.divelog.proximity.service.proximity.ProximityStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Decides which dive sites are watched as platform regions.
 *
 * On a position update (at most once per refresh interval, the latest throttled
 * update running as a trailing cycle when the interval ends):
 * 1. Ask the candidate source for sites within the admission radius (50km), nearest first
 * 2. Target set = the nearest {@value #MAX_MONITORED_REGIONS}
 * 3. Evict live regions that are outside the target set AND beyond the eviction radius (100km)
 * 4. Admit target sites that are not live yet, while the live count is below the cap
 * 5. Report the cycle's success and duration to the {@link HealthMonitor}
 *
 * The 50km/100km gap is a hysteresis band: sites drifting around the admission
 * boundary stay installed instead of being added and removed on every cycle.
 *
 * Concurrency:
 * - All state is confined to the proximity mailbox
 * - The candidate query runs elsewhere; its result re-enters the mailbox
 * - One cycle in flight at a time; positions arriving meanwhile collapse into
 *   a single follow-up cycle run on completion
 * - {@link #stop()} bumps a generation counter so late query results are discarded
 * - Position fix failures count as failed cycles towards safe mode
 *
 * Invariant: the live region count never exceeds {@value #MAX_MONITORED_REGIONS}.
 * Capacity is checked right before each install, never derived from the pre-diff count.
 */
@Slf4j
@Component
public class RegionScheduler implements PositionListener {

    /**
     * Platform ceiling on simultaneously monitored regions per app.
     */
    public static final int MAX_MONITORED_REGIONS = 20;

    private final CandidateSiteSource siteSource;
    private final RegionMonitor regionMonitor;
    private final RegionIdentifiers identifiers;
    private final HealthMonitor healthMonitor;
    private final ProximityStateMachine stateMachine;
    private final ProximityMailbox mailbox;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ProximityProperties.Regions settings;

    // Keyed by site id, in admission order
    private final Map<String, MonitoredRegion> liveRegions = new LinkedHashMap<>();

    private volatile boolean running;
    private long generation;
    private boolean cycleInFlight;
    private boolean recomputePending;
    private boolean trailingPending;
    private ScheduledFuture<?> trailingCycle;
    private Position latestPosition;
    private Instant lastCycleStartedAt;
    private Duration refreshInterval;

    private volatile List<MonitoredRegion> liveSnapshot = List.of();
    private volatile CycleReport lastReport;

    public RegionScheduler(
        CandidateSiteSource siteSource,
        RegionMonitor regionMonitor,
        RegionIdentifiers identifiers,
        HealthMonitor healthMonitor,
        ProximityStateMachine stateMachine,
        ProximityMailbox mailbox,
        @Qualifier("regionTaskScheduler") TaskScheduler taskScheduler,
        Clock clock,
        ProximityProperties properties
    ) {
        this.siteSource = siteSource;
        this.regionMonitor = regionMonitor;
        this.identifiers = identifiers;
        this.healthMonitor = healthMonitor;
        this.stateMachine = stateMachine;
        this.mailbox = mailbox;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.settings = properties.getRegions();
        this.refreshInterval = settings.getRefreshInterval();
    }

    /**
     * @return true if the scheduler was stopped and is now running
     */
    public boolean start() {
        if (running) {
            return false;
        }
        running = true;
        generation++;
        log.info("Region scheduling started (refresh every {}s)", refreshInterval.toSeconds());
        return true;
    }

    /**
     * Stops scheduling, discards any in-flight query result and removes every
     * installed region before returning.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        generation++;
        cycleInFlight = false;
        recomputePending = false;
        cancelTrailingCycle();
        latestPosition = null;
        lastCycleStartedAt = null;

        int removed = 0;
        for (MonitoredRegion region : liveRegions.values()) {
            try {
                regionMonitor.remove(region);
                removed++;
            } catch (RuntimeException e) {
                log.warn("Failed to remove region {} while stopping: {}", region.identifier(), e.getMessage());
            }
        }
        liveRegions.clear();
        publishSnapshot();

        log.info("Region scheduling stopped, {} regions removed", removed);
    }

    public void applyPolicy(PerformancePolicy policy) {
        refreshInterval = policy == PerformancePolicy.STANDARD
            ? settings.getRefreshInterval()
            : settings.getReducedPowerRefreshInterval();
    }

    @Override
    public void onPosition(Position position) {
        if (!running) {
            return;
        }
        latestPosition = position;

        if (cycleInFlight) {
            if (!recomputePending) {
                log.debug("Cycle in flight, coalescing recompute for {}", position.toLogString());
            }
            recomputePending = true;
            return;
        }

        Instant now = clock.instant();
        if (lastCycleStartedAt != null && now.isBefore(lastCycleStartedAt.plus(refreshInterval))) {
            log.debug("Throttled position update {}", position.toLogString());
            scheduleTrailingCycle(lastCycleStartedAt.plus(refreshInterval));
            return;
        }

        beginCycle(position, now);
    }

    /**
     * Fix failures never start a cycle; each one is reported as a failed cycle so a
     * device that has lost location entirely still escalates to safe mode.
     */
    @Override
    public void onPositionFailure(PositionFailure failure) {
        if (!running) {
            return;
        }
        log.debug("Recording position failure {} as a failed cycle", failure.kind());
        healthMonitor.recordCycle(false, Duration.ZERO);
    }

    private void scheduleTrailingCycle(Instant windowEnd) {
        if (trailingPending) {
            return;
        }
        trailingPending = true;
        long cycleGeneration = generation;
        trailingCycle = taskScheduler.schedule(
            () -> mailbox.execute(() -> runTrailingCycle(cycleGeneration)), windowEnd);
    }

    private void runTrailingCycle(long cycleGeneration) {
        if (!trailingPending || cycleGeneration != generation || !running) {
            return;
        }
        trailingPending = false;
        trailingCycle = null;
        if (cycleInFlight) {
            recomputePending = true;
            return;
        }
        log.debug("Refresh window closed, running trailing cycle for {}", latestPosition.toLogString());
        beginCycle(latestPosition, clock.instant());
    }

    private void cancelTrailingCycle() {
        trailingPending = false;
        if (trailingCycle != null) {
            trailingCycle.cancel(false);
            trailingCycle = null;
        }
    }

    private void beginCycle(Position position, Instant startedAt) {
        cancelTrailingCycle();
        cycleInFlight = true;
        lastCycleStartedAt = startedAt;
        long cycleGeneration = generation;

        CompletableFuture<List<CandidateSite>> query;
        try {
            query = siteSource.nearby(position, settings.getAdmissionRadiusKm(), MAX_MONITORED_REGIONS);
        } catch (RuntimeException e) {
            query = CompletableFuture.failedFuture(e);
        }

        query.whenComplete((sites, error) -> mailbox.execute(
            () -> completeCycle(cycleGeneration, position, startedAt, sites, error)));
    }

    private void completeCycle(
        long cycleGeneration,
        Position queriedAt,
        Instant startedAt,
        List<CandidateSite> sites,
        Throwable error
    ) {
        if (cycleGeneration != generation) {
            log.debug("Discarding candidate result from a cancelled cycle");
            return;
        }
        cycleInFlight = false;

        CycleReport report;
        if (error != null) {
            log.warn("Candidate site query failed: {}", rootMessage(error));
            report = new CycleReport(startedAt, Duration.between(startedAt, clock.instant()),
                false, 0, 0, 1, liveRegions.size());
        } else {
            report = applyDiff(queriedAt, sites, startedAt);
        }
        lastReport = report;

        log.info("Scheduling cycle: admitted={}, evicted={}, failures={}, monitored={}, took={}ms",
            report.admitted(), report.evicted(), report.failures(), report.monitoredCount(),
            report.duration().toMillis());
        healthMonitor.recordCycle(report.success(), report.duration());

        if (recomputePending && running) {
            recomputePending = false;
            beginCycle(latestPosition, clock.instant());
        }
    }

    /**
     * Applies a candidate list against the latest known position, which may
     * have moved on since the query was issued.
     */
    private CycleReport applyDiff(Position queriedAt, List<CandidateSite> sites, Instant startedAt) {
        Position current = latestPosition != null ? latestPosition : queriedAt;
        boolean moved = !current.equals(queriedAt);

        List<CandidateSite> target = sites.stream()
            .limit(MAX_MONITORED_REGIONS)
            .collect(Collectors.toList());
        Set<String> targetIds = target.stream()
            .map(CandidateSite::siteId)
            .collect(Collectors.toSet());

        int evicted = 0;
        int admitted = 0;
        int failures = 0;

        for (MonitoredRegion region : new ArrayList<>(liveRegions.values())) {
            if (targetIds.contains(region.siteId())) {
                continue;
            }
            if (current.distanceKm(region.center()) <= settings.getEvictionRadiusKm()) {
                continue;
            }
            try {
                regionMonitor.remove(region);
                liveRegions.remove(region.siteId());
                evicted++;
                log.debug("Evicted {}", region.toLogString());
            } catch (RuntimeException e) {
                // Still installed as far as we know, so it keeps counting against the cap
                failures++;
                log.warn("Failed to remove region {}: {}", region.identifier(), e.getMessage());
            }
        }

        for (CandidateSite site : target) {
            if (liveRegions.containsKey(site.siteId())) {
                continue;
            }
            if (moved && current.distanceKm(site.location()) > settings.getAdmissionRadiusKm()) {
                log.debug("Site {} no longer within admission radius of latest position", site.siteId());
                continue;
            }
            if (liveRegions.size() >= MAX_MONITORED_REGIONS) {
                log.debug("Region capacity reached, deferring remaining admissions");
                break;
            }

            MonitoredRegion region = MonitoredRegion.forSite(
                identifiers.identifierFor(site.siteId()), site, settings.getRegionRadiusMeters());
            try {
                regionMonitor.install(region);
                liveRegions.put(site.siteId(), region);
                admitted++;
                log.debug("Admitted {}", region.toLogString());
            } catch (RuntimeException e) {
                failures++;
                log.warn("Failed to install region {}: {}", region.identifier(), e.getMessage());
            }
        }

        publishSnapshot();
        return new CycleReport(startedAt, Duration.between(startedAt, clock.instant()),
            failures == 0, admitted, evicted, failures, liveRegions.size());
    }

    public void onRegionEntered(String regionId) {
        resolve(regionId).ifPresent(stateMachine::onEnter);
    }

    public void onRegionExited(String regionId) {
        resolve(regionId).ifPresent(stateMachine::onExit);
    }

    public void onRegionStateDetermined(String regionId, RegionState state) {
        if (state == RegionState.INSIDE) {
            onRegionEntered(regionId);
        }
    }

    /**
     * The platform gave up on a region; it no longer counts as live.
     */
    public void onMonitoringFailed(String regionId, Throwable error) {
        String message = error != null ? error.getMessage() : "unknown";
        Optional<String> siteId = identifiers.siteIdOf(regionId);
        if (siteId.isEmpty()) {
            log.warn("Region monitoring failed for {}: {}", regionId, message);
            return;
        }
        MonitoredRegion dropped = liveRegions.remove(siteId.get());
        if (dropped != null) {
            log.warn("Monitoring failed for {}, dropped from live set: {}", dropped.identifier(), message);
            publishSnapshot();
        }
    }

    private Optional<String> resolve(String regionId) {
        if (!running) {
            log.debug("Not running, ignoring callback for {}", regionId);
            return Optional.empty();
        }
        Optional<String> siteId = identifiers.siteIdOf(regionId);
        if (siteId.isEmpty()) {
            log.debug("Ignoring foreign region identifier {}", regionId);
        }
        return siteId;
    }

    public boolean isRunning() {
        return running;
    }

    public List<MonitoredRegion> monitoredRegions() {
        return liveSnapshot;
    }

    public Optional<CycleReport> lastCycle() {
        return Optional.ofNullable(lastReport);
    }

    private void publishSnapshot() {
        liveSnapshot = List.copyOf(liveRegions.values());
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
