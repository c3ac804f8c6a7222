package com.divelog.proximity.service;

import com.divelog.proximity.dto.ProximityStatusRecord;
import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.PermissionPhase;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.ProximitySession;
import com.divelog.proximity.model.RegionState;
import com.divelog.proximity.model.ThermalState;
import com.divelog.proximity.service.health.HealthMonitor;
import com.divelog.proximity.service.health.SafeModeState;
import com.divelog.proximity.service.location.LocationPlatform;
import com.divelog.proximity.service.location.PositionProvider;
import com.divelog.proximity.service.location.PowerPolicyResolver;
import com.divelog.proximity.service.permission.PermissionPhaseController;
import com.divelog.proximity.service.permission.StartRequestOutcome;
import com.divelog.proximity.service.proximity.ProximityStateMachine;
import com.divelog.proximity.service.region.RegionMonitor;
import com.divelog.proximity.service.region.RegionScheduler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Coordinates the proximity pipeline:
 * permission gate -> position provider -> region scheduler -> state machine.
 *
 * Every platform callback and every external command is funneled into the
 * {@link ProximityMailbox}, so the components behind it never see concurrent
 * access. Commands return a future completed from inside the mailbox.
 *
 * Monitoring lifecycle:
 * - Starts on a START_MONITORING outcome or when authorization becomes granted
 * - Stops, and forgets the current visit, when authorization becomes denied
 * - At startup the system-status check adopts an authorization the platform
 *   already has, then starts monitoring if granted
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProximityEngine {

    private final ProximityMailbox mailbox;
    private final PermissionPhaseController permissionController;
    private final PositionProvider positionProvider;
    private final RegionScheduler regionScheduler;
    private final ProximityStateMachine stateMachine;
    private final LocationPlatform locationPlatform;
    private final RegionMonitor regionMonitor;
    private final PowerPolicyResolver powerPolicyResolver;
    private final HealthMonitor healthMonitor;
    private final SafeModeState safeModeState;

    private volatile PerformancePolicy policy = PerformancePolicy.STANDARD;

    @PostConstruct
    public void bind() {
        positionProvider.onPositionUpdate(regionScheduler);

        locationPlatform.setListener(new LocationPlatform.Listener() {
            @Override
            public void onPosition(Position position) {
                mailbox.execute(() -> positionProvider.deliver(position));
            }

            @Override
            public void onPositionFailure(PositionFailure failure) {
                mailbox.execute(() -> positionProvider.deliverFailure(failure));
            }

            @Override
            public void onAuthorizationChanged(AuthorizationStatus status) {
                mailbox.execute(() -> handleAuthorizationChanged(status));
            }
        });

        regionMonitor.setListener(new RegionMonitor.Listener() {
            @Override
            public void onEnter(String regionId) {
                mailbox.execute(() -> regionScheduler.onRegionEntered(regionId));
            }

            @Override
            public void onExit(String regionId) {
                mailbox.execute(() -> regionScheduler.onRegionExited(regionId));
            }

            @Override
            public void onStateDetermined(String regionId, RegionState state) {
                mailbox.execute(() -> regionScheduler.onRegionStateDetermined(regionId, state));
            }

            @Override
            public void onMonitoringFailed(String regionId, Throwable error) {
                mailbox.execute(() -> regionScheduler.onMonitoringFailed(regionId, error));
            }
        });

        mailbox.execute(this::checkSystemStatus);
    }

    public CompletableFuture<StartRequestOutcome> requestStart(boolean userInitiated) {
        return submit(() -> {
            StartRequestOutcome outcome = permissionController.requestStart(userInitiated);
            if (outcome == StartRequestOutcome.START_MONITORING) {
                startMonitoring();
            }
            return outcome;
        });
    }

    public CompletableFuture<PermissionPhase> skipPermission() {
        return submit(permissionController::skip);
    }

    public CompletableFuture<Boolean> stop() {
        return submit(() -> {
            boolean wasRunning = regionScheduler.isRunning();
            stopMonitoring();
            return wasRunning;
        });
    }

    public CompletableFuture<PerformancePolicy> applyPowerState(
        ThermalState thermalState,
        boolean lowPowerMode,
        boolean boatMode
    ) {
        return applyPolicy(powerPolicyResolver.resolve(thermalState, lowPowerMode, boatMode));
    }

    public CompletableFuture<PerformancePolicy> applyPolicy(PerformancePolicy newPolicy) {
        return submit(() -> {
            policy = newPolicy;
            positionProvider.applyPolicy(newPolicy);
            regionScheduler.applyPolicy(newPolicy);
            return newPolicy;
        });
    }

    public CompletableFuture<SamplingSnapshot> enterBackground() {
        return submit(() -> {
            positionProvider.onEnterBackground();
            return new SamplingSnapshot(positionProvider.samplingMode().name(), policy);
        });
    }

    public CompletableFuture<SamplingSnapshot> enterForeground() {
        return submit(() -> {
            positionProvider.onEnterForeground();
            return new SamplingSnapshot(positionProvider.samplingMode().name(), policy);
        });
    }

    /**
     * Point-in-time view assembled from thread-safe snapshots; may straddle a
     * mailbox task.
     */
    public ProximityStatusRecord status() {
        ProximitySession session = stateMachine.session();
        return new ProximityStatusRecord(
            permissionController.currentPhase(),
            regionScheduler.isRunning(),
            positionProvider.samplingMode(),
            policy,
            regionScheduler.monitoredRegions().size(),
            session.siteId(),
            session.enteredAt(),
            positionProvider.currentPosition().orElse(null),
            healthMonitor.counters(),
            regionScheduler.lastCycle().orElse(null),
            safeModeState.current().map(event -> event.reason().tag()).orElse(null)
        );
    }

    void handleAuthorizationChanged(AuthorizationStatus status) {
        PermissionPhase phase = permissionController.onSystemAuthorizationChanged(status);
        if (phase == PermissionPhase.GRANTED) {
            startMonitoring();
        } else if (phase == PermissionPhase.DENIED) {
            stopMonitoring();
        }
    }

    private void checkSystemStatus() {
        PermissionPhase phase = permissionController.synchronizeWithPlatform();
        log.info("System status check: permission phase {}", phase);
        if (phase == PermissionPhase.GRANTED) {
            startMonitoring();
        }
    }

    private void startMonitoring() {
        if (!positionProvider.start()) {
            return;
        }
        if (regionScheduler.start()) {
            positionProvider.currentPosition().ifPresent(regionScheduler::onPosition);
        }
    }

    private void stopMonitoring() {
        regionScheduler.stop();
        positionProvider.stop();
        stateMachine.reset();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        mailbox.execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                log.error("Proximity command failed", e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Sampling state after a lifecycle transition.
     */
    public record SamplingSnapshot(String samplingMode, PerformancePolicy policy) {
    }
}
