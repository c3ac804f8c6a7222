package com.divelog.proximity.service.location;

import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.PermissionPhase;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.SamplingMode;
import com.divelog.proximity.model.SamplingProfile;
import com.divelog.proximity.service.permission.PermissionPhaseController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wraps the platform location service and adapts sampling to power state and
 * app lifecycle.
 *
 * Power adaptation:
 * - STANDARD policy: best accuracy, 50m distance filter
 * - BOAT_MODE / THERMAL_THROTTLED / CRITICAL: 100m accuracy, 500-1000m filter
 * - Backgrounded under a reduced policy: significant-change sampling, restored
 *   to standard sampling on return to the foreground
 *
 * Fix failures are passed on to subscribers and sampling keeps running; the
 * scheduler's health counters are the only escalation path.
 *
 * All methods except {@link #currentPosition()} run on the proximity mailbox.
 */
@Slf4j
@Component
public class PositionProvider {

    private final LocationPlatform platform;
    private final PermissionPhaseController permissionController;
    private final List<PositionListener> subscribers = new CopyOnWriteArrayList<>();

    private boolean started;
    private boolean backgrounded;
    private boolean resumeStandardOnForeground;
    private PerformancePolicy policy = PerformancePolicy.STANDARD;

    private volatile SamplingMode mode = SamplingMode.OFF;
    private volatile Position lastPosition;

    public PositionProvider(LocationPlatform platform, PermissionPhaseController permissionController) {
        this.platform = platform;
        this.permissionController = permissionController;
    }

    /**
     * Starts sampling. Requires the GRANTED phase; idempotent once started.
     *
     * @return whether sampling is running after the call
     */
    public boolean start() {
        if (permissionController.currentPhase() != PermissionPhase.GRANTED) {
            log.info("Not starting location updates: permission phase is {}", permissionController.currentPhase());
            return false;
        }
        if (started) {
            return true;
        }

        started = true;
        switchToStandard();

        if (backgrounded && policy.allowsSignificantChangeInBackground()) {
            switchToSignificantChange();
            resumeStandardOnForeground = true;
        }

        log.info("Location updates started: mode={}, policy={}", mode, policy);
        return true;
    }

    public void stop() {
        if (!started) {
            return;
        }
        started = false;
        resumeStandardOnForeground = false;
        mode = SamplingMode.OFF;
        platform.stopUpdates();
        log.info("Location updates stopped");
    }

    public Optional<Position> currentPosition() {
        return Optional.ofNullable(lastPosition);
    }

    public void onPositionUpdate(PositionListener listener) {
        subscribers.add(listener);
    }

    public void applyPolicy(PerformancePolicy newPolicy) {
        if (newPolicy == policy) {
            return;
        }
        log.info("Performance policy {} -> {}", policy, newPolicy);
        policy = newPolicy;

        if (started && mode == SamplingMode.STANDARD) {
            platform.startStandardUpdates(SamplingProfile.forPolicy(policy));
        }
    }

    public void onEnterBackground() {
        backgrounded = true;
        if (!started) {
            return;
        }
        if (policy.allowsSignificantChangeInBackground() && mode != SamplingMode.SIGNIFICANT_CHANGE) {
            switchToSignificantChange();
            resumeStandardOnForeground = true;
        }
    }

    public void onEnterForeground() {
        backgrounded = false;
        if (!started) {
            return;
        }
        if (resumeStandardOnForeground || mode == SamplingMode.SIGNIFICANT_CHANGE) {
            switchToStandard();
            resumeStandardOnForeground = false;
        }
    }

    /**
     * Delivers a platform reading to every subscriber, in arrival order.
     */
    public void deliver(Position position) {
        if (!started) {
            log.debug("Dropping position received while stopped: {}", position.toLogString());
            return;
        }
        lastPosition = position;
        for (PositionListener subscriber : subscribers) {
            subscriber.onPosition(position);
        }
    }

    public void deliverFailure(PositionFailure failure) {
        log.warn("Location fix failed: kind={}, message={}", failure.kind(), failure.message());
        for (PositionListener subscriber : subscribers) {
            subscriber.onPositionFailure(failure);
        }
    }

    public SamplingMode samplingMode() {
        return mode;
    }

    public PerformancePolicy policy() {
        return policy;
    }

    public boolean isStarted() {
        return started;
    }

    private void switchToStandard() {
        platform.startStandardUpdates(SamplingProfile.forPolicy(policy));
        mode = SamplingMode.STANDARD;
    }

    private void switchToSignificantChange() {
        log.info("Switching to significant-change sampling (policy={})", policy);
        platform.startSignificantChangeUpdates();
        mode = SamplingMode.SIGNIFICANT_CHANGE;
    }
}
