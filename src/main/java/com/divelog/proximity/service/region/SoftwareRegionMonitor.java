package com.divelog.proximity.service.region;

import com.divelog.proximity.model.Coordinate;
import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.RegionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link RegionMonitor} that evaluates raw device readings against the
 * installed circles, the way the device's native geofencing would.
 *
 * - Enforces the platform ceiling: installs beyond {@value #PLATFORM_REGION_LIMIT} are rejected
 * - Reports the initial state of a freshly installed region when a reading is known
 * - Emits enter/exit only on boundary crossings
 *
 * Readings arrive on the WebSocket threads while installs come from the
 * mailbox, so state is guarded by this; listener callbacks are made after the
 * lock is released.
 */
@Slf4j
@Component
public class SoftwareRegionMonitor implements RegionMonitor {

    public static final int PLATFORM_REGION_LIMIT = 20;

    // Guarded by this
    private final Map<String, MonitoredRegion> installed = new LinkedHashMap<>();
    private final Set<String> inside = new HashSet<>();
    private Coordinate lastPoint;

    private volatile Listener listener;

    @Override
    public void install(MonitoredRegion region) {
        RegionState initialState;
        synchronized (this) {
            if (!installed.containsKey(region.identifier()) && installed.size() >= PLATFORM_REGION_LIMIT) {
                throw new RegionMonitoringException(
                    "Region limit of " + PLATFORM_REGION_LIMIT + " reached, cannot install " + region.identifier());
            }
            installed.put(region.identifier(), region);

            if (lastPoint == null) {
                initialState = RegionState.UNKNOWN;
                inside.remove(region.identifier());
            } else if (region.contains(lastPoint)) {
                initialState = RegionState.INSIDE;
                inside.add(region.identifier());
            } else {
                initialState = RegionState.OUTSIDE;
                inside.remove(region.identifier());
            }
        }

        Listener current = listener;
        if (current != null) {
            current.onStateDetermined(region.identifier(), initialState);
        }
    }

    @Override
    public synchronized void remove(MonitoredRegion region) {
        installed.remove(region.identifier());
        inside.remove(region.identifier());
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    /**
     * Evaluates a reading and reports boundary crossings.
     */
    public void evaluate(Position position) {
        Coordinate point = position.coordinate();
        List<String> entered = new ArrayList<>();
        List<String> exited = new ArrayList<>();

        synchronized (this) {
            lastPoint = point;
            for (MonitoredRegion region : installed.values()) {
                boolean nowInside = region.contains(point);
                boolean wasInside = inside.contains(region.identifier());
                if (nowInside && !wasInside) {
                    inside.add(region.identifier());
                    entered.add(region.identifier());
                } else if (!nowInside && wasInside) {
                    inside.remove(region.identifier());
                    exited.add(region.identifier());
                }
            }
        }

        Listener current = listener;
        if (current == null) {
            return;
        }
        // Exits first so a hop between adjacent regions reads as leave-then-arrive
        exited.forEach(current::onExit);
        entered.forEach(current::onEnter);
    }

    public synchronized int installedCount() {
        return installed.size();
    }

    public synchronized Set<String> installedIdentifiers() {
        return Set.copyOf(installed.keySet());
    }
}
