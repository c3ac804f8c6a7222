package com.divelog.proximity.service.region;

import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.model.RegionState;

/**
 * Port to the platform region-monitoring facility.
 *
 * Exclusively driven by {@link RegionScheduler}; nothing else installs or
 * removes regions. The namespace may be shared with other features, so
 * callbacks can carry identifiers this engine never installed.
 */
public interface RegionMonitor {

    /**
     * @throws RegionMonitoringException if the platform rejects the region
     */
    void install(MonitoredRegion region);

    /**
     * @throws RegionMonitoringException if the platform fails to remove the region
     */
    void remove(MonitoredRegion region);

    void setListener(Listener listener);

    interface Listener {

        void onEnter(String regionId);

        void onExit(String regionId);

        /**
         * Initial containment state, reported once after installation.
         */
        void onStateDetermined(String regionId, RegionState state);

        /**
         * @param regionId failing region, or null when the failure is not tied to one
         */
        void onMonitoringFailed(String regionId, Throwable error);
    }
}
