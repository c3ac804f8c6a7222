package com.divelog.proximity.service.location;

import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.ThermalState;
import org.springframework.stereotype.Component;

/**
 * Derives the performance policy from device power signals.
 *
 * Thermal pressure wins over user choices; boat mode and the system
 * low-power mode both map to BOAT_MODE.
 */
@Component
public class PowerPolicyResolver {

    public PerformancePolicy resolve(ThermalState thermalState, boolean lowPowerMode, boolean boatMode) {
        return switch (thermalState) {
            case CRITICAL -> PerformancePolicy.CRITICAL;
            case SERIOUS -> PerformancePolicy.THERMAL_THROTTLED;
            case NOMINAL, FAIR -> (boatMode || lowPowerMode) ? PerformancePolicy.BOAT_MODE : PerformancePolicy.STANDARD;
        };
    }
}
