package com.divelog.proximity.dto;

import com.divelog.proximity.model.ThermalState;
import jakarta.validation.constraints.NotNull;

/**
 * Device power signals used to pick a performance policy.
 *
 * @param thermalState system thermal state
 * @param lowPowerMode system low-power mode enabled
 * @param boatMode     user enabled boat mode in the app
 */
public record PowerStateRecord(
    @NotNull(message = "Thermal state is required")
    ThermalState thermalState,

    boolean lowPowerMode,

    boolean boatMode
) {
}
