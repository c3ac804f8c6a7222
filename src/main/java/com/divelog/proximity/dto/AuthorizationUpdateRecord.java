package com.divelog.proximity.dto;

import com.divelog.proximity.model.AuthorizationStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Location authorization status as reported by the device's system settings.
 */
public record AuthorizationUpdateRecord(
    @NotNull(message = "Authorization status is required")
    AuthorizationStatus status
) {
}
