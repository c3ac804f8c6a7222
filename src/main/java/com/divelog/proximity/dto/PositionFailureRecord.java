package com.divelog.proximity.dto;

import com.divelog.proximity.model.PositionFailure;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A failed fix reported by the device.
 */
public record PositionFailureRecord(
    @NotNull(message = "Failure kind is required")
    PositionFailure.Kind kind,

    String message
) {

    public PositionFailure toFailure(Instant at) {
        return new PositionFailure(kind, message != null ? message : "", at);
    }
}
