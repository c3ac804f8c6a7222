package com.divelog.proximity.dto;

import com.divelog.proximity.model.Position;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * A raw location reading streamed by the device.
 *
 * @param latitude  latitude in decimal degrees (WGS84)
 * @param longitude longitude in decimal degrees (WGS84)
 * @param accuracy  optional horizontal accuracy in meters
 * @param timestamp when the device captured the reading
 */
public record PositionReportRecord(
    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @PositiveOrZero(message = "Accuracy must be >= 0")
    Double accuracy,

    @NotNull(message = "Timestamp is required")
    Instant timestamp
) {

    public PositionReportRecord {
        // One minute of tolerance for device clock skew
        if (timestamp != null && timestamp.isAfter(Instant.now().plusSeconds(60))) {
            throw new IllegalArgumentException("Position timestamp cannot be in the future");
        }
    }

    public Position toPosition() {
        return new Position(latitude, longitude, accuracy != null ? accuracy : 0.0, timestamp);
    }
}
