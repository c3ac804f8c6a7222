package com.divelog.proximity.model;

import java.time.Instant;

/**
 * Immutable device position reading.
 *
 * Each new reading supersedes the previous one; readings are never mutated.
 *
 * @param latitude       latitude in decimal degrees (WGS84)
 * @param longitude      longitude in decimal degrees (WGS84)
 * @param accuracyMeters horizontal accuracy radius in meters (0 when unknown)
 * @param timestamp      when the reading was captured on the device
 */
public record Position(
    double latitude,
    double longitude,
    double accuracyMeters,
    Instant timestamp
) {

    public Position {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]: " + longitude);
        }
        if (accuracyMeters < 0) {
            throw new IllegalArgumentException("Accuracy must be >= 0: " + accuracyMeters);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp is required");
        }
    }

    public static Position of(Coordinate coordinate, double accuracyMeters, Instant timestamp) {
        return new Position(coordinate.latitude(), coordinate.longitude(), accuracyMeters, timestamp);
    }

    public Coordinate coordinate() {
        return new Coordinate(latitude, longitude);
    }

    public double distanceKm(Coordinate other) {
        return coordinate().distanceKm(other);
    }

    public String toLogString() {
        return String.format("Position[lat=%.6f, lon=%.6f, acc=%.0fm, time=%s]",
            latitude, longitude, accuracyMeters, timestamp);
    }
}
