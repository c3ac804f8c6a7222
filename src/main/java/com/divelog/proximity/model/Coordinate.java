package com.divelog.proximity.model;

/**
 * A WGS84 coordinate in decimal degrees.
 *
 * @param latitude  latitude in decimal degrees (-90 to 90)
 * @param longitude longitude in decimal degrees (-180 to 180)
 */
public record Coordinate(double latitude, double longitude) {

    /**
     * Mean earth radius used by the haversine formula (IUGG).
     */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    public Coordinate {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]: " + longitude);
        }
    }

    /**
     * Great-circle (haversine) distance to another coordinate on a spherical earth.
     */
    public double distanceMeters(Coordinate other) {
        double phi1 = Math.toRadians(latitude);
        double phi2 = Math.toRadians(other.latitude);
        double deltaPhi = Math.toRadians(other.latitude - latitude);
        double deltaLambda = Math.toRadians(other.longitude - longitude);

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    public double distanceKm(Coordinate other) {
        return distanceMeters(other) / 1000.0;
    }

    public String toLogString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
