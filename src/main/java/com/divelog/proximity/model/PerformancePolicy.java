package com.divelog.proximity.model;

/**
 * Device power/thermal policy. Supplied from outside the core and consulted
 * when choosing how aggressively to sample positions.
 */
public enum PerformancePolicy {
    STANDARD(50),
    BOAT_MODE(500),
    THERMAL_THROTTLED(750),
    CRITICAL(1_000);

    private final double distanceFilterMeters;

    PerformancePolicy(double distanceFilterMeters) {
        this.distanceFilterMeters = distanceFilterMeters;
    }

    public double distanceFilterMeters() {
        return distanceFilterMeters;
    }

    public boolean usesReducedAccuracy() {
        return this != STANDARD;
    }

    /**
     * Whether a backgrounded app may fall back to significant-change sampling.
     */
    public boolean allowsSignificantChangeInBackground() {
        return this != STANDARD;
    }
}
