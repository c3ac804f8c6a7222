package com.divelog.proximity.model;

/**
 * Parameters handed to the platform for continuous (standard) sampling.
 *
 * @param desiredAccuracyMeters requested fix accuracy
 * @param distanceFilterMeters  minimum movement between reported updates
 */
public record SamplingProfile(double desiredAccuracyMeters, double distanceFilterMeters) {

    public static final double BEST_ACCURACY_METERS = 5;
    public static final double REDUCED_ACCURACY_METERS = 100;
    public static final double REDUCED_MINIMUM_DISTANCE_FILTER_METERS = 500;

    public static SamplingProfile forPolicy(PerformancePolicy policy) {
        if (policy.usesReducedAccuracy()) {
            return new SamplingProfile(
                REDUCED_ACCURACY_METERS,
                Math.max(REDUCED_MINIMUM_DISTANCE_FILTER_METERS, policy.distanceFilterMeters())
            );
        }
        return new SamplingProfile(BEST_ACCURACY_METERS, policy.distanceFilterMeters());
    }
}
