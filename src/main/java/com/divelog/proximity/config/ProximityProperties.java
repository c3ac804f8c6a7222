package com.divelog.proximity.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the proximity engine, bound from {@code divelog.proximity.*}.
 *
 * The 20-region ceiling is not here: it is a platform limit, see
 * {@link com.divelog.proximity.service.region.RegionScheduler#MAX_MONITORED_REGIONS}.
 */
@Data
@ConfigurationProperties(prefix = "divelog.proximity")
public class ProximityProperties {

    private final Regions regions = new Regions();
    private final Health health = new Health();
    private final Session session = new Session();
    private final Notifications notifications = new Notifications();
    private final Permission permission = new Permission();

    @Data
    public static class Regions {
        /** Candidates are queried within this radius of the current position. */
        private double admissionRadiusKm = 50;
        /** Non-target regions are evicted only beyond this distance. */
        private double evictionRadiusKm = 100;
        private double regionRadiusMeters = 500;
        private String identifierPrefix = "dive_site_";
        /** Minimum spacing between scheduling cycles under the standard policy. */
        private Duration refreshInterval = Duration.ofSeconds(60);
        /** Minimum spacing between scheduling cycles under reduced power policies. */
        private Duration reducedPowerRefreshInterval = Duration.ofSeconds(180);
    }

    @Data
    public static class Health {
        private int failureThreshold = 3;
        private int slowCycleThreshold = 3;
        private Duration slowCycleCeiling = Duration.ofSeconds(2);
    }

    @Data
    public static class Session {
        /** Dwell at or above which an exit is reported as a probable completed dive. */
        private Duration diveCompletionDwell = Duration.ofMinutes(30);
    }

    @Data
    public static class Notifications {
        private Duration arrivalReminderDelay = Duration.ofMinutes(15);
    }

    @Data
    public static class Permission {
        private String storageKey = "divelog:proximity:permission-phase";
    }
}
