package com.divelog.proximity.service.region;

/**
 * The platform refused to install or remove a region (resource exhaustion,
 * location services unavailable, ...).
 */
public class RegionMonitoringException extends RuntimeException {

    public RegionMonitoringException(String message) {
        super(message);
    }

    public RegionMonitoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
