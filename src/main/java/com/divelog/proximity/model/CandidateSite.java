package com.divelog.proximity.model;

/**
 * A dive site offered by the candidate source. Read-only to the scheduler.
 *
 * @param siteId   opaque site identifier
 * @param location site coordinate
 */
public record CandidateSite(String siteId, Coordinate location) {

    public CandidateSite {
        if (siteId == null || siteId.isBlank()) {
            throw new IllegalArgumentException("Site id cannot be blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("Site location is required");
        }
    }
}
