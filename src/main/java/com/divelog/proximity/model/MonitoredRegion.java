package com.divelog.proximity.model;

/**
 * A circular region installed with the platform region monitor.
 *
 * The identifier is derived from the site id with a fixed prefix so that
 * enter/exit callbacks can be mapped back to a site.
 *
 * @param identifier    platform region identifier (prefix + site id)
 * @param siteId        site this region watches
 * @param center        region center
 * @param radiusMeters  region radius
 * @param notifyOnEntry deliver enter callbacks
 * @param notifyOnExit  deliver exit callbacks
 */
public record MonitoredRegion(
    String identifier,
    String siteId,
    Coordinate center,
    double radiusMeters,
    boolean notifyOnEntry,
    boolean notifyOnExit
) {

    public static MonitoredRegion forSite(String identifier, CandidateSite site, double radiusMeters) {
        return new MonitoredRegion(identifier, site.siteId(), site.location(), radiusMeters, true, true);
    }

    public boolean contains(Coordinate point) {
        return center.distanceMeters(point) <= radiusMeters;
    }

    public String toLogString() {
        return String.format("Region[id=%s, center=%s, r=%.0fm]", identifier, center.toLogString(), radiusMeters);
    }
}
