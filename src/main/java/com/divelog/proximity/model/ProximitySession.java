package com.divelog.proximity.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Where the user currently is: away, or at one site since a given instant.
 *
 * @param siteId    current site, or null when away
 * @param enteredAt entry instant, or null when away
 */
public record ProximitySession(String siteId, Instant enteredAt) {

    public static final ProximitySession AWAY = new ProximitySession(null, null);

    public ProximitySession {
        if ((siteId == null) != (enteredAt == null)) {
            throw new IllegalArgumentException("Site id and entry time must both be set or both be absent");
        }
    }

    public static ProximitySession atSite(String siteId, Instant enteredAt) {
        return new ProximitySession(siteId, enteredAt);
    }

    public boolean isAtSite() {
        return siteId != null;
    }

    public boolean isAt(String candidateSiteId) {
        return siteId != null && siteId.equals(candidateSiteId);
    }

    public Duration dwellUntil(Instant now) {
        return isAtSite() ? Duration.between(enteredAt, now) : Duration.ZERO;
    }
}
