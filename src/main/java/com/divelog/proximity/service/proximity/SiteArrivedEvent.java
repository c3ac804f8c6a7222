package com.divelog.proximity.service.proximity;

import java.time.Instant;

/**
 * The user entered a dive site's region.
 */
public record SiteArrivedEvent(String siteId, Instant arrivedAt) {
}
