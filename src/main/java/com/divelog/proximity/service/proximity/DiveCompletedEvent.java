package com.divelog.proximity.service.proximity;

import java.time.Duration;
import java.time.Instant;

/**
 * The user left a site after dwelling long enough that a dive probably happened.
 *
 * @param siteId    site that was left
 * @param enteredAt when the user arrived
 * @param exitedAt  when the user left
 * @param dwell     time spent inside the region
 */
public record DiveCompletedEvent(String siteId, Instant enteredAt, Instant exitedAt, Duration dwell) {
}
