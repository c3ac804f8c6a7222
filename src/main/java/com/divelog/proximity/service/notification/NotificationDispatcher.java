package com.divelog.proximity.service.notification;

import java.time.Duration;

/**
 * Schedules local reminders for dive sites.
 *
 * Scheduling is keyed by site id: scheduling again for the same site replaces
 * whatever is pending for it.
 */
public interface NotificationDispatcher {

    void scheduleDelayed(String siteId, Duration delay);

    void scheduleImmediate(String siteId);

    /**
     * Cancels the pending reminder for a site, if any.
     *
     * @return true if a pending reminder was cancelled
     */
    boolean cancel(String siteId);
}
