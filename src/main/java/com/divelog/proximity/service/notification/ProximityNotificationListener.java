package com.divelog.proximity.service.notification;

import com.divelog.proximity.config.ProximityProperties;
import com.divelog.proximity.service.proximity.DiveCompletedEvent;
import com.divelog.proximity.service.proximity.SiteArrivedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Turns proximity events into reminders.
 *
 * - Arrival: a delayed "log your dive" reminder
 * - Probable completed dive: an immediate prompt, replacing any pending arrival reminder
 */
@Slf4j
@Component
public class ProximityNotificationListener {

    private final NotificationDispatcher dispatcher;
    private final Duration arrivalReminderDelay;

    public ProximityNotificationListener(NotificationDispatcher dispatcher, ProximityProperties properties) {
        this.dispatcher = dispatcher;
        this.arrivalReminderDelay = properties.getNotifications().getArrivalReminderDelay();
    }

    @EventListener
    public void onSiteArrived(SiteArrivedEvent event) {
        try {
            dispatcher.scheduleDelayed(event.siteId(), arrivalReminderDelay);
        } catch (RuntimeException e) {
            log.error("Failed to schedule arrival reminder for site {}: {}", event.siteId(), e.getMessage(), e);
        }
    }

    @EventListener
    public void onDiveCompleted(DiveCompletedEvent event) {
        try {
            dispatcher.scheduleImmediate(event.siteId());
        } catch (RuntimeException e) {
            log.error("Failed to schedule dive prompt for site {}: {}", event.siteId(), e.getMessage(), e);
        }
    }
}
