package com.divelog.proximity.service.notification;

import com.divelog.proximity.dto.DiveReminderRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Delivers reminders to the device over STOMP.
 *
 * Message Flow:
 * 1. A reminder is scheduled on the reminder {@link TaskScheduler}, keyed by site id
 * 2. When it fires, a {@link DiveReminderRecord} is published to {@code /topic/reminders}
 * 3. The device turns it into a local notification with the category's actions
 *
 * Scheduling for a site that already has a pending reminder cancels the old one first.
 * A reminder is registered before it is handed to the scheduler and only delivers
 * while still registered, so a reminder that fires is never reported as cancellable.
 */
@Slf4j
@Component
public class StompNotificationDispatcher implements NotificationDispatcher {

    static final String REMINDER_TOPIC = "/topic/reminders";

    private final TaskScheduler taskScheduler;
    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    private final Map<String, PendingReminder> pending = new ConcurrentHashMap<>();

    public StompNotificationDispatcher(
        @Qualifier("reminderTaskScheduler") TaskScheduler taskScheduler,
        SimpMessagingTemplate messagingTemplate,
        Clock clock
    ) {
        this.taskScheduler = taskScheduler;
        this.messagingTemplate = messagingTemplate;
        this.clock = clock;
    }

    @Override
    public void scheduleDelayed(String siteId, Duration delay) {
        Instant fireAt = clock.instant().plus(delay);
        schedule(siteId, ReminderCategory.DIVE_LOG_REMINDER, fireAt);
        log.info("Scheduled {} for site {} at {}", ReminderCategory.DIVE_LOG_REMINDER, siteId, fireAt);
    }

    @Override
    public void scheduleImmediate(String siteId) {
        schedule(siteId, ReminderCategory.DIVE_LOG_PROMPT, clock.instant());
        log.info("Scheduled {} for site {}", ReminderCategory.DIVE_LOG_PROMPT, siteId);
    }

    @Override
    public boolean cancel(String siteId) {
        PendingReminder reminder = pending.remove(siteId);
        if (reminder == null) {
            return false;
        }
        reminder.cancel();
        log.info("Cancelled pending reminder for site {}", siteId);
        return true;
    }

    public boolean hasPending(String siteId) {
        return pending.containsKey(siteId);
    }

    private void schedule(String siteId, ReminderCategory category, Instant fireAt) {
        PendingReminder reminder = new PendingReminder();
        PendingReminder previous = pending.put(siteId, reminder);
        if (previous != null) {
            previous.cancel();
            log.debug("Replaced pending reminder for site {}", siteId);
        }

        try {
            reminder.attach(taskScheduler.schedule(() -> {
                if (pending.remove(siteId, reminder)) {
                    deliver(siteId, category);
                }
            }, fireAt));
        } catch (RuntimeException e) {
            pending.remove(siteId, reminder);
            throw e;
        }
    }

    private void deliver(String siteId, ReminderCategory category) {
        DiveReminderRecord reminder = new DiveReminderRecord(
            siteId, category, category.actions(), clock.instant());
        try {
            messagingTemplate.convertAndSend(REMINDER_TOPIC, reminder);
            log.info("Delivered {} for site {}", category, siteId);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} for site {}: {}", category, siteId, e.getMessage(), e);
        }
    }

    private static final class PendingReminder {

        private ScheduledFuture<?> future;
        private boolean cancelled;

        synchronized void attach(ScheduledFuture<?> scheduled) {
            future = scheduled;
            if (cancelled && future != null) {
                future.cancel(false);
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
