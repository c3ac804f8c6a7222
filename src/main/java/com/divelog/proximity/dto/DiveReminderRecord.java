package com.divelog.proximity.dto;

import com.divelog.proximity.service.notification.ReminderCategory;

import java.time.Instant;
import java.util.List;

/**
 * Reminder pushed to the device on {@code /topic/reminders}.
 *
 * @param siteId    site the reminder is about
 * @param category  notification category the device registers
 * @param actions   action identifiers offered with the notification
 * @param createdAt when the reminder fired
 */
public record DiveReminderRecord(
    String siteId,
    ReminderCategory category,
    List<String> actions,
    Instant createdAt
) {
}
