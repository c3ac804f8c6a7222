package com.divelog.proximity.service.notification;

import java.util.List;

/**
 * Reminder categories understood by the device, with the actions it offers for each.
 */
public enum ReminderCategory {

    /** Sent a while after arriving at a site. */
    DIVE_LOG_REMINDER,

    /** Sent right after leaving a site where the stay looked like a dive. */
    DIVE_LOG_PROMPT;

    public static final String ACTION_LOG_DIVE = "LOG_DIVE";
    public static final String ACTION_DISMISS = "DISMISS";

    public List<String> actions() {
        return List.of(ACTION_LOG_DIVE, ACTION_DISMISS);
    }
}
