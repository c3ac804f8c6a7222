package com.divelog.proximity.service.permission;

/**
 * What a request to start monitoring led to.
 */
public enum StartRequestOutcome {
    /** Permission is granted; monitoring should start now. */
    START_MONITORING,
    /** The platform consent prompt was shown; monitoring starts if the user grants it. */
    CONSENT_PROMPTED,
    /** Nothing happened: denied, or a non-user-initiated request before consent. */
    NOT_STARTED
}
