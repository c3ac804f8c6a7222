package com.divelog.proximity.model;

/**
 * Location authorization as reported by the platform.
 */
public enum AuthorizationStatus {
    NOT_DETERMINED,
    RESTRICTED,
    DENIED,
    AUTHORIZED_WHEN_IN_USE,
    AUTHORIZED_ALWAYS;

    public boolean isAuthorized() {
        return this == AUTHORIZED_WHEN_IN_USE || this == AUTHORIZED_ALWAYS;
    }

    public boolean isRefused() {
        return this == DENIED || this == RESTRICTED;
    }
}
