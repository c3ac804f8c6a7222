package com.divelog.proximity.model;

import java.time.Instant;

/**
 * A failed fix reported by the platform. Failures are transient: sampling continues.
 *
 * @param kind    failure category
 * @param message platform diagnostic
 * @param at      when the failure was reported
 */
public record PositionFailure(Kind kind, String message, Instant at) {

    public enum Kind {
        PERMISSION_DENIED,
        LOCATION_UNKNOWN,
        PLATFORM_ERROR
    }
}
