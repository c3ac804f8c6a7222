package com.divelog.proximity.service.health;

import java.time.Instant;

/**
 * Published once each time a health counter reaches its threshold.
 *
 * Advisory only: what safe mode means is decided by whoever listens.
 *
 * @param reason           which counter crossed its threshold
 * @param consecutiveCount counter value at the crossing
 * @param at               when the crossing was detected
 */
public record SafeModeRequestedEvent(SafeModeReason reason, int consecutiveCount, Instant at) {
}
