package com.divelog.proximity.service.health;

import com.divelog.proximity.config.ProximityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Watches scheduling cycles and requests safe mode when they keep going wrong.
 *
 * Two independent counters:
 * - consecutive failures (query errors, rejected installs)
 * - consecutive slow cycles (duration over the configured ceiling)
 *
 * A cycle that is both successful and fast resets both counters. A counter
 * that reaches its threshold emits exactly one {@link SafeModeRequestedEvent};
 * it keeps counting silently afterwards and can only emit again after a reset.
 *
 * Written only from the region scheduler's cycle completion, on the mailbox.
 */
@Slf4j
@Component
public class HealthMonitor {

    private final ProximityProperties.Health settings;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private int consecutiveFailures;
    private int consecutiveSlowCycles;
    private long escalations;

    private volatile HealthCounters snapshot = HealthCounters.ZERO;

    public HealthMonitor(ProximityProperties properties, ApplicationEventPublisher publisher, Clock clock) {
        this.settings = properties.getHealth();
        this.publisher = publisher;
        this.clock = clock;
    }

    public void recordCycle(boolean success, Duration duration) {
        boolean slow = duration.compareTo(settings.getSlowCycleCeiling()) > 0;

        if (success && !slow) {
            if (consecutiveFailures > 0 || consecutiveSlowCycles > 0) {
                log.info("Scheduling healthy again after {} failed / {} slow cycles",
                    consecutiveFailures, consecutiveSlowCycles);
            }
            consecutiveFailures = 0;
            consecutiveSlowCycles = 0;
            publishSnapshot();
            return;
        }

        if (!success) {
            consecutiveFailures++;
            log.warn("Scheduling cycle failed ({} consecutive)", consecutiveFailures);
            if (consecutiveFailures == settings.getFailureThreshold()) {
                escalate(SafeModeReason.SCHEDULING_FAILURES, consecutiveFailures);
            }
        }

        if (slow) {
            consecutiveSlowCycles++;
            log.warn("Scheduling cycle took {}ms ({} consecutive slow)",
                duration.toMillis(), consecutiveSlowCycles);
            if (consecutiveSlowCycles == settings.getSlowCycleThreshold()) {
                escalate(SafeModeReason.SLOW_CYCLES, consecutiveSlowCycles);
            }
        }

        publishSnapshot();
    }

    public HealthCounters counters() {
        return snapshot;
    }

    private void escalate(SafeModeReason reason, int count) {
        escalations++;
        log.warn("Requesting safe mode: reason={}, consecutive={}", reason.tag(), count);
        publisher.publishEvent(new SafeModeRequestedEvent(reason, count, clock.instant()));
    }

    private void publishSnapshot() {
        snapshot = new HealthCounters(consecutiveFailures, consecutiveSlowCycles, escalations);
    }
}
