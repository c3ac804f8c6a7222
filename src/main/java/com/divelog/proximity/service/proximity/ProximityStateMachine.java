package com.divelog.proximity.service.proximity;

import com.divelog.proximity.config.ProximityProperties;
import com.divelog.proximity.model.ProximitySession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks whether the user is at a dive site and turns raw region crossings
 * into arrival and probable-dive-completion events.
 *
 * States: away, or at one site since an entry instant.
 * - away + enter(A)        -> at(A), publishes {@link SiteArrivedEvent}
 * - at(A) + exit(A)        -> away, publishes {@link DiveCompletedEvent} if dwell >= threshold
 * - at(A) + enter(B)       -> exit(A) then enter(B)
 * - at(A) + enter(A)       -> unchanged
 * - exit for any other site is ignored
 *
 * Event-driven only; there are no timers in here. Runs on the proximity mailbox.
 */
@Slf4j
@Component
public class ProximityStateMachine {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Duration completionDwell;

    private volatile ProximitySession session = ProximitySession.AWAY;

    public ProximityStateMachine(ProximityProperties properties, ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
        this.completionDwell = properties.getSession().getDiveCompletionDwell();
    }

    public void onEnter(String siteId) {
        if (session.isAt(siteId)) {
            log.debug("Already at site {}, ignoring duplicate enter", siteId);
            return;
        }
        if (session.isAtSite()) {
            log.info("Entered site {} while still at {}, closing previous visit first", siteId, session.siteId());
            onExit(session.siteId());
        }

        Instant now = clock.instant();
        session = ProximitySession.atSite(siteId, now);
        log.info("Arrived at site {}", siteId);
        publisher.publishEvent(new SiteArrivedEvent(siteId, now));
    }

    public void onExit(String siteId) {
        if (!session.isAt(siteId)) {
            log.debug("Exit from site {} while not there, ignoring", siteId);
            return;
        }

        Instant now = clock.instant();
        Instant enteredAt = session.enteredAt();
        Duration dwell = session.dwellUntil(now);
        session = ProximitySession.AWAY;

        if (dwell.compareTo(completionDwell) >= 0) {
            log.info("Left site {} after {} min, probable dive completed", siteId, dwell.toMinutes());
            publisher.publishEvent(new DiveCompletedEvent(siteId, enteredAt, now, dwell));
        } else {
            log.info("Left site {} after {}s, too brief for a dive", siteId, dwell.toSeconds());
        }
    }

    /**
     * Forgets the current visit without emitting anything (monitoring stopped).
     */
    public void reset() {
        session = ProximitySession.AWAY;
    }

    public ProximitySession session() {
        return session;
    }
}
