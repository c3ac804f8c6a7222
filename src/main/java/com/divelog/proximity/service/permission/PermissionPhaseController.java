package com.divelog.proximity.service.permission;

import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.PermissionPhase;
import com.divelog.proximity.service.location.LocationPlatform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single source of truth for the location consent flow.
 *
 * The phase is loaded from the store at construction without touching the
 * platform. The platform is only consulted once the engine runs its
 * system-status check, and a consent prompt is only ever shown for a
 * user-initiated request.
 *
 * Mutations run on the proximity mailbox; {@link #currentPhase()} may be read
 * from any thread.
 */
@Slf4j
@Component
public class PermissionPhaseController {

    private final PermissionPhaseStore store;
    private final LocationPlatform platform;

    private volatile PermissionPhase phase;

    public PermissionPhaseController(PermissionPhaseStore store, LocationPlatform platform) {
        this.store = store;
        this.platform = platform;
        this.phase = store.load().orElse(PermissionPhase.INITIAL);
        log.info("Permission phase loaded: {}", phase);
    }

    public PermissionPhase currentPhase() {
        return phase;
    }

    /**
     * Handles a request to start monitoring.
     *
     * @param userInitiated whether the user explicitly asked for it (e.g. tapped "Enable Location")
     */
    public StartRequestOutcome requestStart(boolean userInitiated) {
        switch (phase) {
            case GRANTED:
                return StartRequestOutcome.START_MONITORING;
            case DENIED:
                log.debug("Start requested while denied, ignoring");
                return StartRequestOutcome.NOT_STARTED;
            case INITIAL:
            case EXPLAINER_SHOWN:
            default:
                if (!userInitiated) {
                    log.debug("Start requested without user action in phase {}, not prompting", phase);
                    return StartRequestOutcome.NOT_STARTED;
                }
                transitionTo(PermissionPhase.EXPLAINER_SHOWN);
                log.info("Requesting location authorization from the platform");
                platform.requestAuthorization();
                return StartRequestOutcome.CONSENT_PROMPTED;
        }
    }

    /**
     * The user dismissed the in-app explainer with "Not Now".
     */
    public PermissionPhase skip() {
        if (phase == PermissionPhase.INITIAL || phase == PermissionPhase.EXPLAINER_SHOWN) {
            transitionTo(PermissionPhase.DENIED);
        }
        return phase;
    }

    /**
     * Maps a platform authorization change onto the phase and persists it.
     *
     * @return the phase after the change
     */
    public PermissionPhase onSystemAuthorizationChanged(AuthorizationStatus status) {
        if (status.isAuthorized()) {
            transitionTo(PermissionPhase.GRANTED);
        } else if (status.isRefused()) {
            transitionTo(PermissionPhase.DENIED);
        } else {
            log.debug("Authorization not determined, keeping phase {}", phase);
        }
        return phase;
    }

    /**
     * System-status check run at startup: adopts a status the platform already
     * determined in an earlier session, bypassing the explainer.
     */
    public PermissionPhase synchronizeWithPlatform() {
        return onSystemAuthorizationChanged(platform.authorizationStatus());
    }

    private void transitionTo(PermissionPhase next) {
        if (phase == next) {
            return;
        }
        if (!phase.canTransitionTo(next)) {
            log.warn("Illegal permission transition {} -> {} ignored", phase, next);
            return;
        }
        log.info("Permission phase {} -> {}", phase, next);
        phase = next;
        store.save(next);
    }
}
