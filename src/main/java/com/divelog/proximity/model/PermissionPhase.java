package com.divelog.proximity.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The user's progress through the location consent flow.
 *
 * <pre>
 * INITIAL ──► EXPLAINER_SHOWN ──► GRANTED ◄──► DENIED
 *    │                         ▲       ▲
 *    └─────────────────────────┴───────┘  (platform status already determined)
 * </pre>
 *
 * GRANTED and DENIED swap only through a platform authorization change, which
 * is how a reset made in system settings is observed.
 */
public enum PermissionPhase {
    INITIAL,
    EXPLAINER_SHOWN,
    GRANTED,
    DENIED;

    public Set<PermissionPhase> successors() {
        return switch (this) {
            case INITIAL -> EnumSet.of(EXPLAINER_SHOWN, GRANTED, DENIED);
            case EXPLAINER_SHOWN -> EnumSet.of(GRANTED, DENIED);
            case GRANTED -> EnumSet.of(DENIED);
            case DENIED -> EnumSet.of(GRANTED);
        };
    }

    public boolean canTransitionTo(PermissionPhase next) {
        return successors().contains(next);
    }
}
