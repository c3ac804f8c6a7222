package com.divelog.proximity.service.permission;

import com.divelog.proximity.model.PermissionPhase;

import java.util.Optional;

/**
 * Persists the permission phase across process restarts.
 */
public interface PermissionPhaseStore {

    Optional<PermissionPhase> load();

    void save(PermissionPhase phase);
}
