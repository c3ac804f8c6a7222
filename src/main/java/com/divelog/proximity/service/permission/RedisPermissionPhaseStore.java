package com.divelog.proximity.service.permission;

import com.divelog.proximity.config.ProximityProperties;
import com.divelog.proximity.model.PermissionPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stores the permission phase as a single enum name under one namespaced Redis key.
 *
 * Storage format:
 * - Key: {@code divelog:proximity:permission-phase} (configurable)
 * - Value: enum constant name, e.g. "GRANTED"
 *
 * New phases can only be added, so unknown values are treated as absent
 * instead of migrated.
 */
@Slf4j
@Component
public class RedisPermissionPhaseStore implements PermissionPhaseStore {

    private final StringRedisTemplate stringRedisTemplate;
    private final String key;

    public RedisPermissionPhaseStore(StringRedisTemplate stringRedisTemplate, ProximityProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.key = properties.getPermission().getStorageKey();
    }

    @Override
    public Optional<PermissionPhase> load() {
        String stored;
        try {
            stored = stringRedisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.error("Failed to read permission phase from Redis, assuming none stored", e);
            return Optional.empty();
        }

        if (stored == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(PermissionPhase.valueOf(stored));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown stored permission phase: {}", stored);
            return Optional.empty();
        }
    }

    @Override
    public void save(PermissionPhase phase) {
        try {
            stringRedisTemplate.opsForValue().set(key, phase.name());
        } catch (RuntimeException e) {
            // In-memory phase stays authoritative for this process
            log.error("Failed to persist permission phase {}", phase, e);
        }
    }
}
