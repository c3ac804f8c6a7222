package com.divelog.proximity.service;

import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.service.location.DeviceStreamLocationPlatform;
import com.divelog.proximity.service.region.SoftwareRegionMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything the device streams in.
 *
 * A raw reading feeds both platform adapters: the location adapter (subject to
 * the sampling filter) and the region monitor (every reading, the way native
 * geofencing runs independently of location sampling).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceStreamService {

    private final DeviceStreamLocationPlatform locationPlatform;
    private final SoftwareRegionMonitor regionMonitor;

    /**
     * @return whether the reading passed the sampling filter
     */
    public boolean ingest(Position position) {
        boolean accepted = locationPlatform.ingest(position);
        regionMonitor.evaluate(position);
        log.debug("Ingested {} (accepted={})", position.toLogString(), accepted);
        return accepted;
    }

    public void reportFailure(PositionFailure failure) {
        locationPlatform.reportFailure(failure);
    }

    public void reportAuthorization(AuthorizationStatus status) {
        locationPlatform.reportAuthorization(status);
    }
}
