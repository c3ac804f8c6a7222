package com.divelog.proximity.service.location;

import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.SamplingMode;
import com.divelog.proximity.model.SamplingProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * {@link LocationPlatform} backed by the device's own location service.
 *
 * The device streams raw readings in; this adapter applies the active sampling
 * profile (the distance filter) before handing readings to the engine, and
 * pushes sampling directives and consent prompts back out over STOMP so the
 * device can configure its native location manager to match.
 *
 * Message Flow:
 * 1. Device sends readings to /app/position (or POST /api/proximity/position)
 * 2. Readings closer than the distance filter to the last accepted one are dropped
 * 3. Accepted readings reach the listener (the engine's mailbox)
 * 4. Directives go to /topic/device/sampling, prompts to /topic/device/consent
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceStreamLocationPlatform implements LocationPlatform {

    static final String SAMPLING_TOPIC = "/topic/device/sampling";
    static final String CONSENT_TOPIC = "/topic/device/consent";

    /**
     * Movement a significant-change update represents.
     */
    static final double SIGNIFICANT_CHANGE_DISTANCE_METERS = 500;

    private final SimpMessagingTemplate messagingTemplate;

    private volatile Listener listener;
    private volatile AuthorizationStatus authorizationStatus = AuthorizationStatus.NOT_DETERMINED;

    // Guarded by this
    private SamplingMode mode = SamplingMode.OFF;
    private SamplingProfile profile = SamplingProfile.forPolicy(PerformancePolicy.STANDARD);
    private Position lastAccepted;

    @Override
    public AuthorizationStatus authorizationStatus() {
        return authorizationStatus;
    }

    @Override
    public void requestAuthorization() {
        send(CONSENT_TOPIC, Map.of(
            "type", "CONSENT_PROMPT",
            "permission", "LOCATION_WHEN_IN_USE",
            "timestamp", Instant.now().toString()
        ));
    }

    @Override
    public void startStandardUpdates(SamplingProfile newProfile) {
        synchronized (this) {
            mode = SamplingMode.STANDARD;
            profile = newProfile;
        }
        send(SAMPLING_TOPIC, Map.of(
            "mode", SamplingMode.STANDARD.name(),
            "desiredAccuracyMeters", newProfile.desiredAccuracyMeters(),
            "distanceFilterMeters", newProfile.distanceFilterMeters()
        ));
    }

    @Override
    public void startSignificantChangeUpdates() {
        synchronized (this) {
            mode = SamplingMode.SIGNIFICANT_CHANGE;
        }
        send(SAMPLING_TOPIC, Map.of(
            "mode", SamplingMode.SIGNIFICANT_CHANGE.name(),
            "distanceFilterMeters", SIGNIFICANT_CHANGE_DISTANCE_METERS
        ));
    }

    @Override
    public void stopUpdates() {
        synchronized (this) {
            mode = SamplingMode.OFF;
            lastAccepted = null;
        }
        send(SAMPLING_TOPIC, Map.of("mode", SamplingMode.OFF.name()));
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    /**
     * Takes a raw reading from the device.
     *
     * @return whether the reading passed the sampling filter
     */
    public boolean ingest(Position position) {
        synchronized (this) {
            if (mode == SamplingMode.OFF) {
                log.debug("Sampling off, ignoring {}", position.toLogString());
                return false;
            }
            double filter = mode == SamplingMode.SIGNIFICANT_CHANGE
                ? SIGNIFICANT_CHANGE_DISTANCE_METERS
                : profile.distanceFilterMeters();
            if (lastAccepted != null && lastAccepted.coordinate().distanceMeters(position.coordinate()) < filter) {
                return false;
            }
            lastAccepted = position;
        }

        Listener current = listener;
        if (current != null) {
            current.onPosition(position);
        }
        return true;
    }

    public void reportFailure(PositionFailure failure) {
        Listener current = listener;
        if (current != null) {
            current.onPositionFailure(failure);
        }
    }

    public void reportAuthorization(AuthorizationStatus status) {
        log.info("Device reported location authorization: {}", status);
        authorizationStatus = status;
        Listener current = listener;
        if (current != null) {
            current.onAuthorizationChanged(status);
        }
    }

    public synchronized SamplingMode mode() {
        return mode;
    }

    private void send(String destination, Map<String, Object> payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (RuntimeException e) {
            log.error("Failed to send {} to device", destination, e);
        }
    }
}
