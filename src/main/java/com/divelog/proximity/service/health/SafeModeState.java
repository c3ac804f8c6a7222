package com.divelog.proximity.service.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Application-side consumer of safe mode requests.
 *
 * Remembers the latest request, relays it to connected devices on
 * {@code /topic/safe-mode}, and stays active until cleared explicitly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SafeModeState {

    static final String SAFE_MODE_TOPIC = "/topic/safe-mode";

    private final SimpMessagingTemplate messagingTemplate;

    private volatile SafeModeRequestedEvent active;

    @EventListener
    public void onSafeModeRequested(SafeModeRequestedEvent event) {
        active = event;
        log.warn("Safe mode active: {}", event.reason().tag());

        try {
            messagingTemplate.convertAndSend(SAFE_MODE_TOPIC, Map.of(
                "type", "SAFE_MODE",
                "active", true,
                "reason", event.reason().tag(),
                "consecutiveCount", event.consecutiveCount(),
                "timestamp", event.at().toString()
            ));
        } catch (RuntimeException e) {
            log.error("Failed to broadcast safe mode request", e);
        }
    }

    public Optional<SafeModeRequestedEvent> current() {
        return Optional.ofNullable(active);
    }

    public boolean isActive() {
        return active != null;
    }

    public void clear() {
        if (active != null) {
            log.info("Safe mode cleared (was {})", active.reason().tag());
        }
        active = null;
    }
}
