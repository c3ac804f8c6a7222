package com.divelog.proximity.controller;

import com.divelog.proximity.dto.AuthorizationUpdateRecord;
import com.divelog.proximity.dto.PositionFailureRecord;
import com.divelog.proximity.dto.PositionReportRecord;
import com.divelog.proximity.service.DeviceStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.Map;

/**
 * WebSocket controller for the device's location stream.
 *
 * Message Flow:
 * 1. Device sends readings to /app/position, fix failures to /app/position/failure
 *    and authorization changes to /app/authorization
 * 2. Readings go through the sampling filter and the region monitor
 * 3. The sender gets an acknowledgment on /user/queue/reply, errors on /user/queue/errors
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/device
 * - Subscribe to: /topic/device/sampling, /topic/device/consent, /topic/reminders, /topic/safe-mode
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class DeviceStreamController {

    private final DeviceStreamService deviceStreamService;
    private final SimpMessagingTemplate messagingTemplate;

    @MessageMapping("/position")
    public void handlePosition(@Payload PositionReportRecord report, Principal principal) {
        try {
            boolean accepted = deviceStreamService.ingest(report.toPosition());
            reply(principal, "/queue/reply", Map.of(
                "status", "OK",
                "accepted", accepted,
                "timestamp", Instant.now().toString()
            ));
        } catch (RuntimeException e) {
            log.error("Error processing position report: {}", e.getMessage(), e);
            reply(principal, "/queue/errors", Map.of(
                "status", "ERROR",
                "message", "Failed to process position report",
                "error", String.valueOf(e.getMessage()),
                "timestamp", Instant.now().toString()
            ));
        }
    }

    @MessageMapping("/position/failure")
    public void handlePositionFailure(@Payload PositionFailureRecord failure) {
        if (failure.kind() == null) {
            log.warn("Ignoring fix failure without a kind");
            return;
        }
        log.debug("Device reported fix failure: {}", failure.kind());
        deviceStreamService.reportFailure(failure.toFailure(Instant.now()));
    }

    @MessageMapping("/authorization")
    public void handleAuthorization(@Payload AuthorizationUpdateRecord update) {
        if (update.status() == null) {
            log.warn("Ignoring authorization update without a status");
            return;
        }
        deviceStreamService.reportAuthorization(update.status());
    }

    private void reply(Principal principal, String destination, Map<String, Object> payload) {
        if (principal == null) {
            return;
        }
        messagingTemplate.convertAndSendToUser(principal.getName(), destination, payload);
    }
}
