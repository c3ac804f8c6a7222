package com.divelog.proximity.controller;

import com.divelog.proximity.dto.AuthorizationUpdateRecord;
import com.divelog.proximity.dto.PositionReportRecord;
import com.divelog.proximity.dto.PowerStateRecord;
import com.divelog.proximity.dto.ProximityStatusRecord;
import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.PermissionPhase;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.service.DeviceStreamService;
import com.divelog.proximity.service.ProximityEngine;
import com.divelog.proximity.service.health.HealthCounters;
import com.divelog.proximity.service.health.SafeModeState;
import com.divelog.proximity.service.notification.NotificationDispatcher;
import com.divelog.proximity.service.permission.StartRequestOutcome;
import com.divelog.proximity.service.region.RegionScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST surface of the proximity engine.
 *
 * This controller provides endpoints to:
 * 1. Drive the consent flow and monitoring lifecycle
 * 2. Report power state and app lifecycle transitions
 * 3. Post position readings (the same path as the STOMP stream)
 * 4. Inspect status, monitored regions, health and safe mode
 *
 * Commands run on the engine's mailbox; a command not answered within
 * {@value #COMMAND_TIMEOUT_SECONDS}s is reported as 503.
 */
@RestController
@RequestMapping("/api/proximity")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Proximity", description = "Dive site proximity monitoring API")
public class ProximityController {

    static final long COMMAND_TIMEOUT_SECONDS = 5;

    private final ProximityEngine engine;
    private final RegionScheduler regionScheduler;
    private final DeviceStreamService deviceStreamService;
    private final NotificationDispatcher notificationDispatcher;
    private final SafeModeState safeModeState;

    @Operation(summary = "Engine status", description = "Permission phase, sampling, monitored region count, session and health.")
    @GetMapping("/status")
    public ResponseEntity<ProximityStatusRecord> status() {
        return ResponseEntity.ok(engine.status());
    }

    @Operation(summary = "Monitored regions", description = "Regions currently installed, in admission order.")
    @GetMapping("/regions")
    public ResponseEntity<List<MonitoredRegion>> regions() {
        return ResponseEntity.ok(regionScheduler.monitoredRegions());
    }

    /**
     * Example:
     * POST /api/proximity/permission/request?userInitiated=true
     */
    @Operation(
            summary = "Request to start monitoring",
            description = "Starts monitoring when permission is granted. Without a user action, never shows a consent prompt."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Request handled",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(value = "{\"outcome\":\"CONSENT_PROMPTED\",\"permissionPhase\":\"EXPLAINER_SHOWN\"}")
                    )
            )
    })
    @PostMapping("/permission/request")
    public ResponseEntity<Map<String, Object>> requestStart(
        @Parameter(description = "Whether the user explicitly asked to enable location", example = "true")
        @RequestParam(defaultValue = "false") boolean userInitiated
    ) {
        StartRequestOutcome outcome = await(engine.requestStart(userInitiated));
        log.info("Start request (userInitiated={}): {}", userInitiated, outcome);
        return ResponseEntity.ok(Map.of(
            "outcome", outcome,
            "permissionPhase", engine.status().permissionPhase()
        ));
    }

    @Operation(summary = "Skip the location explainer", description = "The user chose \"Not Now\"; the phase becomes DENIED.")
    @PostMapping("/permission/skip")
    public ResponseEntity<Map<String, Object>> skipPermission() {
        PermissionPhase phase = await(engine.skipPermission());
        return ResponseEntity.ok(Map.of("permissionPhase", phase));
    }

    @Operation(summary = "Report a system authorization change", description = "Status as read from the device's settings.")
    @PostMapping("/authorization")
    public ResponseEntity<Map<String, Object>> authorization(@Valid @RequestBody AuthorizationUpdateRecord update) {
        deviceStreamService.reportAuthorization(update.status());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "status", "ACCEPTED",
            "authorization", update.status()
        ));
    }

    @Operation(summary = "Stop monitoring", description = "Removes every installed region and stops location updates.")
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean wasRunning = await(engine.stop());
        return ResponseEntity.ok(Map.of("stopped", true, "wasRunning", wasRunning));
    }

    @PostMapping("/lifecycle/background")
    public ResponseEntity<ProximityEngine.SamplingSnapshot> enterBackground() {
        return ResponseEntity.ok(await(engine.enterBackground()));
    }

    @PostMapping("/lifecycle/foreground")
    public ResponseEntity<ProximityEngine.SamplingSnapshot> enterForeground() {
        return ResponseEntity.ok(await(engine.enterForeground()));
    }

    @Operation(summary = "Report device power state", description = "Thermal state, low-power mode and boat mode select the performance policy.")
    @PostMapping("/power")
    public ResponseEntity<Map<String, Object>> power(@Valid @RequestBody PowerStateRecord powerState) {
        PerformancePolicy policy = await(engine.applyPowerState(
            powerState.thermalState(), powerState.lowPowerMode(), powerState.boatMode()));
        return ResponseEntity.ok(Map.of(
            "performancePolicy", policy,
            "distanceFilterMeters", policy.distanceFilterMeters()
        ));
    }

    /**
     * Example request:
     * POST /api/proximity/position
     * {
     *   "latitude": 28.0155,
     *   "longitude": 34.4630,
     *   "accuracy": 12.0,
     *   "timestamp": "2024-05-01T08:30:00Z"
     * }
     */
    @Operation(summary = "Post a position reading", description = "Same path as the STOMP stream on /app/position.")
    @PostMapping("/position")
    public ResponseEntity<Map<String, Object>> position(@Valid @RequestBody PositionReportRecord report) {
        Position position = report.toPosition();
        boolean accepted = deviceStreamService.ingest(position);
        return ResponseEntity.ok(Map.of(
            "accepted", accepted,
            "latitude", position.latitude(),
            "longitude", position.longitude()
        ));
    }

    @Operation(summary = "Cancel a pending reminder")
    @DeleteMapping("/reminders/{siteId}")
    public ResponseEntity<Map<String, Object>> cancelReminder(@PathVariable String siteId) {
        boolean cancelled = notificationDispatcher.cancel(siteId);
        return ResponseEntity.ok(Map.of("siteId", siteId, "cancelled", cancelled));
    }

    @GetMapping("/safe-mode")
    public ResponseEntity<Map<String, Object>> safeMode() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", safeModeState.isActive());
        safeModeState.current().ifPresent(event -> {
            body.put("reason", event.reason().tag());
            body.put("consecutiveCount", event.consecutiveCount());
            body.put("since", event.at());
        });
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/safe-mode")
    public ResponseEntity<Map<String, Object>> clearSafeMode() {
        boolean wasActive = safeModeState.isActive();
        safeModeState.clear();
        return ResponseEntity.ok(Map.of("active", false, "wasActive", wasActive));
    }

    /**
     * DEGRADED while safe mode is active.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        HealthCounters counters = engine.status().health();
        return ResponseEntity.ok(Map.of(
            "status", safeModeState.isActive() ? "DEGRADED" : "UP",
            "service", "Dive Proximity Engine",
            "consecutiveFailures", counters.consecutiveFailures(),
            "consecutiveSlowCycles", counters.consecutiveSlowCycles(),
            "timestamp", Instant.now()
        ));
    }

    private static <T> T await(CompletableFuture<T> command) {
        try {
            return command.get(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Proximity engine did not respond in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Interrupted while waiting for the proximity engine");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) e.getCause();
            }
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Proximity command failed", e.getCause());
        }
    }
}
