package com.divelog.proximity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the dive proximity engine.
 *
 * Flow:
 * 1. The device streams position readings over WebSocket
 * 2. Readings pass the sampling filter and reach the region scheduler
 * 3. The scheduler keeps the nearest dive sites (at most 20) installed as regions
 * 4. Region enter/exit crossings drive the proximity state machine
 * 5. Arrivals and probable completed dives become reminders for the device
 */
@SpringBootApplication
public class DiveProximityApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiveProximityApplication.class, args);
    }
}
