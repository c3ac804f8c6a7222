package com.divelog.proximity.service.health;

import com.divelog.proximity.config.ProximityProperties;
import com.divelog.proximity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.divelog.proximity.support.TestSites.T0;
import static org.assertj.core.api.Assertions.assertThat;

class HealthMonitorTest {

    private static final Duration FAST = Duration.ofMillis(150);
    private static final Duration SLOW = Duration.ofMillis(2_500);

    private List<SafeModeRequestedEvent> events;
    private HealthMonitor healthMonitor;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        healthMonitor = new HealthMonitor(
            new ProximityProperties(),
            event -> events.add((SafeModeRequestedEvent) event),
            new MutableClock(T0)
        );
    }

    @Test
    void shouldEscalateOnceAfterThreeConsecutiveFailures() {
        healthMonitor.recordCycle(false, FAST);
        healthMonitor.recordCycle(false, FAST);
        assertThat(events).isEmpty();

        healthMonitor.recordCycle(false, FAST);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).reason()).isEqualTo(SafeModeReason.SCHEDULING_FAILURES);
        assertThat(events.get(0).reason().tag()).isEqualTo("scheduling_failures");
        assertThat(events.get(0).consecutiveCount()).isEqualTo(3);
        assertThat(events.get(0).at()).isEqualTo(T0);

        healthMonitor.recordCycle(false, FAST);
        assertThat(events).hasSize(1);
        assertThat(healthMonitor.counters().consecutiveFailures()).isEqualTo(4);
    }

    @Test
    void shouldRearmAfterHealthyCycle() {
        for (int i = 0; i < 4; i++) {
            healthMonitor.recordCycle(false, FAST);
        }
        healthMonitor.recordCycle(true, FAST);
        assertThat(healthMonitor.counters()).isEqualTo(new HealthCounters(0, 0, 1));

        for (int i = 0; i < 3; i++) {
            healthMonitor.recordCycle(false, FAST);
        }

        assertThat(events).hasSize(2);
        assertThat(healthMonitor.counters().escalations()).isEqualTo(2);
    }

    @Test
    void shouldEscalateSlowCyclesIndependently() {
        healthMonitor.recordCycle(true, SLOW);
        healthMonitor.recordCycle(true, SLOW);
        healthMonitor.recordCycle(true, SLOW);

        assertThat(events).extracting(SafeModeRequestedEvent::reason).containsExactly(SafeModeReason.SLOW_CYCLES);
        assertThat(events.get(0).reason().tag()).isEqualTo("slow_cycles");
        assertThat(healthMonitor.counters().consecutiveFailures()).isZero();
    }

    @Test
    void shouldEscalateBothCountersWhenCyclesAreSlowAndFailing() {
        for (int i = 0; i < 3; i++) {
            healthMonitor.recordCycle(false, SLOW);
        }

        assertThat(events).extracting(SafeModeRequestedEvent::reason)
            .containsExactly(SafeModeReason.SCHEDULING_FAILURES, SafeModeReason.SLOW_CYCLES);
    }

    @Test
    void shouldNotCountCycleAtExactlyTheCeilingAsSlow() {
        for (int i = 0; i < 3; i++) {
            healthMonitor.recordCycle(true, Duration.ofSeconds(2));
        }

        assertThat(events).isEmpty();
        assertThat(healthMonitor.counters()).isEqualTo(HealthCounters.ZERO);
    }

    @Test
    void shouldNotResetFailuresOnSuccessfulButSlowCycle() {
        healthMonitor.recordCycle(false, FAST);
        healthMonitor.recordCycle(false, FAST);
        healthMonitor.recordCycle(true, SLOW);
        healthMonitor.recordCycle(false, FAST);

        assertThat(events).extracting(SafeModeRequestedEvent::reason)
            .containsExactly(SafeModeReason.SCHEDULING_FAILURES);
        assertThat(healthMonitor.counters().consecutiveSlowCycles()).isEqualTo(1);
    }

    @Test
    void shouldHonourConfiguredThreshold() {
        ProximityProperties properties = new ProximityProperties();
        properties.getHealth().setFailureThreshold(1);
        HealthMonitor strict = new HealthMonitor(
            properties, event -> events.add((SafeModeRequestedEvent) event), new MutableClock(T0));

        strict.recordCycle(false, FAST);

        assertThat(events).hasSize(1);
    }
}
