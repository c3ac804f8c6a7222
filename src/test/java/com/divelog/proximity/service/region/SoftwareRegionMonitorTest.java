package com.divelog.proximity.service.region;

import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.model.RegionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.divelog.proximity.support.TestSites.positionAt;
import static com.divelog.proximity.support.TestSites.siteAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SoftwareRegionMonitorTest {

    private SoftwareRegionMonitor monitor;
    private List<String> callbacks;

    @BeforeEach
    void setUp() {
        monitor = new SoftwareRegionMonitor();
        callbacks = new ArrayList<>();
        monitor.setListener(new RegionMonitor.Listener() {
            @Override
            public void onEnter(String regionId) {
                callbacks.add("enter:" + regionId);
            }

            @Override
            public void onExit(String regionId) {
                callbacks.add("exit:" + regionId);
            }

            @Override
            public void onStateDetermined(String regionId, RegionState state) {
                callbacks.add("state:" + regionId + ":" + state);
            }

            @Override
            public void onMonitoringFailed(String regionId, Throwable error) {
                callbacks.add("failed:" + regionId);
            }
        });
    }

    private static MonitoredRegion region(String siteId, double km) {
        return MonitoredRegion.forSite("dive_site_" + siteId, siteAt(siteId, km), 500);
    }

    @Test
    void shouldRejectInstallBeyondPlatformLimit() {
        for (int i = 0; i < SoftwareRegionMonitor.PLATFORM_REGION_LIMIT; i++) {
            monitor.install(region("s" + i, i));
        }

        assertThatThrownBy(() -> monitor.install(region("extra", 30)))
            .isInstanceOf(RegionMonitoringException.class);
        assertThat(monitor.installedCount()).isEqualTo(SoftwareRegionMonitor.PLATFORM_REGION_LIMIT);
    }

    @Test
    void shouldReportUnknownStateBeforeAnyReading() {
        monitor.install(region("a", 0));

        assertThat(callbacks).containsExactly("state:dive_site_a:UNKNOWN");
    }

    @Test
    void shouldReportInitialStateFromLastReading() {
        monitor.evaluate(positionAt(0));

        monitor.install(region("here", 0.2));
        monitor.install(region("there", 5));

        assertThat(callbacks).containsExactly(
            "state:dive_site_here:INSIDE",
            "state:dive_site_there:OUTSIDE");
    }

    @Test
    void shouldEmitEnterAndExitOnlyOnCrossings() {
        monitor.install(region("a", 10));
        callbacks.clear();

        monitor.evaluate(positionAt(9));
        monitor.evaluate(positionAt(9.8));
        monitor.evaluate(positionAt(10.1));
        monitor.evaluate(positionAt(11));

        assertThat(callbacks).containsExactly("enter:dive_site_a", "exit:dive_site_a");
    }

    @Test
    void shouldReportExitBeforeEnterWhenHoppingBetweenRegions() {
        monitor.install(region("a", 10));
        monitor.install(region("b", 10.8));
        monitor.evaluate(positionAt(10));
        callbacks.clear();

        monitor.evaluate(positionAt(10.8));

        assertThat(callbacks).containsExactly("exit:dive_site_a", "enter:dive_site_b");
    }

    @Test
    void shouldStopReportingRemovedRegion() {
        MonitoredRegion region = region("a", 10);
        monitor.install(region);
        monitor.remove(region);
        callbacks.clear();

        monitor.evaluate(positionAt(10));

        assertThat(callbacks).isEmpty();
        assertThat(monitor.installedIdentifiers()).isEmpty();
    }
}
