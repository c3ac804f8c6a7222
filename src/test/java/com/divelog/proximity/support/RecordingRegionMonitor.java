package com.divelog.proximity.support;

import com.divelog.proximity.model.MonitoredRegion;
import com.divelog.proximity.service.region.RegionMonitor;
import com.divelog.proximity.service.region.RegionMonitoringException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Region monitor double that tracks what is installed and the peak count,
 * and can be told to reject specific identifiers.
 */
public class RecordingRegionMonitor implements RegionMonitor {

    public final Map<String, MonitoredRegion> installed = new LinkedHashMap<>();
    public final List<String> installCalls = new ArrayList<>();
    public final List<String> removeCalls = new ArrayList<>();
    public final Set<String> rejectInstall = new HashSet<>();
    public final Set<String> rejectRemove = new HashSet<>();
    public int peakInstalled;

    private Listener listener;

    @Override
    public void install(MonitoredRegion region) {
        installCalls.add(region.identifier());
        if (rejectInstall.contains(region.identifier())) {
            throw new RegionMonitoringException("rejected " + region.identifier());
        }
        installed.put(region.identifier(), region);
        peakInstalled = Math.max(peakInstalled, installed.size());
    }

    @Override
    public void remove(MonitoredRegion region) {
        removeCalls.add(region.identifier());
        if (rejectRemove.contains(region.identifier())) {
            throw new RegionMonitoringException("cannot remove " + region.identifier());
        }
        installed.remove(region.identifier());
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    public Listener listener() {
        return listener;
    }
}
