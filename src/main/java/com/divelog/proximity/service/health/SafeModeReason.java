package com.divelog.proximity.service.health;

/**
 * Why the scheduler asked for safe mode. The tag is what consumers see on the wire.
 */
public enum SafeModeReason {
    SCHEDULING_FAILURES("scheduling_failures"),
    SLOW_CYCLES("slow_cycles");

    private final String tag;

    SafeModeReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
