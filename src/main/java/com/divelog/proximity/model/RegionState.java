package com.divelog.proximity.model;

/**
 * Initial containment state the platform determines right after a region is installed.
 */
public enum RegionState {
    INSIDE,
    OUTSIDE,
    UNKNOWN
}
