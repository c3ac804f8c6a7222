package com.divelog.proximity.model;

public enum ThermalState {
    NOMINAL,
    FAIR,
    SERIOUS,
    CRITICAL
}
