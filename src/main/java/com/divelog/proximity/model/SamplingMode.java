package com.divelog.proximity.model;

public enum SamplingMode {
    OFF,
    STANDARD,
    SIGNIFICANT_CHANGE
}
