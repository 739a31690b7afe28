package com.aiverse.fabric.catalog.drift;

public enum DetectionFrequency {
    REALTIME,
    HOURLY,
    DAILY,
    WEEKLY
}
