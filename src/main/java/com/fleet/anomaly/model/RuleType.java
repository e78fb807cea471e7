package com.fleet.anomaly.model;

public enum RuleType {
    HIGH_TEMP,
    TEMP_SPIKE,
    CURRENT_UNSTABLE,
    LOW_BATTERY,
    SPEED_JUMP,
    LOW_PRESSURE
}
