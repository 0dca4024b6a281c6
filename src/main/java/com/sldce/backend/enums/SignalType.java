package com.sldce.backend.enums;

public enum SignalType {
    CONFIDENCE_DOMINANT,
    ANOMALY_DOMINANT,
    BOTH_HIGH
}
