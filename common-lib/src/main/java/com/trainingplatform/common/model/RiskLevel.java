package com.trainingplatform.common.model;

public enum RiskLevel {
    NONE,
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}
