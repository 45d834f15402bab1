package com.trainingplatform.common.model;

public enum PlanStatus {
    PLANNED,
    COMPLETED,
    SKIPPED,
    CHANGED
}
