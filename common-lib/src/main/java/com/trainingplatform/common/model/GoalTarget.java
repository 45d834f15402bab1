package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * One measurable target of a {@link PerformanceGoal}: a unit and a value.
 * Targets with a blank unit or a missing value match nothing.
 */
public record GoalTarget(
    @JsonProperty("unit")  String unit,
    @JsonProperty("value") Double value
) {
    public boolean isDistance() {
        return hasValue() && "km".equals(normalizedUnit());
    }

    /** Session counts, e.g. {@code "sessions"} or the Swedish {@code "pass"}. */
    public boolean isSessionCount() {
        if (!hasValue()) return false;
        String u = normalizedUnit();
        return u.contains("session") || u.contains("pass");
    }

    private boolean hasValue() {
        return value != null && Double.isFinite(value) && value > 0;
    }

    private String normalizedUnit() {
        return unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
    }
}
