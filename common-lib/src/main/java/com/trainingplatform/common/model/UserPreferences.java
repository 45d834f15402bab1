package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * User preference fields read by the engine.
 *
 * <p>{@code enabledModalities == null} means every modality is enabled.
 * {@code longRunThresholdKm == null} falls back to the caller's default.
 */
public record UserPreferences(
    @JsonProperty("longRunThresholdKm") Double longRunThresholdKm,
    @JsonProperty("enabledModalities")  Set<SuggestionType> enabledModalities,
    @JsonProperty("birthYear")          Integer birthYear
) {
    public static final double DEFAULT_LONG_RUN_THRESHOLD_KM = 15.0;

    public static final UserPreferences DEFAULTS = new UserPreferences(null, null, null);

    public double longRunThresholdOr(double fallback) {
        return longRunThresholdKm != null && longRunThresholdKm > 0 ? longRunThresholdKm : fallback;
    }

    public boolean isEnabled(SuggestionType type) {
        if (type == SuggestionType.REST || enabledModalities == null) return true;
        return enabledModalities.contains(type);
    }
}
