package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ephemeral engine output, regenerated on every call, never persisted.
 *
 * <p>{@code durationMinutes}, {@code distanceKm} and {@code intensity} are
 * {@code null} when a suggestion does not prescribe them.
 */
public record TrainingSuggestion(
    @JsonProperty("id")              String id,
    @JsonProperty("type")            SuggestionType type,
    @JsonProperty("source")          SuggestionSource source,
    @JsonProperty("label")           String label,
    @JsonProperty("description")     String description,
    @JsonProperty("reason")          String reason,
    @JsonProperty("durationMinutes") Integer durationMinutes,
    @JsonProperty("distanceKm")      Double distanceKm,
    @JsonProperty("intensity")       Intensity intensity
) {
    public boolean hasDistance() {
        return distanceKm != null && distanceKm > 0;
    }
}
