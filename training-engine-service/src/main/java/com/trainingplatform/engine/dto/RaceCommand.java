package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A race result to derive fitness from, plus an optional distance to
 * extrapolate to with Riegel's formula.
 */
public record RaceCommand(
    @JsonProperty("distanceKm")       double distanceKm,
    @JsonProperty("timeSeconds")      double timeSeconds,
    @JsonProperty("targetDistanceKm") Double targetDistanceKm
) {}
