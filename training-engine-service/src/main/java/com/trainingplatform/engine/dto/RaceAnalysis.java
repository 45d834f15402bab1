package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.performance.PaceZones;

import java.util.List;
import java.util.Map;

/**
 * Fitness score with derived paces and race predictions. {@code riegel} is
 * {@code null} when no target distance was requested.
 */
public record RaceAnalysis(
    @JsonProperty("fitnessScore")         double fitnessScore,
    @JsonProperty("paceZones")            PaceZones paceZones,
    @JsonProperty("formattedPaceZones")   Map<String, String> formattedPaceZones,
    @JsonProperty("predictions")          List<RacePrediction> predictions,
    @JsonProperty("riegel")               RacePrediction riegel
) {}
