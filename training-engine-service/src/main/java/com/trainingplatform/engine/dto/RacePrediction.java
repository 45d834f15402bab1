package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RacePrediction(
    @JsonProperty("distance")      String distance,
    @JsonProperty("distanceKm")    double distanceKm,
    @JsonProperty("seconds")       double seconds,
    @JsonProperty("formatted")     String formatted
) {}
