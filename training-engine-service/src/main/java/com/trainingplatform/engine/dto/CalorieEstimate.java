package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CalorieEstimate(
    @JsonProperty("activityType") String activityType,
    @JsonProperty("kcal")         double kcal
) {}
