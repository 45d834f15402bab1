package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.performance.CalorieParams;

public record CalorieCommand(
    @JsonProperty("activityType")    String activityType,
    @JsonProperty("durationSeconds") double durationSeconds,
    @JsonProperty("params")          CalorieParams params
) {}
