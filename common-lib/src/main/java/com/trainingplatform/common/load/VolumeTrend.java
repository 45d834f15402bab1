package com.trainingplatform.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VolumeTrend(
    @JsonProperty("averageKm")         double averageKm,
    @JsonProperty("currentKm")         double currentKm,
    @JsonProperty("differenceKm")      double differenceKm,
    @JsonProperty("percentDifference") double percentDifference,
    @JsonProperty("status")            VolumeTrendStatus status
) {}
