package com.trainingplatform.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.WeeklyForecast;

public record WeeklyLoadReport(
    @JsonProperty("week")                    WeekWindow week,
    @JsonProperty("forecast")                WeeklyForecast forecast,
    @JsonProperty("intensity")               IntensityDistribution intensity,
    @JsonProperty("volumeTrend")             VolumeTrend volumeTrend,
    @JsonProperty("adherence")               AdherenceReport adherence,
    @JsonProperty("averageRunningPace")      double averageRunningPace,
    @JsonProperty("averageRunningPaceLabel") String averageRunningPaceLabel
) {}
