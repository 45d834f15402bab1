package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completed-to-date plus still-planned volume for one week.
 */
public record WeeklyForecast(
    @JsonProperty("runningKm")        double runningKm,
    @JsonProperty("runningSessions")  int    runningSessions,
    @JsonProperty("strengthSessions") int    strengthSessions
) {
    public static final WeeklyForecast EMPTY = new WeeklyForecast(0.0, 0, 0);

    public static WeeklyForecast ofRunningKm(double km) {
        return new WeeklyForecast(km, 0, 0);
    }
}
