package com.trainingplatform.common.suggestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.LocalDate;
import java.util.List;

/**
 * In-memory snapshot handed to {@link SuggestionEngine}. {@code forecast} may
 * be {@code null}, in which case it is derived from {@code history} and
 * {@code planned}.
 */
public record SuggestionRequest(
    @JsonProperty("history")     List<ActivityRecord> history,
    @JsonProperty("planned")     List<PlannedActivity> planned,
    @JsonProperty("targetDate")  LocalDate targetDate,
    @JsonProperty("goals")       List<PerformanceGoal> goals,
    @JsonProperty("forecast")    WeeklyForecast forecast,
    @JsonProperty("preferences") UserPreferences preferences
) {
    public static SuggestionRequest of(List<ActivityRecord> history, LocalDate targetDate,
                                       List<PerformanceGoal> goals, WeeklyForecast forecast) {
        return new SuggestionRequest(history, List.of(), targetDate, goals, forecast, null);
    }

    public SuggestionRequest withPreferences(UserPreferences prefs) {
        return new SuggestionRequest(history, planned, targetDate, goals, forecast, prefs);
    }
}
