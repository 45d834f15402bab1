package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of {@code POST /api/v1/training/suggestions}. {@code targetDate}
 * defaults to today in the configured zone; {@code forecast} is derived when
 * absent.
 */
public record SuggestionCommand(
    @JsonProperty("history")     List<ActivityRecord> history,
    @JsonProperty("planned")     List<PlannedActivity> planned,
    @JsonProperty("targetDate")  LocalDate targetDate,
    @JsonProperty("goals")       List<PerformanceGoal> goals,
    @JsonProperty("forecast")    WeeklyForecast forecast,
    @JsonProperty("preferences") UserPreferences preferences
) {}
