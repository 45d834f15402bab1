package com.trainingplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of {@code POST /api/v1/training/weekly-report}. {@code weekDate} is any
 * day of the week to report on and {@code asOf} the day used to decide which
 * planned sessions were missed; both default to today.
 */
public record WeeklyReportCommand(
    @JsonProperty("weekDate")    LocalDate weekDate,
    @JsonProperty("asOf")        LocalDate asOf,
    @JsonProperty("activities")  List<ActivityRecord> activities,
    @JsonProperty("planned")     List<PlannedActivity> planned,
    @JsonProperty("forecast")    WeeklyForecast forecast,
    @JsonProperty("preferences") UserPreferences preferences
) {}
