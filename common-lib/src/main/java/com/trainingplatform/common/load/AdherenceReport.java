package com.trainingplatform.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Plan adherence for one week. {@code insights} keeps insertion order:
 * overall message, per-session distance discrepancies, missed sessions, extras.
 */
public record AdherenceReport(
    @JsonProperty("adherencePercent") double adherencePercent,
    @JsonProperty("plannedCount")     int plannedCount,
    @JsonProperty("completedCount")   int completedCount,
    @JsonProperty("missedCount")      int missedCount,
    @JsonProperty("extraCount")       int extraCount,
    @JsonProperty("insights")         List<String> insights
) {}
