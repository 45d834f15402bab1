package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A calendar entry from the planning UI. Read-only to the engine.
 *
 * <p>{@code completedActivityId} links a completed plan to the logged
 * {@link ActivityRecord} that fulfilled it; {@code actualDistanceKm} is the
 * distance that activity covered.
 */
public record PlannedActivity(
    @JsonProperty("id")                  String id,
    @JsonProperty("date")                LocalDate date,
    @JsonProperty("category")            PlannedCategory category,
    @JsonProperty("status")              PlanStatus status,
    @JsonProperty("title")               String title,
    @JsonProperty("estimatedDistanceKm") Double estimatedDistanceKm,
    @JsonProperty("targetHeartRateZone") String targetHeartRateZone,
    @JsonProperty("race")                boolean race,
    @JsonProperty("actualDistanceKm")    Double actualDistanceKm,
    @JsonProperty("completedActivityId") String completedActivityId
) {
    public static PlannedActivity planned(String id, LocalDate date, PlannedCategory category,
                                          String title, Double estimatedDistanceKm) {
        return new PlannedActivity(id, date, category, PlanStatus.PLANNED, title,
            estimatedDistanceKm, null, false, null, null);
    }

    public PlannedActivity completedBy(String activityId, Double actualKm) {
        return new PlannedActivity(id, date, category, PlanStatus.COMPLETED, title,
            estimatedDistanceKm, targetHeartRateZone, race, actualKm, activityId);
    }

    public PlannedActivity withStatus(PlanStatus newStatus) {
        return new PlannedActivity(id, date, category, newStatus, title,
            estimatedDistanceKm, targetHeartRateZone, race, actualDistanceKm, completedActivityId);
    }

    public boolean isStillPlanned() {
        return status == PlanStatus.PLANNED;
    }

    public double estimatedDistanceOrZero() {
        return estimatedDistanceKm != null && Double.isFinite(estimatedDistanceKm)
            ? Math.max(0.0, estimatedDistanceKm) : 0.0;
    }
}
