package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A user goal with one or more targets and an optional validity period.
 */
public record PerformanceGoal(
    @JsonProperty("id")         String id,
    @JsonProperty("name")       String name,
    @JsonProperty("status")     GoalStatus status,
    @JsonProperty("targets")    List<GoalTarget> targets,
    @JsonProperty("validFrom")  LocalDate validFrom,
    @JsonProperty("validUntil") LocalDate validUntil
) {
    /** Active status and, when a period is set, {@code date} inside it (inclusive). */
    public boolean isActiveOn(LocalDate date) {
        if (status != GoalStatus.ACTIVE) return false;
        if (date == null) return true;
        if (validFrom != null && date.isBefore(validFrom)) return false;
        return validUntil == null || !date.isAfter(validUntil);
    }

    public Optional<Double> distanceTargetKm() {
        if (targets == null) return Optional.empty();
        return targets.stream()
            .filter(t -> t != null && t.isDistance())
            .map(GoalTarget::value)
            .findFirst();
    }

    /**
     * Weekly session target for a strength-frequency goal. The goal name must
     * mention strength ({@code "strength"} or the Swedish {@code "styrka"}).
     */
    public Optional<Double> strengthSessionTarget() {
        String n = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (!n.contains("strength") && !n.contains("styrka")) return Optional.empty();
        if (targets == null) return Optional.empty();
        return targets.stream()
            .filter(t -> t != null && t.isSessionCount())
            .map(GoalTarget::value)
            .findFirst();
    }
}
