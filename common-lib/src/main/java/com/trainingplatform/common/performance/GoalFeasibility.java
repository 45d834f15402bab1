package com.trainingplatform.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Likelihood of closing a fitness-score gap in the time left.
 *
 * @param probability             0.0–1.0
 * @param gap                     target minus current score, never negative
 * @param neededWeeklyImprovement score points required per week
 */
public record GoalFeasibility(
    @JsonProperty("probability")             double probability,
    @JsonProperty("gap")                     double gap,
    @JsonProperty("neededWeeklyImprovement") double neededWeeklyImprovement
) {
    static final GoalFeasibility ALREADY_REACHED = new GoalFeasibility(1.0, 0.0, 0.0);
}
