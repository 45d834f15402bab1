package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.suggestion.SuggestionContext;
import com.trainingplatform.common.suggestion.SuggestionRule;
import com.trainingplatform.common.suggestion.SuggestionSet;
import com.trainingplatform.common.suggestion.Suggestions;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fills the gap to an active weekly distance goal late in the week.
 *
 * <p>Fires when the remaining distance (target − forecast) is within
 * [{@value #MIN_GAP_KM}, {@value #MAX_GAP_KM}] km and the target date is
 * Thursday–Sunday. The run is sized to the remaining distance, capped at
 * {@value #MAX_SUGGESTED_KM} km, and timed at the estimated easy pace.
 */
public final class GoalGapRule implements SuggestionRule {

    static final double MIN_GAP_KM = 3.0;
    static final double MAX_GAP_KM = 25.0;
    static final double MAX_SUGGESTED_KM = 30.0;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (!ctx.isBackHalfOfWeek()) return List.of();

        Optional<Double> target = ctx.goals().stream()
            .filter(g -> g.isActiveOn(ctx.targetDate()))
            .map(PerformanceGoal::distanceTargetKm)
            .flatMap(Optional::stream)
            .findFirst();
        if (target.isEmpty()) return List.of();

        double forecastKm = ctx.forecast().runningKm();
        double remaining = target.get() - forecastKm;
        if (remaining < MIN_GAP_KM || remaining > MAX_GAP_KM) return List.of();

        double km = SuggestionContext.round1(Math.min(remaining, MAX_SUGGESTED_KM));
        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.GOAL_GAP, SuggestionType.RUN,
            "Close the weekly goal",
            String.format(Locale.ROOT, "%.1f km run", km),
            String.format(Locale.ROOT, "%.1f km left to reach the weekly goal (forecast %.1f / %.1f km).",
                remaining, forecastKm, target.get()),
            SuggestionContext.minutesFor(km, ctx.easyPace()), km, Intensity.MODERATE));
    }
}
