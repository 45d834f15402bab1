package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.load.WeekWindow;
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
import java.util.Optional;

/**
 * Pushes a strength session when the sessions still required by an active
 * strength-frequency goal are at least the days left in the week (today
 * included).
 */
public final class StrengthFrequencyRule implements SuggestionRule {

    static final int SESSION_MINUTES = 50;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (accepted.hasType(SuggestionType.STRENGTH)) return List.of();

        Optional<Double> target = ctx.goals().stream()
            .filter(g -> g.isActiveOn(ctx.targetDate()))
            .map(PerformanceGoal::strengthSessionTarget)
            .flatMap(Optional::stream)
            .findFirst();
        if (target.isEmpty()) return List.of();

        int required = (int) Math.ceil(target.get());
        int remaining = Math.max(0, required - ctx.forecast().strengthSessions());
        int daysLeft = WeekWindow.daysLeftIncluding(ctx.targetDate());
        if (remaining == 0 || remaining < daysLeft) return List.of();

        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.STRENGTH_FREQUENCY,
            SuggestionType.STRENGTH,
            "Strength goal",
            "45-60 min strength",
            remaining + (remaining == 1 ? " session" : " sessions")
                + " left to reach the weekly strength goal with " + daysLeft
                + (daysLeft == 1 ? " day" : " days") + " to go.",
            SESSION_MINUTES, null, Intensity.HIGH));
    }
}
