package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.suggestion.SuggestionContext;
import com.trainingplatform.common.suggestion.SuggestionRule;
import com.trainingplatform.common.suggestion.SuggestionSet;
import com.trainingplatform.common.suggestion.Suggestions;

import java.util.List;
import java.util.Locale;

/** Suggests the distance still missing to grow 5% on last week. */
public final class ProgressiveOverloadRule implements SuggestionRule {

    static final double MIN_LAST_WEEK_KM = 5.0;
    static final double GROWTH = 1.05;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        double lastWeek = ctx.lastWeekKm();
        double forecastKm = ctx.forecast().runningKm();
        double target = lastWeek * GROWTH;
        if (lastWeek <= MIN_LAST_WEEK_KM || forecastKm >= target) return List.of();

        double km = SuggestionContext.round1(target - forecastKm);
        if (km <= 0) return List.of();
        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.PROGRESSIVE_OVERLOAD, SuggestionType.RUN,
            "Build volume",
            String.format(Locale.ROOT, "%.1f km easy", km),
            String.format(Locale.ROOT, "%.1f km more reaches a 5%% increase on last week's %.1f km.", km, lastWeek),
            SuggestionContext.minutesFor(km, ctx.easyPace()), km, Intensity.LOW));
    }
}
