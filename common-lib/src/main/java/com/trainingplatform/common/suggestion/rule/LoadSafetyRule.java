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

/**
 * Warns when the forecast exceeds 150% of last completed week's running
 * volume (itself above {@value #MIN_LAST_WEEK_KM} km). Ranked ahead of
 * every other suggestion.
 */
public final class LoadSafetyRule implements SuggestionRule {

    static final double MIN_LAST_WEEK_KM = 10.0;
    static final double SPIKE_RATIO = 1.5;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        double lastWeek = ctx.lastWeekKm();
        double forecastKm = ctx.forecast().runningKm();
        if (lastWeek <= MIN_LAST_WEEK_KM || forecastKm <= lastWeek * SPIKE_RATIO) return List.of();

        double increasePct = (forecastKm - lastWeek) / lastWeek * 100.0;
        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.LOAD_SAFETY, SuggestionType.REST,
            "Load warning",
            String.format(Locale.ROOT, "This week's running is forecast at %.1f km, up %.0f%% on last week (%.1f km).",
                forecastKm, increasePct, lastWeek),
            "Week-over-week jumps above 50% sharply raise injury risk. Trim or soften planned sessions.",
            null, null, Intensity.LOW));
    }
}
