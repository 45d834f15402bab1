package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.ActivityRecord;
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
 * Midweek nudge towards an interval or tempo session when the last ten days
 * held no hard run. A run counts as hard by its intensity tag or by a title
 * keyword.
 */
public final class QualitySessionRule implements SuggestionRule {

    static final int LOOKBACK_DAYS = 10;
    static final int SESSION_MINUTES = 45;
    static final double SESSION_KM = 8.0;

    private static final List<String> HARD_KEYWORDS =
        List.of("tempo", "interval", "intervall", "race", "tävling", "hårt");

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (!ctx.hasRunningHistory() || !ctx.isMidweek()) return List.of();
        if (accepted.has(SuggestionType.RUN, Intensity.HIGH)) return List.of();
        if (ctx.runsInLastDays(LOOKBACK_DAYS).stream().anyMatch(QualitySessionRule::isHardRun)) return List.of();

        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.QUALITY_SESSION, SuggestionType.RUN,
            "Quality session",
            "Intervals or tempo, e.g. 5 x 1 km at threshold pace",
            "No hard run in the last " + LOOKBACK_DAYS + " days. Some speed work keeps you sharp.",
            SESSION_MINUTES, SESSION_KM, Intensity.HIGH));
    }

    static boolean isHardRun(ActivityRecord run) {
        if (run.intensity() != null && run.intensity().isHard()) return true;
        if (run.title() == null) return false;
        String title = run.title().toLowerCase(Locale.ROOT);
        return HARD_KEYWORDS.stream().anyMatch(title::contains);
    }
}
