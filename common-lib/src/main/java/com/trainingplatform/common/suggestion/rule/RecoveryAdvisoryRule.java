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
 * Advises recovery when the week's forecast exceeds 110% of the trailing
 * four-week average. Sparse baselines (≤ {@value #MIN_BASELINE_KM} km/week)
 * are ignored. Emits a rest day plus a concrete 30-minute recovery jog.
 */
public final class RecoveryAdvisoryRule implements SuggestionRule {

    static final double MIN_BASELINE_KM = 10.0;
    static final double LOAD_RATIO = 1.10;
    static final int JOG_MINUTES = 30;
    /** Recovery jogs run this much slower than the easy pace. */
    static final double JOG_PACE_FACTOR = 1.2;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        double average = ctx.trailingAverageKm();
        double forecastKm = ctx.forecast().runningKm();
        if (average <= MIN_BASELINE_KM || forecastKm <= average * LOAD_RATIO) return List.of();

        TrainingSuggestion rest = Suggestions.create(ctx.targetDate(), SuggestionSource.RECOVERY_ADVISORY,
            SuggestionType.REST,
            "Recovery day",
            String.format(Locale.ROOT, "High weekly volume (%.1f km vs %.1f km average).", forecastKm, average),
            "Lower injury risk with rest or easy cross-training.",
            null, null, Intensity.LOW);

        double jogKm = SuggestionContext.round1(JOG_MINUTES / (ctx.easyPace() * JOG_PACE_FACTOR));
        TrainingSuggestion jog = Suggestions.create(ctx.targetDate(), SuggestionSource.RECOVERY_JOG,
            SuggestionType.RUN,
            "Recovery jog",
            JOG_MINUTES + " min very easy jog (zone 1-2).",
            "Active recovery keeps blood flowing without adding load.",
            JOG_MINUTES, jogKm, Intensity.LOW);

        return List.of(rest, jog);
    }
}
