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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Reminds about the long run when none at or above the threshold has been
 * logged for a week. Fires on weekends, or any day once the gap passes two
 * weeks. A user who has never run that far counts as an unbounded gap.
 */
public final class LongRunReminderRule implements SuggestionRule {

    static final long MIN_GAP_DAYS = 7;
    static final long OVERDUE_GAP_DAYS = 14;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (!ctx.hasRunningHistory()) return List.of();

        double threshold = ctx.longRunThresholdKm();
        LocalDate lastLong = ctx.history().stream()
            .filter(ActivityRecord::isRunning)
            .filter(a -> a.distanceOrZero() >= threshold)
            .map(ActivityRecord::date)
            .reduce((a, b) -> b)
            .orElse(null);

        long gap = lastLong == null ? Long.MAX_VALUE : ChronoUnit.DAYS.between(lastLong, ctx.targetDate());
        if (gap < MIN_GAP_DAYS) return List.of();
        if (!ctx.isWeekend() && gap <= OVERDUE_GAP_DAYS) return List.of();

        double km = SuggestionContext.round1(threshold);
        String reason = lastLong == null
            ? String.format(Locale.ROOT, "No run of %.1f km or more in your history yet.", threshold)
            : String.format(Locale.ROOT, "%d days since your last run of %.1f km or more.", gap, threshold);
        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.LONG_RUN, SuggestionType.RUN,
            "Long run",
            String.format(Locale.ROOT, "%.1f km at easy pace", km),
            reason,
            SuggestionContext.minutesFor(km, ctx.easyPace()), km, Intensity.MODERATE));
    }
}
