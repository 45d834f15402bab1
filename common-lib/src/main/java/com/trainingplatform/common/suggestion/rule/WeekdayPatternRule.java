package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.suggestion.SuggestionContext;
import com.trainingplatform.common.suggestion.SuggestionRule;
import com.trainingplatform.common.suggestion.SuggestionSet;
import com.trainingplatform.common.suggestion.Suggestions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Repeats what the user habitually does on this weekday.
 *
 * <p>The most common activity type on the target's weekday (ties resolved by
 * first occurrence) is suggested when it is running or strength, using the
 * average duration (nearest 5 min) and average distance (nearest 0.1 km) of
 * those past sessions.
 */
public final class WeekdayPatternRule implements SuggestionRule {

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        List<ActivityRecord> sameWeekday = ctx.history().stream()
            .filter(a -> a.date().isBefore(ctx.targetDate()))
            .filter(a -> a.date().getDayOfWeek() == ctx.dayOfWeek())
            .toList();
        if (sameWeekday.isEmpty()) return List.of();

        Map<ActivityType, Integer> counts = new LinkedHashMap<>();
        sameWeekday.forEach(a -> counts.merge(a.type(), 1, Integer::sum));

        ActivityType top = null;
        int best = 0;
        for (Map.Entry<ActivityType, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                top = e.getKey();
                best = e.getValue();
            }
        }

        SuggestionType type;
        if (top == ActivityType.RUNNING) type = SuggestionType.RUN;
        else if (top == ActivityType.STRENGTH) type = SuggestionType.STRENGTH;
        else return List.of();

        final ActivityType matched = top;
        List<ActivityRecord> sessions = sameWeekday.stream().filter(a -> a.type() == matched).toList();

        double avgMinutes = sessions.stream().mapToDouble(ActivityRecord::durationMinutes).average().orElse(0);
        int minutes = (int) (Math.round(avgMinutes / 5.0) * 5);

        Double km = null;
        List<ActivityRecord> withDistance = sessions.stream().filter(ActivityRecord::hasDistance).toList();
        if (!withDistance.isEmpty()) {
            km = SuggestionContext.round1(
                withDistance.stream().mapToDouble(ActivityRecord::distanceOrZero).average().orElse(0));
        }

        String day = ctx.dayOfWeek().name().charAt(0)
            + ctx.dayOfWeek().name().substring(1).toLowerCase(Locale.ROOT);
        String what = type == SuggestionType.RUN ? "run" : "strength";
        String description = km != null
            ? String.format(Locale.ROOT, "%d min %s, about %.1f km", minutes, what, km)
            : String.format(Locale.ROOT, "%d min %s", minutes, what);

        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.WEEKDAY_PATTERN, type,
            day + " " + what,
            description,
            String.format(Locale.ROOT, "You usually do %s on %ss (%d of %d sessions).",
                what, day, best, sameWeekday.size()),
            minutes > 0 ? minutes : null, km, Intensity.MODERATE));
    }
}
