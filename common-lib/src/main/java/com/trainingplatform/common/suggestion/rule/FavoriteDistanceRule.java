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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Surfaces distances the user keeps coming back to. Runs from the last
 * 30 days are bucketed to the nearest 0.5 km; the two most frequent buckets
 * seen at least twice, and not already covered by another suggestion,
 * are proposed.
 */
public final class FavoriteDistanceRule implements SuggestionRule {

    static final int LOOKBACK_DAYS = 30;
    static final int MIN_OCCURRENCES = 2;
    static final int MAX_FAVORITES = 2;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        Map<Double, List<ActivityRecord>> buckets = new TreeMap<>();
        for (ActivityRecord run : ctx.runsInLastDays(LOOKBACK_DAYS)) {
            if (!run.hasDistance()) continue;
            buckets.computeIfAbsent(bucketOf(run.distanceKm()), k -> new ArrayList<>()).add(run);
        }

        List<Map.Entry<Double, List<ActivityRecord>>> ranked = buckets.entrySet().stream()
            .filter(e -> e.getValue().size() >= MIN_OCCURRENCES)
            .sorted(Comparator.<Map.Entry<Double, List<ActivityRecord>>>comparingInt(e -> e.getValue().size())
                .reversed()
                .thenComparing(Map.Entry::getKey))
            .toList();

        List<TrainingSuggestion> out = new ArrayList<>();
        for (Map.Entry<Double, List<ActivityRecord>> e : ranked) {
            if (out.size() == MAX_FAVORITES) break;
            double km = e.getKey();
            if (km <= 0 || accepted.coversDistance(km)) continue;

            double pace = e.getValue().stream()
                .mapToDouble(ActivityRecord::paceMinPerKm)
                .filter(p -> p > 0)
                .average()
                .orElse(ctx.easyPace());
            String qualifier = String.format(Locale.ROOT, "%.1f", km);
            out.add(Suggestions.create(ctx.targetDate(), SuggestionSource.FAVORITE_DISTANCE, qualifier,
                SuggestionType.RUN,
                String.format(Locale.ROOT, "Favorite %s km", qualifier),
                String.format(Locale.ROOT, "%s km at your usual pace", qualifier),
                String.format(Locale.ROOT, "You ran about %s km %d times in the last %d days.",
                    qualifier, e.getValue().size(), LOOKBACK_DAYS),
                SuggestionContext.minutesFor(km, pace), km, Intensity.MODERATE));
        }
        return out;
    }

    static double bucketOf(double km) {
        return Math.round(km * 2.0) / 2.0;
    }
}
