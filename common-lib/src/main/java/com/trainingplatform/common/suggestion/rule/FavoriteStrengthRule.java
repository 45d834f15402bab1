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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suggests the strength workout the user logs most often, by title, when no
 * strength suggestion is present yet. Ties go to the title seen first.
 */
public final class FavoriteStrengthRule implements SuggestionRule {

    static final int MIN_OCCURRENCES = 2;
    static final int DEFAULT_MINUTES = 45;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (accepted.hasType(SuggestionType.STRENGTH)) return List.of();

        Map<String, List<ActivityRecord>> byTitle = new LinkedHashMap<>();
        for (ActivityRecord a : ctx.history()) {
            if (a.type() != ActivityType.STRENGTH || a.title() == null || a.title().isBlank()) continue;
            byTitle.computeIfAbsent(a.title().trim(), k -> new ArrayList<>()).add(a);
        }

        String favorite = null;
        int best = 0;
        for (Map.Entry<String, List<ActivityRecord>> e : byTitle.entrySet()) {
            if (e.getValue().size() > best) {
                favorite = e.getKey();
                best = e.getValue().size();
            }
        }
        if (favorite == null || best < MIN_OCCURRENCES) return List.of();

        double avg = byTitle.get(favorite).stream()
            .mapToDouble(ActivityRecord::durationMinutes)
            .filter(m -> m > 0)
            .average()
            .orElse(DEFAULT_MINUTES);
        int minutes = (int) (Math.round(avg / 5.0) * 5);
        if (minutes <= 0) minutes = DEFAULT_MINUTES;

        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.FAVORITE_STRENGTH, SuggestionType.STRENGTH,
            favorite,
            minutes + " min " + favorite,
            "Your most frequent strength session (" + best + " times).",
            minutes, null, Intensity.MODERATE));
    }
}
