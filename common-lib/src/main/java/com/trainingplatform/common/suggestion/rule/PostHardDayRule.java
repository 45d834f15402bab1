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

/**
 * Looks at yesterday. After a hard or long session it proposes an easy
 * recovery run; after a rest day, and only if nothing else has been
 * suggested yet, a default 45-minute easy run.
 */
public final class PostHardDayRule implements SuggestionRule {

    static final double LONG_SESSION_MINUTES = 90.0;
    static final int RECOVERY_MINUTES = 30;
    static final int DEFAULT_MINUTES = 45;
    static final double RECOVERY_PACE_FACTOR = 1.1;

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (!ctx.hasHistory()) return List.of();

        List<ActivityRecord> yesterday = ctx.activitiesOn(ctx.targetDate().minusDays(1));
        boolean wasHard = yesterday.stream().anyMatch(a ->
            (a.intensity() != null && a.intensity().isHard()) || a.durationMinutes() > LONG_SESSION_MINUTES);

        if (wasHard) {
            if (accepted.has(SuggestionType.RUN, Intensity.LOW)) return List.of();
            double km = SuggestionContext.round1(RECOVERY_MINUTES / (ctx.easyPace() * RECOVERY_PACE_FACTOR));
            return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.POST_HARD_DAY, SuggestionType.RUN,
                "Easy recovery run",
                RECOVERY_MINUTES + " min easy, conversational pace",
                "Yesterday was a hard session. Keep today light.",
                RECOVERY_MINUTES, km, Intensity.LOW));
        }

        if (yesterday.isEmpty() && accepted.isEmpty()) {
            double km = SuggestionContext.round1(DEFAULT_MINUTES / ctx.easyPace());
            return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.DEFAULT_EASY, SuggestionType.RUN,
                "Easy run",
                DEFAULT_MINUTES + " min easy run",
                "You rested yesterday. A steady easy run keeps the routine going.",
                DEFAULT_MINUTES, km, Intensity.LOW));
        }
        return List.of();
    }
}
