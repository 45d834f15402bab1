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
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Legacy "try something new" suggestion drawn at random, independent of the
 * input. Non-deterministic unless the generator is seeded, so the engine
 * only installs it when explicitly enabled.
 */
public final class ChallengeRule implements SuggestionRule {

    static final double PROBABILITY = 0.3;

    private static final List<Challenge> CHALLENGES = List.of(
        new Challenge("Hill repeats", "6 x 200 m uphill, jog down", SuggestionType.RUN, 40),
        new Challenge("Hyrox simulation", "Run 1 km + one station, repeat 4 times", SuggestionType.HYROX, 60),
        new Challenge("Bike endurance", "60 min steady ride", SuggestionType.BIKE, 60),
        new Challenge("Fartlek", "30 min with free-form surges", SuggestionType.RUN, 30));

    private final RandomGenerator random;

    public ChallengeRule(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public List<TrainingSuggestion> propose(SuggestionContext ctx, SuggestionSet accepted) {
        if (random.nextDouble() >= PROBABILITY) return List.of();
        Challenge c = CHALLENGES.get(random.nextInt(CHALLENGES.size()));
        return List.of(Suggestions.create(ctx.targetDate(), SuggestionSource.CHALLENGE, c.type(),
            c.label(), c.description(), "Something different to break the routine.",
            c.minutes(), null, Intensity.MODERATE));
    }

    private record Challenge(String label, String description, SuggestionType type, int minutes) {}
}
