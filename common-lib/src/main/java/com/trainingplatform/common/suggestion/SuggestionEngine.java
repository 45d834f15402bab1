package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.exception.TrainingEngineException;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.suggestion.rule.ChallengeRule;
import com.trainingplatform.common.suggestion.rule.FavoriteDistanceRule;
import com.trainingplatform.common.suggestion.rule.FavoriteStrengthRule;
import com.trainingplatform.common.suggestion.rule.GoalGapRule;
import com.trainingplatform.common.suggestion.rule.LoadSafetyRule;
import com.trainingplatform.common.suggestion.rule.LongRunReminderRule;
import com.trainingplatform.common.suggestion.rule.PostHardDayRule;
import com.trainingplatform.common.suggestion.rule.ProgressiveOverloadRule;
import com.trainingplatform.common.suggestion.rule.QualitySessionRule;
import com.trainingplatform.common.suggestion.rule.RecoveryAdvisoryRule;
import com.trainingplatform.common.suggestion.rule.StrengthFrequencyRule;
import com.trainingplatform.common.suggestion.rule.WeekdayPatternRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Runs every {@link SuggestionRule} in a fixed order against one request,
 * collects what they propose into a {@link SuggestionSet} and ranks the result.
 *
 * <p>With the default rule list the output is a pure function of the request:
 * identical requests yield identical reports. The random challenge rule is only
 * installed when {@link SuggestionSettings#challengeEnabled()} is set, and its
 * presence is reported in {@link SuggestionReport#diagnostics()}.
 *
 * <p>Stateless after construction; safe to share across threads.
 */
public final class SuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(SuggestionEngine.class);

    static final String COMPONENT = "SuggestionEngine";
    static final String NON_DETERMINISTIC_DIAGNOSTIC =
        "challenge rule enabled: output includes a randomly drawn suggestion and is not deterministic";

    private final SuggestionSettings settings;
    private final List<SuggestionRule> rules;

    public SuggestionEngine() {
        this(SuggestionSettings.DEFAULTS, threadLocalRandom());
    }

    /**
     * @param random drawn from by the challenge rule on every call; must be safe
     *               for concurrent use when the engine is shared across threads
     */
    public SuggestionEngine(SuggestionSettings settings, RandomGenerator random) {
        this(settings, defaultRules(settings, random));
    }

    SuggestionEngine(SuggestionSettings settings, List<SuggestionRule> rules) {
        this.settings = settings == null ? SuggestionSettings.DEFAULTS : settings;
        this.rules = List.copyOf(rules);
        if (this.settings.challengeEnabled()) {
            log.warn("Challenge suggestions enabled; suggestion output is non-deterministic");
        }
    }

    /** Draws from the calling thread's {@link ThreadLocalRandom}. */
    public static RandomGenerator threadLocalRandom() {
        return () -> ThreadLocalRandom.current().nextLong();
    }

    /** Emission order of the built-in rules. */
    public static List<SuggestionRule> defaultRules(SuggestionSettings settings, RandomGenerator random) {
        List<SuggestionRule> rules = new ArrayList<>(List.of(
            new GoalGapRule(),
            new RecoveryAdvisoryRule(),
            new LoadSafetyRule(),
            new StrengthFrequencyRule(),
            new WeekdayPatternRule(),
            new PostHardDayRule(),
            new ProgressiveOverloadRule(),
            new LongRunReminderRule(),
            new QualitySessionRule(),
            new FavoriteDistanceRule(),
            new FavoriteStrengthRule()));
        if (settings != null && settings.challengeEnabled()) {
            rules.add(new ChallengeRule(random));
        }
        return rules;
    }

    public SuggestionReport generate(SuggestionRequest request) {
        if (request == null || request.targetDate() == null) {
            throw TrainingEngineException.missing(COMPONENT, "generate", "targetDate");
        }
        SuggestionContext ctx = SuggestionContext.of(request, settings);
        SuggestionSet accepted = new SuggestionSet(ctx.similarityToleranceKm(), ctx.preferences());

        for (SuggestionRule rule : rules) {
            for (TrainingSuggestion candidate : rule.propose(ctx, accepted)) {
                boolean added = accepted.offer(candidate);
                if (!added) {
                    log.debug("Dropped suggestion id={} rule={}", candidate.id(), rule.getClass().getSimpleName());
                }
            }
        }

        List<TrainingSuggestion> ranked = SuggestionRanking.rank(accepted.asList());
        log.debug("Generated suggestions targetDate={} historySize={} count={}",
            ctx.targetDate(), ctx.history().size(), ranked.size());

        List<String> diagnostics = settings.challengeEnabled()
            ? List.of(NON_DETERMINISTIC_DIAGNOSTIC)
            : List.of();
        return new SuggestionReport(ranked, diagnostics);
    }
}
