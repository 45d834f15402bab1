package com.trainingplatform.common.model;

/**
 * The rule that produced a {@link TrainingSuggestion} together with its
 * ranking tier. Lower tiers sort first; equal tiers keep emission order.
 *
 * <pre>
 *   tier 0  load-safety warning
 *   tier 1  goal-critical (goal gap, strength frequency)
 *   tier 2  weekday pattern
 *   tier 3  everything else
 * </pre>
 */
public enum SuggestionSource {
    GOAL_GAP("goal-gap", 1),
    RECOVERY_ADVISORY("recovery-advisory", 3),
    RECOVERY_JOG("recovery-jog", 3),
    LOAD_SAFETY("load-safety", 0),
    STRENGTH_FREQUENCY("strength-frequency", 1),
    WEEKDAY_PATTERN("weekday-pattern", 2),
    POST_HARD_DAY("post-hard-day", 3),
    DEFAULT_EASY("default-easy", 3),
    PROGRESSIVE_OVERLOAD("progressive-overload", 3),
    LONG_RUN("long-run", 3),
    QUALITY_SESSION("quality-session", 3),
    FAVORITE_DISTANCE("favorite-distance", 3),
    FAVORITE_STRENGTH("favorite-strength", 3),
    CHALLENGE("challenge", 3);

    private final String slug;
    private final int tier;

    SuggestionSource(String slug, int tier) {
        this.slug = slug;
        this.tier = tier;
    }

    public String slug() {
        return slug;
    }

    public int tier() {
        return tier;
    }
}
