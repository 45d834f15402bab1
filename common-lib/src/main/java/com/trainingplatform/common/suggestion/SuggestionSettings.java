package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.UserPreferences;

/**
 * Engine-wide knobs.
 *
 * @param defaultLongRunThresholdKm long-run threshold when preferences carry none
 * @param similarityToleranceKm     two same-modality suggestions closer than this are duplicates
 * @param challengeEnabled          include the legacy random challenge rule
 */
public record SuggestionSettings(
    double  defaultLongRunThresholdKm,
    double  similarityToleranceKm,
    boolean challengeEnabled
) {
    public static final double DEFAULT_SIMILARITY_TOLERANCE_KM = 1.0;

    public static final SuggestionSettings DEFAULTS = new SuggestionSettings(
        UserPreferences.DEFAULT_LONG_RUN_THRESHOLD_KM, DEFAULT_SIMILARITY_TOLERANCE_KM, false);
}
