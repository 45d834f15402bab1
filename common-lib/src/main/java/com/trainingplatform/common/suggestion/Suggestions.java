package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;

import java.time.LocalDate;

/**
 * Builds suggestions with deterministic ids of the form
 * {@code sugg-<targetDate>-<source>[-<qualifier>]}, so identical inputs
 * always produce identical output.
 */
public final class Suggestions {

    private Suggestions() {}

    public static TrainingSuggestion create(LocalDate targetDate, SuggestionSource source,
                                            SuggestionType type, String label,
                                            String description, String reason,
                                            Integer durationMinutes, Double distanceKm,
                                            Intensity intensity) {
        return create(targetDate, source, null, type, label, description, reason,
                      durationMinutes, distanceKm, intensity);
    }

    public static TrainingSuggestion create(LocalDate targetDate, SuggestionSource source,
                                            String qualifier, SuggestionType type, String label,
                                            String description, String reason,
                                            Integer durationMinutes, Double distanceKm,
                                            Intensity intensity) {
        return new TrainingSuggestion(id(targetDate, source, qualifier), type, source, label,
            description, reason, durationMinutes, distanceKm, intensity);
    }

    static String id(LocalDate targetDate, SuggestionSource source, String qualifier) {
        String base = "sugg-" + targetDate + "-" + source.slug();
        return qualifier == null ? base : base + "-" + qualifier;
    }
}
